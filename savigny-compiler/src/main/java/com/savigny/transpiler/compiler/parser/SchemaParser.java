/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.compiler.parser;

import com.savigny.transpiler.compiler.config.ConfigurationValidator;
import com.savigny.transpiler.compiler.lexer.Token;

import java.util.Iterator;

/**
 * Builds a schema from a token stream.
 *
 * <p>{@link TokenSchemaParser} is the bundled grammar. Alternative grammars
 * plug into the pipeline through
 * {@link com.savigny.transpiler.compiler.SchemaTranspiler#setSchemaParser}.
 */
public interface SchemaParser {

    /**
     * Consumes tokens up to and including {@code END}.
     *
     * @param tokens token stream ending with an {@code END} token
     * @param validator vocabulary checks; its current institution is set as a side effect
     * @return the schema and any non-fatal validation issues
     * @throws com.savigny.transpiler.api.exceptions.SchemaParseException on a syntax error
     */
    ParseResult parse(Iterator<Token> tokens, ConfigurationValidator validator);
}
