/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.compiler.lexer;

import com.savigny.transpiler.api.model.ComplianceType;
import com.savigny.transpiler.api.model.DeonticOperator;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Noise-tolerant scanner for schema sources.
 *
 * <p>Reads the source line by line and yields classified tokens lazily. Filler
 * words are dropped before classification, and the stream always ends with a
 * single {@link TokenKind#END} token. The sequence cannot be restarted.
 *
 * <h2>Classification order</h2>
 * First match wins: quoted literal, institution marker, integer, norm
 * reference, deontic keywords, conditional, conjunction, violation, then,
 * fact, evidence, agenda markers, scope, institution type, multiplicity,
 * legal domain, role, capitalized name, plain string.
 */
public final class LexicalScanner implements Iterator<Token> {

    private static final Logger logger = Logger.getLogger(LexicalScanner.class.getName());

    private static final Set<String> ROLE_NOUNS = Set.of(
        "comprador", "vendedor", "arrendador", "arrendatario", "acreedor", "deudor",
        "juez", "quejoso", "autoridad", "trabajador", "empleador", "parte1", "parte2"
    );

    private static final List<String> INSTITUTION_TYPES = List.of(
        "contrato", "procedimiento", "acto-juridico", "hecho-juridico", "acto", "hecho"
    );

    private static final List<String> MULTIPLICITIES = List.of(
        "múltiples", "multiples", "multiple", "una", "single"
    );

    private final BufferedReader reader;
    private String line;
    private int lineNumber;
    private int position;
    private boolean endReached;
    private boolean endReturned;
    private String lastText;
    private int tokenLine;
    private int tokenColumn;

    public LexicalScanner(Reader source) {
        this.reader = source instanceof BufferedReader br ? br : new BufferedReader(source);
    }

    public LexicalScanner(String source) {
        this(new StringReader(source));
    }

    @Override
    public boolean hasNext() {
        return !endReturned;
    }

    @Override
    public Token next() {
        if (endReturned) {
            throw new NoSuchElementException("Scanner already reached the end of input");
        }
        return nextToken();
    }

    /**
     * Returns the raw text of the most recently returned token, or {@code null}
     * before the first token.
     */
    public String lastText() {
        return lastText;
    }

    public int line() {
        return tokenLine;
    }

    public int column() {
        return tokenColumn;
    }

    private Token nextToken() {
        while (true) {
            if (!skipSeparators()) {
                endReturned = true;
                lastText = "";
                return new Token(TokenKind.END, "", null, lineNumber, position + 1);
            }
            tokenLine = lineNumber;
            tokenColumn = position + 1;

            if (line.charAt(position) == '"') {
                String literal = readQuoted();
                lastText = literal;
                return new Token(TokenKind.STRING, literal, literal, tokenLine, tokenColumn);
            }

            String word = readWord();
            if (NoiseWords.isNoise(word)) {
                logger.finest("Skipping noise word: " + word);
                continue;
            }
            lastText = word;
            return classify(word, tokenLine, tokenColumn);
        }
    }

    /**
     * Advances past separators, reading further lines as needed.
     *
     * @return false once the input is exhausted
     */
    private boolean skipSeparators() {
        while (!endReached) {
            if (line == null || position >= line.length()) {
                if (!readLine()) {
                    endReached = true;
                    return false;
                }
                continue;
            }
            if (isSeparator(line.charAt(position))) {
                position++;
            } else {
                return true;
            }
        }
        return false;
    }

    private boolean readLine() {
        try {
            line = reader.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read schema source at line " + (lineNumber + 1), e);
        }
        if (line == null) {
            return false;
        }
        lineNumber++;
        position = 0;
        return true;
    }

    private String readWord() {
        int start = position;
        while (position < line.length() && !isSeparator(line.charAt(position))) {
            position++;
        }
        return line.substring(start, position);
    }

    // A literal runs to the closing quote or to the end of its line.
    private String readQuoted() {
        int start = ++position;
        while (position < line.length() && line.charAt(position) != '"') {
            position++;
        }
        String literal = line.substring(start, position);
        if (position < line.length()) {
            position++;
        }
        return literal;
    }

    static boolean isSeparator(char c) {
        return Character.isWhitespace(c) || c == '.' || c == ',' || c == ':' || c == ';' || c == '[' || c == ']';
    }

    /**
     * Classifies a single unquoted, non-noise word.
     */
    static Token classify(String word, int line, int column) {
        if (is(word, "institution") || is(word, "[institution]")) {
            return token(TokenKind.INSTITUTION, word, null, line, column);
        }
        Integer number = parseNumber(word);
        if (number != null) {
            return token(TokenKind.NUMBER, word, number, line, column);
        }
        if (is(word, "regla")) {
            return token(TokenKind.NORM_REFERENCE, word, null, line, column);
        }
        if (is(word, "debe")) {
            return token(TokenKind.OBLIGATION, word, DeonticOperator.OBLIGATION, line, column);
        }
        if (is(word, "no-debe")) {
            return token(TokenKind.PROHIBITION, word, DeonticOperator.PROHIBITION, line, column);
        }
        if (is(word, "puede")) {
            return token(TokenKind.PRIVILEGE, word, DeonticOperator.PRIVILEGE, line, column);
        }
        if (is(word, "tiene-derecho-a")) {
            return token(TokenKind.CLAIM_RIGHT, word, DeonticOperator.CLAIM_RIGHT, line, column);
        }
        if (is(word, "en-caso-que")) {
            return token(TokenKind.CONDITIONAL, word, null, line, column);
        }
        if (is(word, "y")) {
            return token(TokenKind.CONJUNCTION, word, null, line, column);
        }
        if (is(word, "violación") || startsWith(word, "violacion")) {
            return token(TokenKind.VIOLATION, word, null, line, column);
        }
        if (is(word, "entonces")) {
            return token(TokenKind.THEN, word, null, line, column);
        }
        if (is(word, "hecho") || startsWith(word, "hecho-juridico")) {
            return token(TokenKind.FACT, word, null, line, column);
        }
        if (is(word, "evidencia")) {
            return token(TokenKind.EVIDENCE, word, null, line, column);
        }
        if (is(word, "busca")) {
            return token(TokenKind.SEEK, word, null, line, column);
        }
        if (is(word, "establezca")) {
            return token(TokenKind.ESTABLISH, word, null, line, column);
        }
        if (is(word, "cumplimiento")) {
            return token(TokenKind.FULFILLED, word, ComplianceType.FULFILLED, line, column);
        }
        if (is(word, "incumplimiento")) {
            return token(TokenKind.BREACHED, word, ComplianceType.BREACHED, line, column);
        }
        if (is(word, "adjudique")) {
            return token(TokenKind.ADJUDICATE, word, null, line, column);
        }
        if (startsWith(word, "lo-esencial") || is(word, "esencial")) {
            return token(TokenKind.ESSENTIAL, word, null, line, column);
        }
        if (startsWith(word, "lo-siguiente") || is(word, "siguiente")) {
            return token(TokenKind.FOLLOWING, word, null, line, column);
        }
        if (startsWith(word, "actua")) {
            return token(TokenKind.SCOPE, word, null, line, column);
        }
        for (String type : INSTITUTION_TYPES) {
            if (is(word, type)) {
                return token(TokenKind.INSTITUTION_TYPE, word, word, line, column);
            }
        }
        for (String multiplicity : MULTIPLICITIES) {
            if (is(word, multiplicity)) {
                return token(TokenKind.MULTIPLICITY, word, word, line, column);
            }
        }
        if (startsWith(word, "derecho-")) {
            return token(TokenKind.LEGAL_DOMAIN, word, word, line, column);
        }
        if (isRole(word)) {
            return token(TokenKind.ROLE, word, word, line, column);
        }
        if (Character.isUpperCase(word.charAt(0))) {
            return token(TokenKind.INSTITUTION_NAME, word, word, line, column);
        }
        return token(TokenKind.STRING, word, word, line, column);
    }

    static boolean isRole(String word) {
        return startsWith(word, "el-") || startsWith(word, "la-")
            || ROLE_NOUNS.contains(word.toLowerCase(Locale.ROOT));
    }

    // Digits with an optional trailing period; values beyond int range stay plain words.
    private static Integer parseNumber(String word) {
        int length = word.endsWith(".") ? word.length() - 1 : word.length();
        if (length == 0 || length > 9) {
            return null;
        }
        for (int i = 0; i < length; i++) {
            char c = word.charAt(i);
            if (c < '0' || c > '9') {
                return null;
            }
        }
        return Integer.parseInt(word.substring(0, length));
    }

    private static boolean is(String word, String keyword) {
        return word.equalsIgnoreCase(keyword);
    }

    private static boolean startsWith(String word, String prefix) {
        return word.regionMatches(true, 0, prefix, 0, prefix.length());
    }

    private static Token token(TokenKind kind, String text, Object value, int line, int column) {
        return new Token(kind, text, value, line, column);
    }
}
