/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.compiler.parser;

import com.savigny.transpiler.api.exceptions.SchemaParseException;
import com.savigny.transpiler.api.model.Agenda;
import com.savigny.transpiler.api.model.ComplianceType;
import com.savigny.transpiler.api.model.DeonticOperator;
import com.savigny.transpiler.api.model.Institution;
import com.savigny.transpiler.api.model.LegalFact;
import com.savigny.transpiler.api.model.Norm;
import com.savigny.transpiler.api.model.NormCondition;
import com.savigny.transpiler.api.model.Schema;
import com.savigny.transpiler.api.model.Violation;
import com.savigny.transpiler.compiler.config.ConfigurationValidator;
import com.savigny.transpiler.compiler.lexer.Token;
import com.savigny.transpiler.compiler.lexer.TokenKind;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Recursive-descent builder for the schema language.
 *
 * <pre>
 * schema      := institution statement* END
 * institution := INSTITUTION name type MULTIPLICITY? LEGAL_DOMAIN?
 * statement   := norm | violation | fact | agenda
 * norm        := NUMBER ROLE deontic text (SCOPE text)? (CONDITIONAL condition (CONJUNCTION condition)*)?
 * condition   := NORM_REFERENCE NUMBER | text
 * violation   := VIOLATION NORM_REFERENCE? NUMBER (CONJUNCTION NUMBER)? THEN ROLE deontic? text
 * fact        := FACT text EVIDENCE text
 * agenda      := ROLE SEEK ESTABLISH (FULFILLED | BREACHED) INSTITUTION_TYPE? name? CONJUNCTION?
 *                ADJUDICATE ROLE (ESSENTIAL | FOLLOWING? text (CONJUNCTION text)*)?
 * </pre>
 *
 * <p>Text is a run of plain words, capitalized names and roles, joined by
 * single spaces. A run stops before anything that starts a statement. In
 * norm actions and scopes a conjunction between two words is kept as
 * {@code y}; in conditions and remedies it separates items.
 *
 * <p>The lexer classifies {@code hecho} as a fact marker, so a fact token is
 * also accepted where an institution type is expected.
 *
 * <p>Instances hold per-parse state and must not be shared between threads.
 */
public final class TokenSchemaParser implements SchemaParser {

    private static final Logger logger = Logger.getLogger(TokenSchemaParser.class.getName());

    private final List<Token> buffer = new ArrayList<>();
    private Iterator<Token> tokens;
    private ConfigurationValidator validator;
    private List<ValidationIssue> issues;
    private Schema schema;

    @Override
    public ParseResult parse(Iterator<Token> tokens, ConfigurationValidator validator) {
        this.tokens = Objects.requireNonNull(tokens, "tokens");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.buffer.clear();
        this.issues = new ArrayList<>();
        this.schema = new Schema();

        parseInstitution();
        while (peek(0).kind() != TokenKind.END) {
            parseStatement();
        }

        logger.fine(String.format("Parsed schema: %d norms, %d violations, %d facts, %d agendas, %d issues",
            schema.getNorms().size(), schema.getViolations().size(), schema.getFacts().size(),
            schema.getAgendas().size(), issues.size()));
        return new ParseResult(schema, issues);
    }

    private void parseInstitution() {
        expect(TokenKind.INSTITUTION, "Expected 'Institution' declaration");
        Token nameToken = peek(0);
        if (nameToken.kind() != TokenKind.INSTITUTION_NAME && nameToken.kind() != TokenKind.STRING) {
            throw error("Expected institution name", nameToken);
        }
        advance();
        String name = nameToken.stringValue();

        Token typeToken = peek(0);
        if (typeToken.kind() != TokenKind.INSTITUTION_TYPE && typeToken.kind() != TokenKind.FACT) {
            throw error("Expected institution type", typeToken);
        }
        advance();
        String type = typeToken.text();
        // "acto jurídico" written as two words
        Token qualifier = peek(0);
        if (qualifier.kind() == TokenKind.STRING && qualifier.text().toLowerCase(Locale.ROOT).startsWith("jur")) {
            advance();
            type = type + " " + qualifier.text();
        }

        String multiplicity = null;
        if (peek(0).kind() == TokenKind.MULTIPLICITY) {
            multiplicity = advance().stringValue();
        }
        String domain = null;
        Token domainToken = peek(0);
        if (domainToken.kind() == TokenKind.LEGAL_DOMAIN) {
            advance();
            domain = domainToken.stringValue();
        }

        if (!validator.isValidInstitution(name)) {
            report(ValidationIssue.Kind.UNKNOWN_INSTITUTION, name,
                validator.suggestInstitution(name).orElse(null), nameToken);
        }
        if (!validator.isValidType(type)) {
            report(ValidationIssue.Kind.UNKNOWN_TYPE, type, null, typeToken);
        }
        if (domain != null && !validator.isValidDomain(domain)) {
            report(ValidationIssue.Kind.UNKNOWN_DOMAIN, domain, null, domainToken);
        }

        schema.setInstitution(name, validator.mapInstitutionType(type),
            validator.mapMultiplicity(multiplicity), domain);
        validator.setCurrentInstitution(name);
    }

    private void parseStatement() {
        Token token = peek(0);
        switch (token.kind()) {
            case NUMBER -> parseNorm();
            case VIOLATION -> parseViolation();
            case FACT -> parseFact();
            case ROLE -> {
                if (peek(1).kind() != TokenKind.SEEK) {
                    throw error("Expected 'busca' after role '" + token.text() + "'", peek(1));
                }
                parseAgenda();
            }
            default -> throw error("Unexpected token '" + token.text() + "'", token);
        }
    }

    private void parseNorm() {
        Token idToken = expect(TokenKind.NUMBER, "Expected norm number");
        String role = parseRole();
        DeonticOperator deontic = parseDeontic();
        String action = parseText(true, "Expected norm action");

        Norm norm = new Norm(idToken.intValue(), role, deontic, action);
        if (peek(0).kind() == TokenKind.SCOPE) {
            advance();
            norm.setScope(parseText(true, "Expected scope after 'actua'"));
        }
        if (peek(0).kind() == TokenKind.CONDITIONAL) {
            advance();
            norm.addCondition(parseCondition());
            while (peek(0).kind() == TokenKind.CONJUNCTION) {
                advance();
                norm.addCondition(parseCondition());
            }
        }

        try {
            schema.addNorm(norm);
        } catch (IllegalArgumentException e) {
            throw new SchemaParseException(e.getMessage(), idToken.line(), idToken.column(), e);
        }
    }

    private NormCondition parseCondition() {
        if (peek(0).kind() == TokenKind.NORM_REFERENCE) {
            advance();
            Token number = expect(TokenKind.NUMBER, "Expected norm number after 'regla'");
            return NormCondition.normReference(number.intValue());
        }
        return NormCondition.text(parseText(false, "Expected condition"));
    }

    private void parseViolation() {
        expect(TokenKind.VIOLATION, "Expected violation");
        if (peek(0).kind() == TokenKind.NORM_REFERENCE) {
            advance();
        }
        int first = expect(TokenKind.NUMBER, "Expected violated norm number").intValue();
        Integer second = null;
        if (peek(0).kind() == TokenKind.CONJUNCTION) {
            advance();
            if (peek(0).kind() == TokenKind.NORM_REFERENCE) {
                advance();
            }
            second = expect(TokenKind.NUMBER, "Expected second violated norm number").intValue();
        }
        expect(TokenKind.THEN, "Expected 'entonces'");
        String role = parseRole();
        DeonticOperator deontic = peek(0).kind().isDeontic() ? advance().deonticValue() : null;
        String consequence = parseText(true, "Expected violation consequence");

        schema.addViolation(second == null
            ? Violation.single(first, role, deontic, consequence)
            : Violation.compound(first, second, role, deontic, consequence));
    }

    private void parseFact() {
        expect(TokenKind.FACT, "Expected fact");
        String description = parseText(true, "Expected fact description");
        expect(TokenKind.EVIDENCE, "Expected 'evidencia'");
        String evidence = parseText(true, "Expected evidence");
        schema.addFact(new LegalFact(description, evidence));
    }

    private void parseAgenda() {
        String requester = parseRole();
        expect(TokenKind.SEEK, "Expected 'busca'");
        // filler words between the two markers are tolerated
        while (peek(0).kind() == TokenKind.STRING) {
            advance();
        }
        expect(TokenKind.ESTABLISH, "Expected 'establezca'");

        Token complianceToken = peek(0);
        if (complianceToken.kind() != TokenKind.FULFILLED && complianceToken.kind() != TokenKind.BREACHED) {
            throw error("Expected 'cumplimiento' or 'incumplimiento'", complianceToken);
        }
        advance();
        ComplianceType compliance = complianceToken.complianceValue();

        if (peek(0).kind() == TokenKind.INSTITUTION_TYPE) {
            advance();
        }
        String institution = schema.getInstitution().map(Institution::name).orElse(null);
        if (peek(0).kind() == TokenKind.INSTITUTION_NAME) {
            institution = advance().stringValue();
        }
        if (peek(0).kind() == TokenKind.CONJUNCTION) {
            advance();
        }
        expect(TokenKind.ADJUDICATE, "Expected 'adjudique'");
        String beneficiary = parseRole();

        if (peek(0).kind() == TokenKind.ESSENTIAL) {
            advance();
            schema.addAgenda(new Agenda(requester, compliance, institution, beneficiary, true));
            return;
        }
        Agenda agenda = new Agenda(requester, compliance, institution, beneficiary, false);
        boolean following = peek(0).kind() == TokenKind.FOLLOWING;
        if (following) {
            advance();
        }
        if (following || startsText(0)) {
            agenda.addRemedy(parseText(false, "Expected remedy"));
            while (peek(0).kind() == TokenKind.CONJUNCTION && startsText(1)) {
                advance();
                agenda.addRemedy(parseText(false, "Expected remedy"));
            }
        }
        schema.addAgenda(agenda);
    }

    private String parseRole() {
        Token token = expect(TokenKind.ROLE, "Expected role");
        String role = token.stringValue();
        if (!validator.isValidRole(role)) {
            report(ValidationIssue.Kind.UNKNOWN_ROLE, role, validator.suggestRole(role).orElse(null), token);
        }
        return role;
    }

    private DeonticOperator parseDeontic() {
        Token token = peek(0);
        if (!token.kind().isDeontic()) {
            throw error("Expected deontic operator", token);
        }
        advance();
        return token.deonticValue();
    }

    /**
     * Reads a text run.
     *
     * @param keepConjunctions whether {@code y} between two words belongs to the text
     */
    private String parseText(boolean keepConjunctions, String message) {
        if (!startsText(0)) {
            throw error(message, peek(0));
        }
        StringBuilder text = new StringBuilder();
        while (true) {
            if (startsText(0)) {
                if (text.length() > 0) {
                    text.append(' ');
                }
                text.append(advance().stringValue());
            } else if (keepConjunctions && peek(0).kind() == TokenKind.CONJUNCTION && startsText(1)) {
                text.append(' ').append(advance().text());
            } else {
                return text.toString();
            }
        }
    }

    private boolean startsText(int offset) {
        Token token = peek(offset);
        return switch (token.kind()) {
            case STRING, INSTITUTION_NAME, INSTITUTION_TYPE, MULTIPLICITY -> true;
            case ROLE -> peek(offset + 1).kind() != TokenKind.SEEK;
            case NUMBER -> !(peek(offset + 1).kind() == TokenKind.ROLE && peek(offset + 2).kind().isDeontic());
            default -> false;
        };
    }

    private Token expect(TokenKind kind, String message) {
        Token token = peek(0);
        if (token.kind() != kind) {
            throw error(message, token);
        }
        return advance();
    }

    private Token peek(int offset) {
        while (buffer.size() <= offset) {
            if (!tokens.hasNext()) {
                Token last = buffer.isEmpty() ? null : buffer.get(buffer.size() - 1);
                if (last != null && last.kind() == TokenKind.END) {
                    return last;
                }
                buffer.add(new Token(TokenKind.END, "", null, 0, 0));
                continue;
            }
            buffer.add(tokens.next());
        }
        return buffer.get(offset);
    }

    private Token advance() {
        Token token = peek(0);
        if (token.kind() != TokenKind.END) {
            buffer.remove(0);
        }
        return token;
    }

    private void report(ValidationIssue.Kind kind, String value, String suggestion, Token token) {
        ValidationIssue issue = new ValidationIssue(kind, value, suggestion, token.line());
        issues.add(issue);
        logger.warning(issue.describe());
    }

    private static SchemaParseException error(String message, Token token) {
        String found = token.kind() == TokenKind.END ? "end of input" : "'" + token.text() + "'";
        return new SchemaParseException(message + ", found " + found, token.line(), token.column());
    }
}
