/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.compiler.codegen;

import java.util.Locale;

/**
 * Text sanitization and identifier derivation for Kelsen output.
 */
public final class KelsenNames {

    static final int MAX_STRING_NAME_LENGTH = 30;
    static final int MAX_FACT_ID_LENGTH = 30;
    static final int MAX_CONTEXT_VAR_LENGTH = 20;

    private KelsenNames() {
    }

    /**
     * Drops characters that break Kelsen string literals (dollar, quotes, comma,
     * semicolon, braces, percent) and turns parentheses and brackets into spaces.
     */
    public static String sanitize(String input) {
        if (input == null) {
            return "";
        }
        StringBuilder out = new StringBuilder(input.length());
        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            switch (c) {
                case '$', '"', '\'', ',', ';', '{', '%', '}' -> {
                    // dropped
                }
                case '(', ')', '[', ']' -> out.append(' ');
                default -> out.append(c);
            }
        }
        return out.toString();
    }

    /**
     * Derives a string constant name from an action: ASCII letters and digits
     * are kept, other runs become one underscore, the result is capped and
     * suffixed with the norm ordinal.
     */
    public static String stringName(String action, int ordinal) {
        StringBuilder name = new StringBuilder();
        for (int i = 0; i < action.length() && name.length() < MAX_STRING_NAME_LENGTH; i++) {
            char c = action.charAt(i);
            if (isAsciiAlphanumeric(c)) {
                name.append(c);
            } else if (name.length() > 0 && name.charAt(name.length() - 1) != '_') {
                name.append('_');
            }
        }
        while (name.length() > 0 && name.charAt(name.length() - 1) == '_') {
            name.setLength(name.length() - 1);
        }
        if (name.length() == 0) {
            name.append("action");
        }
        return name.append('_').append(ordinal).toString();
    }

    /**
     * First word of a text with its first letter upper-cased, the stem of asset names.
     */
    public static String assetStem(String text) {
        String firstWord = text == null ? "" : text.strip().split("\\s+", 2)[0];
        StringBuilder stem = new StringBuilder();
        for (int i = 0; i < firstWord.length(); i++) {
            char c = firstWord.charAt(i);
            if (Character.isLetterOrDigit(c) || c == '_') {
                stem.append(c);
            }
        }
        if (stem.length() == 0) {
            return "Norm";
        }
        stem.setCharAt(0, Character.toUpperCase(stem.charAt(0)));
        return stem.toString();
    }

    public static String subject(String role) {
        return role == null ? KelsenGenerator.PLACEHOLDER : role.toUpperCase(Locale.ROOT);
    }

    /**
     * Upper-snake identifier of a fact, capped and suffixed with the fact ordinal.
     */
    public static String factIdentifier(String description, int ordinal) {
        String sanitized = sanitize(description);
        StringBuilder id = new StringBuilder(sanitized.length());
        for (int i = 0; i < sanitized.length(); i++) {
            char c = sanitized.charAt(i);
            id.append(Character.isWhitespace(c) ? '_' : Character.toUpperCase(c));
        }
        if (id.length() > MAX_FACT_ID_LENGTH) {
            id.setLength(MAX_FACT_ID_LENGTH);
        }
        return id.append('_').append(ordinal).toString();
    }

    /**
     * Lower-cased first word of a legal-context action, capped in length.
     */
    public static String contextVariable(String action) {
        int end = action.indexOf(' ');
        String word = end < 0 ? action : action.substring(0, end);
        if (word.length() > MAX_CONTEXT_VAR_LENGTH) {
            word = word.substring(0, MAX_CONTEXT_VAR_LENGTH);
        }
        word = word.toLowerCase(Locale.ROOT);
        return word.isEmpty() ? "accion" : word;
    }

    private static boolean isAsciiAlphanumeric(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
    }
}
