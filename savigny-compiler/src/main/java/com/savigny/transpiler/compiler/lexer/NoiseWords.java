/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.compiler.lexer;

import java.util.Locale;
import java.util.Set;

/**
 * Filler words dropped by the scanner before classification.
 */
public final class NoiseWords {

    private static final Set<String> WORDS = Set.of(
        "comienza", "como", "un", "una", "que", "en", "personas", "establecen",
        "dentro", "del", "dadas", "condiciones", "legales", "forma", "requerida",
        "la", "norma", "si", "hay", "de", "please", "hello", "maybe", "a", "al",
        "por", "con", "esta", "incluye", "para", "su", "los", "las",
        "es", "son", "está", "están", "ha", "han", "fue", "fueron", "será", "serán",
        "&", "$", "el", "pero", "siguiente", "resolución", "lo", "proteger", "sus",
        "derechos", "e", "intereses"
    );

    private NoiseWords() {
    }

    public static boolean isNoise(String word) {
        return word != null && WORDS.contains(word.toLowerCase(Locale.ROOT));
    }

    public static Set<String> all() {
        return WORDS;
    }
}
