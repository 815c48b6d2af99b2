/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.compiler.config;

/**
 * Case-insensitive Levenshtein distance with unit costs.
 */
public final class EditDistance {

    private EditDistance() {
    }

    public static int between(String a, String b) {
        int n = a.length();
        int m = b.length();
        int[] previous = new int[m + 1];
        int[] current = new int[m + 1];
        for (int j = 0; j <= m; j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= n; i++) {
            current[0] = i;
            char ca = Character.toLowerCase(a.charAt(i - 1));
            for (int j = 1; j <= m; j++) {
                int cost = ca == Character.toLowerCase(b.charAt(j - 1)) ? 0 : 1;
                current[j] = Math.min(
                    Math.min(previous[j] + 1, current[j - 1] + 1),
                    previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[m];
    }
}
