/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.compiler.codegen;

import java.util.List;
import java.util.Locale;

/**
 * Keyword-based {@link AssetClassifier}. Immovable keywords are checked before
 * movable ones; anything else is a service. Matching ignores case.
 */
public final class KeywordAssetClassifier implements AssetClassifier {

    private static final List<String> OMISSION_KEYWORDS = List.of("no ", "abstenerse", "evitar");

    private final List<String> immovableKeywords;
    private final List<String> movableKeywords;
    private final List<String> omissionKeywords;

    public KeywordAssetClassifier(List<String> immovableKeywords, List<String> movableKeywords,
                                  List<String> omissionKeywords) {
        this.immovableKeywords = List.copyOf(immovableKeywords);
        this.movableKeywords = List.copyOf(movableKeywords);
        this.omissionKeywords = List.copyOf(omissionKeywords);
    }

    /**
     * Classifier for the scope of schema norms.
     */
    public static KeywordAssetClassifier forNormScopes() {
        return new KeywordAssetClassifier(List.of("inmueble"), List.of("propiedad"), OMISSION_KEYWORDS);
    }

    /**
     * Classifier for the object of legal-context norms.
     */
    public static KeywordAssetClassifier forContextObjects() {
        return new KeywordAssetClassifier(
            List.of("inmueble", "propiedad", "bien"),
            List.of("documento", "precio", "pago"),
            OMISSION_KEYWORDS);
    }

    @Override
    public AssetType classify(String description) {
        if (description == null) {
            return AssetType.SERVICE;
        }
        String text = description.toLowerCase(Locale.ROOT);
        if (containsAny(text, immovableKeywords)) {
            return AssetType.IMMOVABLE_PROPERTY;
        }
        if (containsAny(text, movableKeywords)) {
            return AssetType.MOVABLE_PROPERTY;
        }
        return AssetType.SERVICE;
    }

    @Override
    public boolean isOmission(String action) {
        return action != null && containsAny(action.toLowerCase(Locale.ROOT), omissionKeywords);
    }

    private static boolean containsAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
