/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.compiler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.savigny.transpiler.api.exceptions.DocumentLoadException;
import com.savigny.transpiler.compiler.config.ConfigurationDocument;
import com.savigny.transpiler.compiler.context.LegalContext;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Reads configuration and legal-context documents into immutable handles.
 *
 * <p>A load either returns a complete handle or throws
 * {@link DocumentLoadException}: {@code RESOURCE_MISSING} when the file cannot
 * be read, {@code MALFORMED_DOCUMENT} when its content is not a JSON object of
 * the expected shape. Unknown fields are ignored.
 */
public final class DocumentLoader {

    private static final Logger logger = Logger.getLogger(DocumentLoader.class.getName());

    private final ObjectMapper objectMapper;

    public DocumentLoader() {
        this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public DocumentLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ConfigurationDocument loadConfiguration(Path path) {
        ConfigurationDocument document = read(path, ConfigurationDocument.class);
        logger.info(String.format("Loaded configuration from %s: %d institutions, %d domains",
            path, document.institutions().size(), document.domains().size()));
        return document;
    }

    public LegalContext loadContext(Path path) {
        LegalContext context = read(path, LegalContext.class);
        logger.info(String.format("Loaded legal context from %s: %d sources, %d role mapping tables",
            path, context.sources().size(), context.roleMappings().size()));
        return context;
    }

    public ConfigurationDocument parseConfiguration(String json) {
        return parse(json, "<inline>", ConfigurationDocument.class);
    }

    public LegalContext parseContext(String json) {
        return parse(json, "<inline>", LegalContext.class);
    }

    private <T> T read(Path path, Class<T> type) {
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new DocumentLoadException(DocumentLoadException.Reason.RESOURCE_MISSING, path.toString(),
                "Document not found: " + path, e);
        } catch (IOException e) {
            throw new DocumentLoadException(DocumentLoadException.Reason.RESOURCE_MISSING, path.toString(),
                "Cannot read document " + path + ": " + e.getMessage(), e);
        }
        return parse(content, path.toString(), type);
    }

    private <T> T parse(String json, String location, Class<T> type) {
        if (json == null || json.isBlank()) {
            throw new DocumentLoadException(DocumentLoadException.Reason.MALFORMED_DOCUMENT, location,
                "Document is empty: " + location);
        }
        T value;
        try {
            value = objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new DocumentLoadException(DocumentLoadException.Reason.MALFORMED_DOCUMENT, location,
                "Malformed " + type.getSimpleName() + " in " + location + ": " + e.getOriginalMessage(), e);
        }
        if (value == null) {
            throw new DocumentLoadException(DocumentLoadException.Reason.MALFORMED_DOCUMENT, location,
                "Document has no content: " + location);
        }
        return value;
    }
}
