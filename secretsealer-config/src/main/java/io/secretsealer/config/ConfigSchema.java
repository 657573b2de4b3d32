/*
 * Copyright Secretsealer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.secretsealer.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SchemaId;
import com.networknt.schema.SchemaLocation;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;

/**
 * An immutable and valid Draft 4 schema for a configuration document.
 * Instances can be created from classpath resources or from string literals.
 */
public class ConfigSchema {

    static final YAMLMapper MAPPER = new YAMLMapper()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER);

    // Invariant: This is a valid schema
    // Enforced by: Constructor
    private final JsonNode rootNode;
    private final JsonSchema schema;

    ConfigSchema(JsonNode rootNode) {
        Objects.requireNonNull(rootNode);
        validateSchema(rootNode);
        this.rootNode = rootNode;
        this.schema = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V4).getSchema(rootNode);
    }

    private static void validateSchema(JsonNode rootNode) {
        JsonSchemaFactory jsonSchemaFactory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V4);
        // The meta-schema is retrieved from the classpath at classpath:draft/2020-12/schema.
        JsonSchema metaSchema = jsonSchemaFactory.getSchema(SchemaLocation.of(SchemaId.V202012));
        Set<ValidationMessage> assertions = metaSchema.validate(rootNode, executionContext -> {
            // By default since Draft 2019-09 the format keyword only generates annotations and not assertions
            executionContext.getExecutionConfig().setFormatAssertionsEnabled(true);
        });
        if (!assertions.isEmpty()) {
            throw new IllegalArgumentException("Not a valid schema: " + assertions);
        }
    }

    /**
     * Loads a schema from the classpath.
     * @param resource The absolute resource name, without a leading slash.
     * @return The schema.
     */
    public static ConfigSchema fromResource(String resource) {
        try (InputStream inputStream = ConfigSchema.class.getClassLoader().getResourceAsStream(resource)) {
            if (inputStream == null) {
                throw new IllegalArgumentException("No schema resource " + resource);
            }
            return new ConfigSchema(MAPPER.readTree(inputStream));
        }
        catch (IOException e) {
            throw new UncheckedIOException("Could not read schema resource " + resource, e);
        }
    }

    static ConfigSchema create(String schemaAsString) {
        try {
            return new ConfigSchema(MAPPER.readTree(schemaAsString));
        }
        catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Not a valid schema: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public String toString() {
        try {
            return MAPPER.writeValueAsString(rootNode);
        }
        catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Validates a configuration document against this schema.
     * @param configInstance The parsed document.
     * @return The same document.
     * @throws InvalidConfigException If the document does not conform to this schema.
     */
    public JsonNode validate(JsonNode configInstance) {
        Set<ValidationMessage> assertions = schema.validate(configInstance);
        if (!assertions.isEmpty()) {
            throw new InvalidConfigException("Invalid config", assertions.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .toList());
        }
        return configInstance;
    }
}
