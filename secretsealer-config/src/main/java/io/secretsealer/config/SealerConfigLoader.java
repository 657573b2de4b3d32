/*
 * Copyright Secretsealer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.secretsealer.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Reads a {@link SealerConfig} from YAML, validating it against
 * {@value #SCHEMA_RESOURCE} before binding it.
 */
public class SealerConfigLoader {

    static final String SCHEMA_RESOURCE = "io/secretsealer/config/sealer-config.schema.yaml";

    private static final Logger log = LoggerFactory.getLogger(SealerConfigLoader.class);

    private final ConfigSchema schema;

    public SealerConfigLoader() {
        this(ConfigSchema.fromResource(SCHEMA_RESOURCE));
    }

    SealerConfigLoader(@NonNull ConfigSchema schema) {
        this.schema = Objects.requireNonNull(schema);
    }

    /**
     * @param yaml The YAML document. An empty document gives the defaults.
     * @return The config.
     * @throws InvalidConfigException If the document is not valid YAML or not valid config.
     */
    @NonNull
    public SealerConfig load(@NonNull String yaml) {
        JsonNode node;
        try {
            node = ConfigSchema.MAPPER.readTree(yaml);
        }
        catch (JsonProcessingException e) {
            throw new InvalidConfigException("Config is not valid YAML", e);
        }
        return bind(node);
    }

    @NonNull
    public SealerConfig load(@NonNull InputStream yaml) {
        JsonNode node;
        try {
            node = ConfigSchema.MAPPER.readTree(yaml);
        }
        catch (IOException e) {
            throw new InvalidConfigException("Config could not be read", e);
        }
        return bind(node);
    }

    /**
     * Loads the document, then applies overrides from the given environment.
     * @see SealerConfig#withEnvironment(Map)
     */
    @NonNull
    public SealerConfig load(@NonNull String yaml, @NonNull Map<String, String> env) {
        return load(yaml).withEnvironment(env);
    }

    private SealerConfig bind(JsonNode node) {
        if (node == null || node instanceof MissingNode || node.isNull()) {
            node = ConfigSchema.MAPPER.createObjectNode();
        }
        schema.validate(node);
        SealerConfig config;
        try {
            config = ConfigSchema.MAPPER.treeToValue(node, SealerConfig.class);
        }
        catch (JsonProcessingException e) {
            throw new InvalidConfigException("Config could not be bound", e);
        }
        log.debug("Loaded {}", config);
        return config;
    }
}
