/*
 * Copyright Secretsealer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.secretsealer.config;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SealerConfigLoaderTest {

    private final SealerConfigLoader loader = new SealerConfigLoader();

    @Test
    void emptyDocumentShouldGiveDefaults() {
        assertThat(loader.load("")).isEqualTo(SealerConfig.defaults());
        assertThat(loader.load("{}")).isEqualTo(SealerConfig.defaults());
    }

    @Test
    void shouldLoadFullDocument() {
        var config = loader.load("""
                controllerNamespace: sealing
                controllerName: controller
                clusterDomain: example.internal
                annotationsToPreserve:
                  - owner
                  - " team "
                encryptionThreads: 8
                sealTimeoutSeconds: 30
                """);

        assertThat(config.controllerNamespace()).isEqualTo("sealing");
        assertThat(config.controllerName()).isEqualTo("controller");
        assertThat(config.clusterDomain()).isEqualTo("example.internal");
        assertThat(config.allowlist().keys()).containsExactlyInAnyOrder("owner", "team");
        assertThat(config.encryptionThreads()).isEqualTo(8);
        assertThat(config.sealTimeoutSeconds()).isEqualTo(30);
    }

    @Test
    void shouldLoadFromStream() {
        var in = new ByteArrayInputStream("encryptionThreads: 2\n".getBytes(StandardCharsets.UTF_8));

        assertThat(loader.load(in).encryptionThreads()).isEqualTo(2);
    }

    @Test
    void environmentShouldWinOverDocument() {
        var config = loader.load("controllerNamespace: sealing\n", Map.of("SEALED_SECRETS_CONTROLLER_NAMESPACE", "other"));

        assertThat(config.controllerNamespace()).isEqualTo("other");
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "encryptionThreads: 0",
            "encryptionThreads: 65",
            "encryptionThreads: four",
            "sealTimeoutSeconds: 0",
            "annotationsToPreserve: owner",
            "controllerNamespace: ''",
            "unknownProperty: true",
            "- a list" })
    void shouldRejectInvalidDocument(String yaml) {
        assertThatThrownBy(() -> loader.load(yaml))
                .isInstanceOfSatisfying(InvalidConfigException.class, e -> assertThat(e.messages()).isNotEmpty())
                .hasMessageStartingWith("Invalid config");
    }

    @Test
    void shouldRejectMalformedYaml() {
        assertThatThrownBy(() -> loader.load("controllerNamespace: [unclosed"))
                .isInstanceOf(InvalidConfigException.class)
                .hasMessage("Config is not valid YAML");
    }
}
