/*
 * Copyright Secretsealer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.secretsealer.seal;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScopeLabelResolverTest {

    @Test
    void clusterLabelIsEmpty() {
        assertThat(ScopeLabelResolver.resolveLabel(Scope.CLUSTER, "ns", "name")).isEmpty();
    }

    @Test
    void namespaceLabelIsNamespace() {
        assertThat(ScopeLabelResolver.resolveLabel(Scope.NAMESPACE, "ns", "name"))
                .isEqualTo("ns".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void strictLabelIsNamespaceSlashName() {
        assertThat(ScopeLabelResolver.resolveLabel(Scope.STRICT, "ns", "name"))
                .isEqualTo("ns/name".getBytes(StandardCharsets.UTF_8));
    }

    @ParameterizedTest
    @EnumSource(Scope.class)
    void labelIsPure(Scope scope) {
        assertThat(ScopeLabelResolver.resolveLabel(scope, "ns", "name"))
                .isEqualTo(ScopeLabelResolver.resolveLabel(scope, "ns", "name"));
    }

    @Test
    void strictLabelsDifferWhenNameDiffers() {
        assertThat(ScopeLabelResolver.resolveLabel(Scope.STRICT, "ns", "a"))
                .isNotEqualTo(ScopeLabelResolver.resolveLabel(Scope.STRICT, "ns", "b"));
        assertThat(ScopeLabelResolver.resolveLabel(Scope.NAMESPACE, "ns-a", "x"))
                .isNotEqualTo(ScopeLabelResolver.resolveLabel(Scope.NAMESPACE, "ns-b", "x"));
    }

    @Test
    void shouldResolveAnnotations() {
        assertThat(ScopeLabelResolver.resolveAnnotations(Scope.CLUSTER))
                .isEqualTo(Map.of("sealedsecrets.bitnami.com/cluster-wide", "true"));
        assertThat(ScopeLabelResolver.resolveAnnotations(Scope.NAMESPACE))
                .isEqualTo(Map.of("sealedsecrets.bitnami.com/namespace-wide", "true"));
        assertThat(ScopeLabelResolver.resolveAnnotations(Scope.STRICT)).isEmpty();
    }

    @Test
    void shouldClassifyScopeControlKeys() {
        assertThat(ScopeLabelResolver.isScopeControl(ScopeLabelResolver.CLUSTER_WIDE_ANNOTATION)).isTrue();
        assertThat(ScopeLabelResolver.isScopeControl(ScopeLabelResolver.NAMESPACE_WIDE_ANNOTATION)).isTrue();
        assertThat(ScopeLabelResolver.isScopeControl("sealedsecrets.bitnami.com/managed")).isFalse();
        assertThat(ScopeLabelResolver.isScopeControl("owner")).isFalse();
        assertThat(ScopeLabelResolver.isScopeControl(null)).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = { "cluster", "Namespace", " STRICT " })
    void shouldParseScopeNames(String name) {
        assertThat(Scope.fromName(name).wireName()).isEqualTo(name.trim().toLowerCase());
    }

    @Test
    void shouldRejectUnknownScope() {
        assertThatThrownBy(() -> Scope.fromName("global"))
                .isInstanceOf(FormatException.class)
                .hasMessage("Unknown scope 'global', expected one of cluster, namespace or strict");
        assertThatThrownBy(() -> Scope.fromName(null))
                .isInstanceOf(FormatException.class);
    }
}
