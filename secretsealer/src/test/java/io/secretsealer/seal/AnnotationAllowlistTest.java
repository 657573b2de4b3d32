/*
 * Copyright Secretsealer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.secretsealer.seal;

import java.util.Arrays;
import java.util.Set;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnnotationAllowlistTest {

    @Test
    void shouldTrimAndDropBlankEntries() {
        var allowlist = AnnotationAllowlist.of(Arrays.asList(" owner ", "", "  ", null, "team"));

        assertThat(allowlist.keys()).containsExactlyInAnyOrder("owner", "team");
    }

    @Test
    void noneIsEmpty() {
        assertThat(AnnotationAllowlist.none().isEmpty()).isTrue();
        assertThat(AnnotationAllowlist.none().permits("owner")).isFalse();
    }

    @Test
    void shouldNeverPermitScopeMarkers() {
        var allowlist = AnnotationAllowlist.of(Set.of("owner", ScopeLabelResolver.NAMESPACE_WIDE_ANNOTATION));

        assertThat(allowlist.permits("owner")).isTrue();
        assertThat(allowlist.permits(ScopeLabelResolver.NAMESPACE_WIDE_ANNOTATION)).isFalse();
        assertThat(allowlist.permits("team")).isFalse();
    }

    @Test
    void shouldRejectUntrimmedKeys() {
        assertThatThrownBy(() -> new AnnotationAllowlist(Set.of(" owner")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
