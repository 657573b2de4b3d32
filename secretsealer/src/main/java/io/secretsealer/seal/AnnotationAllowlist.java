/*
 * Copyright Secretsealer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.secretsealer.seal;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * The annotation keys of an existing sealed record which survive a re-seal.
 * Scope markers never survive, even if listed.
 * @param keys The trimmed, non-blank keys.
 */
public record AnnotationAllowlist(@NonNull Set<String> keys) {

    private static final AnnotationAllowlist NONE = new AnnotationAllowlist(Set.of());

    public AnnotationAllowlist {
        keys = Set.copyOf(keys);
        for (String key : keys) {
            if (key.isBlank() || !key.equals(key.trim())) {
                throw new IllegalArgumentException("Annotation keys must be trimmed and non-blank: '" + key + "'");
            }
        }
    }

    /**
     * Builds an allowlist from raw configuration entries, trimming them and dropping blank ones.
     */
    @NonNull
    public static AnnotationAllowlist of(@NonNull Collection<String> entries) {
        var keys = new LinkedHashSet<String>();
        for (String entry : entries) {
            if (entry == null) {
                continue;
            }
            var key = entry.trim();
            if (!key.isEmpty()) {
                keys.add(key);
            }
        }
        return new AnnotationAllowlist(keys);
    }

    @NonNull
    public static AnnotationAllowlist none() {
        return NONE;
    }

    public boolean isEmpty() {
        return keys.isEmpty();
    }

    /**
     * @return true if an existing annotation with this key should be carried into a new sealed record.
     */
    public boolean permits(String annotationKey) {
        return keys.contains(annotationKey) && !ScopeLabelResolver.isScopeControl(annotationKey);
    }
}
