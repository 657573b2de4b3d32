/*
 * Copyright Secretsealer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.secretsealer.api.inmemory;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;

import io.secretsealer.api.AnnotationStore;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * An {@link AnnotationStore} held in memory, to be used only for testing.
 */
public class InMemoryAnnotationStore implements AnnotationStore {

    private final Map<NamespacedName, Map<String, String>> annotations = new ConcurrentHashMap<>();

    /**
     * Records the annotations of a sealed record, replacing any previous ones.
     */
    public InMemoryAnnotationStore put(@NonNull String namespace, @NonNull String name, @NonNull Map<String, String> recordAnnotations) {
        annotations.put(new NamespacedName(namespace, name), Map.copyOf(recordAnnotations));
        return this;
    }

    @NonNull
    @Override
    public CompletionStage<Map<String, String>> getPreserved(@NonNull String namespace, @NonNull String name, @NonNull Set<String> allowlist) {
        var existing = annotations.getOrDefault(new NamespacedName(namespace, name), Map.of());
        var preserved = new HashMap<String, String>();
        for (String key : allowlist) {
            var value = existing.get(key);
            if (value != null) {
                preserved.put(key, value);
            }
        }
        return CompletableFuture.completedFuture(preserved);
    }
}
