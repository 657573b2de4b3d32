/*
 * Copyright Secretsealer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.secretsealer.api.inmemory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;

import io.secretsealer.api.NotFoundException;
import io.secretsealer.api.SecretStore;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * A {@link SecretStore} held in memory, to be used only for testing.
 * Reading from a namespace that was never created fails with {@link NotFoundException};
 * reading an absent secret from a known namespace yields an empty map.
 */
public class InMemorySecretStore implements SecretStore {

    private final Set<String> namespaces = ConcurrentHashMap.newKeySet();
    private final Map<NamespacedName, Map<String, String>> secrets = new ConcurrentHashMap<>();

    public InMemorySecretStore createNamespace(@NonNull String namespace) {
        namespaces.add(namespace);
        return this;
    }

    /**
     * Stores a secret, creating its namespace if necessary.
     */
    public InMemorySecretStore put(@NonNull String namespace, @NonNull String name, @NonNull Map<String, String> data) {
        createNamespace(namespace);
        secrets.put(new NamespacedName(namespace, name), Map.copyOf(data));
        return this;
    }

    @NonNull
    @Override
    public CompletionStage<Map<String, String>> getPlaintext(@NonNull String namespace, @NonNull String name) {
        if (!namespaces.contains(namespace)) {
            return CompletableFuture.failedFuture(new NotFoundException("Namespace '" + namespace + "' not found"));
        }
        return CompletableFuture.completedFuture(secrets.getOrDefault(new NamespacedName(namespace, name), Map.of()));
    }
}
