/*
 * Copyright Secretsealer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.secretsealer.api.inmemory;

import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import io.secretsealer.api.ControllerKeySource;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * A stand-in for the controller, to be used only for testing.
 * It holds an RSA key pair which can be {@linkplain #rotate() rotated}, and counts how often its public key was fetched.
 */
public class InMemoryControllerKeySource implements ControllerKeySource {

    private static final int KEY_SIZE_BITS = 2048;

    private final KeyPairGenerator generator;
    private final AtomicReference<KeyPair> current;
    private final AtomicInteger fetches = new AtomicInteger();

    public InMemoryControllerKeySource() {
        try {
            this.generator = KeyPairGenerator.getInstance("RSA");
        }
        catch (NoSuchAlgorithmException e) {
            // JCA guarantees that RSA is available
            throw new IllegalStateException(e);
        }
        this.generator.initialize(KEY_SIZE_BITS);
        this.current = new AtomicReference<>(generator.generateKeyPair());
    }

    /**
     * Replaces the key pair with a new one.
     * @return The new public key.
     */
    public PublicKey rotate() {
        var keyPair = generator.generateKeyPair();
        current.set(keyPair);
        return keyPair.getPublic();
    }

    /**
     * @return The private key matching the current public key.
     */
    public PrivateKey privateKey() {
        return current.get().getPrivate();
    }

    /**
     * @return The number of times {@link #currentPublicKey()} has been called.
     */
    public int fetchCount() {
        return fetches.get();
    }

    @NonNull
    @Override
    public CompletionStage<PublicKey> currentPublicKey() {
        fetches.incrementAndGet();
        return CompletableFuture.completedFuture(current.get().getPublic());
    }
}
