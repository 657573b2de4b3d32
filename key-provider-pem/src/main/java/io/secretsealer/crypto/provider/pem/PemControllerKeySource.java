/*
 * Copyright Secretsealer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.secretsealer.crypto.provider.pem;

import java.security.PublicKey;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.secretsealer.api.ControllerKeySource;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * A {@link ControllerKeySource} which fetches the controller's certificate as PEM text and parses it.
 * The key is fetched and parsed on every call, so a rotated controller key is picked up by the next seal.
 */
public class PemControllerKeySource implements ControllerKeySource {

    private static final Logger log = LoggerFactory.getLogger(PemControllerKeySource.class);

    private final Supplier<CompletionStage<String>> pemFetcher;

    /**
     * @param pemFetcher Fetches the current PEM text, for example from the controller's {@code /v1/cert.pem} endpoint.
     */
    public PemControllerKeySource(@NonNull Supplier<CompletionStage<String>> pemFetcher) {
        this.pemFetcher = Objects.requireNonNull(pemFetcher);
    }

    @NonNull
    @Override
    public CompletionStage<PublicKey> currentPublicKey() {
        CompletionStage<String> pem;
        try {
            pem = Objects.requireNonNull(pemFetcher.get(), "fetcher returned no stage");
        }
        catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return pem.thenApply(text -> {
            var key = PemPublicKeys.parse(text);
            log.debug("Fetched controller public key ({})", key.getAlgorithm());
            return key;
        });
    }
}
