/*
 * Copyright Secretsealer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.secretsealer.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.secretsealer.api.AnnotationStore;
import io.secretsealer.api.ControllerKeySource;
import io.secretsealer.api.SecretStore;
import io.secretsealer.crypto.HybridEncryptor;
import io.secretsealer.seal.SealingPipeline;
import io.secretsealer.seal.SecretSealer;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Factory for configured {@link SecretSealer}s.
 */
public final class SecretSealers {

    private static final Logger log = LoggerFactory.getLogger(SecretSealers.class);

    private SecretSealers() {
    }

    /**
     * Creates a sealer with its own fixed-size encryption pool, which {@link SecretSealer#close()} shuts down.
     */
    @NonNull
    public static SecretSealer create(@NonNull SealerConfig config,
                                      @NonNull SecretStore secretStore,
                                      @NonNull AnnotationStore annotationStore,
                                      @NonNull ControllerKeySource keySource) {
        ExecutorService executor = Executors.newFixedThreadPool(config.encryptionThreads(), new EncryptionThreadFactory());
        var pipeline = new SealingPipeline(new HybridEncryptor(), executor, config.allowlist());
        log.info("Created secret sealer for controller {}/{} with {} encryption thread(s), preserving annotations {}",
                config.controllerNamespace(), config.controllerName(), config.encryptionThreads(), pipeline.allowlist().keys());
        return new SecretSealer(secretStore, annotationStore, keySource, pipeline, config.sealTimeout(), executor::shutdownNow);
    }

    private static final class EncryptionThreadFactory implements ThreadFactory {
        private final AtomicInteger count = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            var thread = new Thread(r, "secretsealer-encrypt-" + count.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
