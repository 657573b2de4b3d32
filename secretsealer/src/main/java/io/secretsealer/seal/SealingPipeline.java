/*
 * Copyright Secretsealer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.secretsealer.seal;

import java.security.PublicKey;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.BooleanSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.secretsealer.crypto.CryptoException;
import io.secretsealer.crypto.HybridEncryptor;
import io.secretsealer.crypto.SealedValue;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Turns a {@link SealRequest}, together with what is already stored for the same secret, into a {@link SealedRecord}.
 * <ol>
 *     <li>Stored values are merged with the submitted ones, the submitted ones winning,
 *     so that editing some keys of a secret keeps the others.</li>
 *     <li>Every merged value is sealed, in parallel on the given executor, under the label for the request's scope.</li>
 *     <li>The record's annotations are the scope markers for the request's scope, plus any existing annotations
 *     the allowlist permits. Existing scope markers are always dropped.</li>
 * </ol>
 * If sealing any one value fails the whole seal fails, and the values not yet sealed are not attempted.
 * The public key is passed in on every call and never kept.
 */
public class SealingPipeline {

    private static final Logger log = LoggerFactory.getLogger(SealingPipeline.class);

    private final HybridEncryptor encryptor;
    private final Executor encryptionExecutor;
    private final AnnotationAllowlist allowlist;

    public SealingPipeline(@NonNull HybridEncryptor encryptor,
                           @NonNull Executor encryptionExecutor,
                           @NonNull AnnotationAllowlist allowlist) {
        this.encryptor = Objects.requireNonNull(encryptor);
        this.encryptionExecutor = Objects.requireNonNull(encryptionExecutor);
        this.allowlist = Objects.requireNonNull(allowlist);
    }

    @NonNull
    public AnnotationAllowlist allowlist() {
        return allowlist;
    }

    /**
     * Asynchronously seals the given request.
     * @see #seal(SealRequest, Map, Map, PublicKey, BooleanSupplier)
     */
    @NonNull
    public CompletionStage<SealedRecord> seal(@NonNull SealRequest request,
                                              Map<String, String> existingPlaintext,
                                              Map<String, String> existingAnnotations,
                                              PublicKey publicKey) {
        return seal(request, existingPlaintext, existingAnnotations, publicKey, () -> false);
    }

    /**
     * Asynchronously seals the given request.
     * @param request The request.
     * @param existingPlaintext The values already stored for the secret; null is treated as empty.
     * @param existingAnnotations The annotations of the existing sealed record; null is treated as empty.
     * @param publicKey The controller's current public key.
     * @param aborted Polled before each value is sealed; once it returns true no further values are sealed
     * and the seal fails with {@link PipelineException.Reason#CANCELLED}.
     * @return A completion stage for the record, which fails with {@link PipelineException}.
     */
    @NonNull
    public CompletionStage<SealedRecord> seal(@NonNull SealRequest request,
                                              Map<String, String> existingPlaintext,
                                              Map<String, String> existingAnnotations,
                                              PublicKey publicKey,
                                              @NonNull BooleanSupplier aborted) {
        Objects.requireNonNull(request);
        Objects.requireNonNull(aborted);
        var merged = mergeValues(existingPlaintext, request.values());
        if (log.isDebugEnabled()) {
            log.debug("Sealing {} key(s) for {}/{}, {} carried over from the stored secret",
                    merged.size(), request.namespace(), request.secretName(), merged.size() - request.values().size());
        }
        byte[] label = ScopeLabelResolver.resolveLabel(request.scope(), request.namespace(), request.secretName());
        var scopeAnnotations = ScopeLabelResolver.resolveAnnotations(request.scope());
        var annotations = mergeAnnotations(scopeAnnotations, existingAnnotations);
        if (publicKey == null) {
            return CompletableFuture.failedFuture(new PipelineException(PipelineException.Reason.CRYPTO, "No public key"));
        }
        return sealAll(merged, publicKey, label, aborted)
                .thenApply(encryptedData -> new SealedRecord(
                        new ObjectMeta(request.secretName(), request.namespace(), annotations),
                        encryptedData,
                        new ObjectMeta(request.secretName(), request.namespace(), scopeAnnotations)));
    }

    static Map<String, String> mergeValues(Map<String, String> existing, Map<String, String> submitted) {
        var merged = new LinkedHashMap<String, String>();
        if (existing != null) {
            merged.putAll(existing);
        }
        merged.putAll(submitted);
        return merged;
    }

    Map<String, String> mergeAnnotations(Map<String, String> scopeAnnotations, Map<String, String> existing) {
        var merged = new HashMap<>(scopeAnnotations);
        if (existing != null) {
            existing.forEach((key, value) -> {
                if (allowlist.permits(key)) {
                    merged.put(key, value);
                }
            });
        }
        return merged;
    }

    private CompletableFuture<Map<String, SealedValue>> sealAll(Map<String, String> values,
                                                                PublicKey publicKey,
                                                                byte[] label,
                                                                BooleanSupplier aborted) {
        var result = new CompletableFuture<Map<String, SealedValue>>();
        List<CompletableFuture<Map.Entry<String, SealedValue>>> tasks = new ArrayList<>(values.size());
        for (var entry : values.entrySet()) {
            var task = sealOne(entry.getKey(), entry.getValue(), publicKey, label, aborted, result);
            // hooked before the next task is submitted, so a failure stops the tasks after it
            task.whenComplete((ignored, error) -> {
                if (error != null) {
                    result.completeExceptionally(toPipelineException(error));
                }
            });
            tasks.add(task);
        }
        // the first failure wins; stop everything not yet started
        result.whenComplete((ignored, error) -> {
            if (error != null) {
                tasks.forEach(sibling -> sibling.cancel(false));
            }
        });
        CompletableFuture.allOf(tasks.toArray(new CompletableFuture<?>[0]))
                .thenRun(() -> {
                    var sealed = new LinkedHashMap<String, SealedValue>();
                    for (var task : tasks) {
                        var entry = task.join();
                        sealed.put(entry.getKey(), entry.getValue());
                    }
                    result.complete(sealed);
                });
        return result;
    }

    private CompletableFuture<Map.Entry<String, SealedValue>> sealOne(String key,
                                                                      String value,
                                                                      PublicKey publicKey,
                                                                      byte[] label,
                                                                      BooleanSupplier aborted,
                                                                      CompletableFuture<?> overall) {
        try {
            return CompletableFuture.supplyAsync(() -> {
                if (overall.isDone() || aborted.getAsBoolean()) {
                    throw new CancellationException("Abandoned before sealing key '" + key + "'");
                }
                try {
                    return Map.entry(key, encryptor.seal(publicKey, label, value));
                }
                catch (CryptoException e) {
                    throw new CryptoException("Failed to seal key '" + key + "'", e);
                }
            }, encryptionExecutor);
        }
        catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static PipelineException toPipelineException(Throwable error) {
        var cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof PipelineException pipelineException) {
            return pipelineException;
        }
        if (cause instanceof CancellationException) {
            return new PipelineException(PipelineException.Reason.CANCELLED, "Seal was abandoned", cause);
        }
        if (cause instanceof RejectedExecutionException) {
            return new PipelineException(PipelineException.Reason.UNAVAILABLE, "No capacity to seal values", cause);
        }
        return new PipelineException(PipelineException.Reason.CRYPTO, cause.getMessage(), cause);
    }
}
