/*
 * Copyright Secretsealer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.secretsealer.seal;

import java.security.PublicKey;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.secretsealer.api.AnnotationStore;
import io.secretsealer.api.ControllerKeySource;
import io.secretsealer.api.NotFoundException;
import io.secretsealer.api.SecretStore;
import io.secretsealer.crypto.CryptoException;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Seals requests end to end: reads what is stored for the target secret, fetches the controller's current key,
 * and hands everything to a {@link SealingPipeline}.
 * <p>
 * The three reads are issued together. A secret, namespace or sealed record that does not exist is read as empty;
 * every other failure fails the seal with a {@link PipelineException} whose {@link PipelineException#reason() reason}
 * tells the caller whether retrying could help.
 * If the seal takes longer than the timeout it fails with {@link PipelineException.Reason#TIMED_OUT},
 * and outstanding reads and encryptions are abandoned. Cancelling the returned future abandons them too.
 */
public class SecretSealer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SecretSealer.class);

    private final SecretStore secretStore;
    private final AnnotationStore annotationStore;
    private final ControllerKeySource keySource;
    private final SealingPipeline pipeline;
    private final Duration timeout;
    private final Runnable onClose;

    public SecretSealer(@NonNull SecretStore secretStore,
                        @NonNull AnnotationStore annotationStore,
                        @NonNull ControllerKeySource keySource,
                        @NonNull SealingPipeline pipeline,
                        @NonNull Duration timeout) {
        this(secretStore, annotationStore, keySource, pipeline, timeout, () -> {
        });
    }

    /**
     * @param onClose Run by {@link #close()}, to release whatever the pipeline's executor holds.
     */
    public SecretSealer(@NonNull SecretStore secretStore,
                        @NonNull AnnotationStore annotationStore,
                        @NonNull ControllerKeySource keySource,
                        @NonNull SealingPipeline pipeline,
                        @NonNull Duration timeout,
                        @NonNull Runnable onClose) {
        this.secretStore = Objects.requireNonNull(secretStore);
        this.annotationStore = Objects.requireNonNull(annotationStore);
        this.keySource = Objects.requireNonNull(keySource);
        this.pipeline = Objects.requireNonNull(pipeline);
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.timeout = timeout;
        this.onClose = Objects.requireNonNull(onClose);
    }

    /**
     * Asynchronously seals the given request.
     * @param request The request.
     * @return A future for the sealed record, which fails with {@link PipelineException}.
     */
    @NonNull
    public CompletableFuture<SealedRecord> seal(@NonNull SealRequest request) {
        Objects.requireNonNull(request);
        log.info("Sealing {} key(s) into {}/{} with {} scope",
                request.values().size(), request.namespace(), request.secretName(), request.scope().wireName());

        var aborted = new AtomicBoolean();
        var allowlist = pipeline.allowlist();
        var storedPlaintext = call(() -> secretStore.getPlaintext(request.namespace(), request.secretName())).toCompletableFuture();
        var storedAnnotations = allowlist.isEmpty()
                ? CompletableFuture.<Map<String, String>> completedFuture(Map.of())
                : call(() -> annotationStore.getPreserved(request.namespace(), request.secretName(), allowlist.keys())).toCompletableFuture();
        var currentKey = call(keySource::currentPublicKey).toCompletableFuture();
        List<CompletableFuture<?>> reads = List.of(storedPlaintext, storedAnnotations, currentKey);

        var plaintext = readPlaintext(request, storedPlaintext);
        var annotations = readAnnotations(request, storedAnnotations);
        var publicKey = fetchPublicKey(currentKey);

        var result = new CompletableFuture<SealedRecord>();
        result.whenComplete((record, error) -> {
            if (error == null) {
                log.info("Sealed {} key(s) into {}/{}", record.encryptedData().size(), request.namespace(), request.secretName());
            }
            else {
                aborted.set(true);
                reads.forEach(read -> read.cancel(false));
                log.warn("Failed to seal {}/{}: {}", request.namespace(), request.secretName(), error.getMessage());
            }
        });

        // fail as soon as any read fails, without waiting for the others
        for (CompletableFuture<?> read : List.of(plaintext, annotations, publicKey)) {
            read.whenComplete((ignored, error) -> {
                if (error != null) {
                    result.completeExceptionally(toPipelineException(error));
                }
            });
        }

        CompletableFuture.allOf(plaintext, annotations, publicKey)
                .thenCompose(ignored -> pipeline.seal(request, plaintext.join(), annotations.join(), publicKey.join(), aborted::get))
                .whenComplete((record, error) -> {
                    if (error == null) {
                        result.complete(record);
                    }
                    else {
                        result.completeExceptionally(toPipelineException(error));
                    }
                });

        expireAfter(result, timeout, "Sealing " + request.namespace() + "/" + request.secretName() + " did not finish within " + timeout);
        return result;
    }

    /**
     * Fails {@code result} with {@link PipelineException.Reason#TIMED_OUT} unless it completes within {@code timeout}.
     * The scheduled expiry is dropped as soon as {@code result} completes, and holds nothing but the message.
     * @return The expiry, which is cancelled once {@code result} completes first.
     */
    static CompletableFuture<Void> expireAfter(CompletableFuture<?> result, Duration timeout, String message) {
        var expiry = new CompletableFuture<Void>().orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        expiry.whenComplete((ignored, error) -> {
            if (unwrap(error) instanceof TimeoutException) {
                result.completeExceptionally(new PipelineException(PipelineException.Reason.TIMED_OUT, message));
            }
        });
        result.whenComplete((ignored, error) -> expiry.cancel(false));
        return expiry;
    }

    private CompletableFuture<Map<String, String>> readPlaintext(SealRequest request, CompletableFuture<Map<String, String>> stored) {
        return stored
                .handle((data, error) -> {
                    if (error == null) {
                        return data == null ? Map.<String, String> of() : data;
                    }
                    var cause = unwrap(error);
                    if (cause instanceof NotFoundException) {
                        log.warn("No existing secret {}/{} ({}), sealing only the submitted values",
                                request.namespace(), request.secretName(), cause.getMessage());
                        return Map.of();
                    }
                    throw new CompletionException(new PipelineException(PipelineException.Reason.UNAVAILABLE,
                            "Failed to read existing secret " + request.namespace() + "/" + request.secretName(), cause));
                });
    }

    private CompletableFuture<Map<String, String>> readAnnotations(SealRequest request, CompletableFuture<Map<String, String>> stored) {
        return stored
                .handle((data, error) -> {
                    if (error == null) {
                        return data == null ? Map.<String, String> of() : data;
                    }
                    var cause = unwrap(error);
                    if (cause instanceof NotFoundException) {
                        log.warn("No existing sealed secret {}/{} ({}), no annotations to preserve",
                                request.namespace(), request.secretName(), cause.getMessage());
                        return Map.of();
                    }
                    throw new CompletionException(new PipelineException(PipelineException.Reason.UNAVAILABLE,
                            "Failed to read annotations of sealed secret " + request.namespace() + "/" + request.secretName(), cause));
                });
    }

    private CompletableFuture<PublicKey> fetchPublicKey(CompletableFuture<PublicKey> current) {
        return current
                .handle((key, error) -> {
                    if (error == null) {
                        return key;
                    }
                    var cause = unwrap(error);
                    PipelineException failure;
                    if (cause instanceof NotFoundException) {
                        failure = new PipelineException(PipelineException.Reason.NOT_FOUND, "Controller public key not found", cause);
                    }
                    else if (cause instanceof CryptoException) {
                        failure = new PipelineException(PipelineException.Reason.CRYPTO, "Controller public key is unusable", cause);
                    }
                    else {
                        failure = new PipelineException(PipelineException.Reason.UNAVAILABLE, "Failed to fetch controller public key", cause);
                    }
                    throw new CompletionException(failure);
                });
    }

    private static <T> CompletionStage<T> call(Supplier<CompletionStage<T>> collaboratorCall) {
        try {
            return Objects.requireNonNull(collaboratorCall.get(), "collaborator returned no stage");
        }
        catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static Throwable unwrap(Throwable error) {
        var cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private static PipelineException toPipelineException(Throwable error) {
        var cause = unwrap(error);
        if (cause instanceof PipelineException pipelineException) {
            return pipelineException;
        }
        if (cause instanceof CancellationException) {
            return new PipelineException(PipelineException.Reason.CANCELLED, "Seal was abandoned", cause);
        }
        return new PipelineException(PipelineException.Reason.UNAVAILABLE, "Seal failed unexpectedly", cause);
    }

    @Override
    public void close() {
        onClose.run();
    }
}
