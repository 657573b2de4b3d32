/*
 * Copyright Secretsealer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.secretsealer.seal;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PublicKey;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import io.secretsealer.api.AnnotationStore;
import io.secretsealer.api.CollaboratorException;
import io.secretsealer.api.ControllerKeySource;
import io.secretsealer.api.NotFoundException;
import io.secretsealer.api.SecretStore;
import io.secretsealer.crypto.CryptoException;
import io.secretsealer.crypto.HybridDecryptor;
import io.secretsealer.crypto.HybridEncryptor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mock.Strictness.LENIENT;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SecretSealerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private static KeyPair keyPair;

    @Mock(strictness = LENIENT)
    SecretStore secretStore;

    @Mock(strictness = LENIENT)
    AnnotationStore annotationStore;

    @Mock(strictness = LENIENT)
    ControllerKeySource keySource;

    private final SealRequest request = new SealRequest(Scope.STRICT, "ns", "app", Map.of("b", "3"));

    @BeforeAll
    static void generateKeyPair() throws GeneralSecurityException {
        var generator = KeyPairGenerator.getInstance("RSA");
        generator.initialize(2048);
        keyPair = generator.generateKeyPair();
    }

    @BeforeEach
    void setUp() {
        when(secretStore.getPlaintext(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(Map.of("a", "1", "b", "2")));
        when(annotationStore.getPreserved(anyString(), anyString(), anySet())).thenReturn(CompletableFuture.completedFuture(Map.of("owner", "team-x")));
        when(keySource.currentPublicKey()).thenReturn(CompletableFuture.completedFuture(keyPair.getPublic()));
    }

    private SecretSealer sealer(AnnotationAllowlist allowlist, Duration timeout) {
        return new SecretSealer(secretStore, annotationStore, keySource,
                new SealingPipeline(new HybridEncryptor(), Runnable::run, allowlist), timeout);
    }

    private SecretSealer sealer() {
        return sealer(AnnotationAllowlist.of(Set.of("owner")), TIMEOUT);
    }

    private static PipelineException failure(CompletableFuture<?> future) {
        var e = assertThrows(ExecutionException.class, () -> future.get(10, TimeUnit.SECONDS));
        assertThat(e.getCause()).isInstanceOf(PipelineException.class);
        return (PipelineException) e.getCause();
    }

    private static String open(SealedRecord record, String key) {
        byte[] label = ScopeLabelResolver.resolveLabel(Scope.STRICT, "ns", "app");
        return new String(new HybridDecryptor().open(keyPair.getPrivate(), label, record.encryptedData().get(key)), StandardCharsets.UTF_8);
    }

    @Test
    void shouldSealStoredAndSubmittedValues() throws Exception {
        // When
        var record = sealer().seal(request).get(10, TimeUnit.SECONDS);

        // Then
        assertThat(record.encryptedData()).containsOnlyKeys("a", "b");
        assertThat(open(record, "a")).isEqualTo("1");
        assertThat(open(record, "b")).isEqualTo("3");
        assertThat(record.metadata().annotations()).isEqualTo(Map.of("owner", "team-x"));
        verify(annotationStore).getPreserved("ns", "app", Set.of("owner"));
    }

    @Test
    void shouldFetchPublicKeyOnEveryCall() throws Exception {
        // Given
        var sealer = sealer();

        // When
        sealer.seal(request).get(10, TimeUnit.SECONDS);
        sealer.seal(request).get(10, TimeUnit.SECONDS);

        // Then
        verify(keySource, times(2)).currentPublicKey();
    }

    @Test
    void shouldNotReadAnnotationsWithEmptyAllowlist() throws Exception {
        // When
        var record = sealer(AnnotationAllowlist.none(), TIMEOUT).seal(request).get(10, TimeUnit.SECONDS);

        // Then
        assertThat(record.metadata().annotations()).isEmpty();
        verifyNoInteractions(annotationStore);
    }

    @Test
    void shouldTreatMissingSecretAsEmpty() throws Exception {
        // Given
        when(secretStore.getPlaintext(anyString(), anyString())).thenReturn(CompletableFuture.failedFuture(new NotFoundException("Namespace 'ns' not found")));

        // When
        var record = sealer().seal(request).get(10, TimeUnit.SECONDS);

        // Then
        assertThat(record.encryptedData()).containsOnlyKeys("b");
    }

    @Test
    void shouldTreatMissingSealedRecordAsUnannotated() throws Exception {
        // Given
        when(annotationStore.getPreserved(anyString(), anyString(), anySet())).thenThrow(new NotFoundException("no such sealed secret"));

        // When
        var record = sealer().seal(request).get(10, TimeUnit.SECONDS);

        // Then
        assertThat(record.metadata().annotations()).isEmpty();
    }

    @Test
    void shouldReportSecretStoreFailureAsRetryable() {
        // Given
        when(secretStore.getPlaintext(anyString(), anyString())).thenReturn(CompletableFuture.failedFuture(new CollaboratorException("connection refused")));

        // When
        var e = failure(sealer().seal(request));

        // Then
        assertThat(e.reason()).isEqualTo(PipelineException.Reason.UNAVAILABLE);
        assertThat(e.isRetryable()).isTrue();
        assertThat(e).hasMessage("Failed to read existing secret ns/app");
        assertThat(e.getCause()).hasMessage("connection refused");
    }

    @Test
    void shouldReportAnnotationStoreFailureAsRetryable() {
        // Given
        when(annotationStore.getPreserved(anyString(), anyString(), anySet())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("boom")));

        // When
        var e = failure(sealer().seal(request));

        // Then
        assertThat(e.reason()).isEqualTo(PipelineException.Reason.UNAVAILABLE);
        assertThat(e).hasMessage("Failed to read annotations of sealed secret ns/app");
    }

    @Test
    void shouldReportMissingPublicKey() {
        // Given
        when(keySource.currentPublicKey()).thenReturn(CompletableFuture.failedFuture(new NotFoundException("no cert")));

        // When
        var e = failure(sealer().seal(request));

        // Then
        assertThat(e.reason()).isEqualTo(PipelineException.Reason.NOT_FOUND);
        assertThat(e.isRetryable()).isFalse();
    }

    @Test
    void shouldReportUnusablePublicKey() {
        // Given
        when(keySource.currentPublicKey()).thenReturn(CompletableFuture.failedFuture(new CryptoException("not a certificate")));

        // When
        var e = failure(sealer().seal(request));

        // Then
        assertThat(e.reason()).isEqualTo(PipelineException.Reason.CRYPTO);
        assertThat(e).hasMessage("Controller public key is unusable");
    }

    @Test
    void shouldReportKeySourceThatThrows() {
        // Given
        when(keySource.currentPublicKey()).thenThrow(new IllegalStateException("closed"));

        // When
        var e = failure(sealer().seal(request));

        // Then
        assertThat(e.reason()).isEqualTo(PipelineException.Reason.UNAVAILABLE);
        assertThat(e).hasMessage("Failed to fetch controller public key");
    }

    @Test
    void shouldTimeOutAndAbandonOutstandingReads() {
        // Given
        var pendingKey = new CompletableFuture<PublicKey>();
        when(keySource.currentPublicKey()).thenReturn(pendingKey);

        // When
        var e = failure(sealer(AnnotationAllowlist.none(), Duration.ofMillis(100)).seal(request));

        // Then
        assertThat(e.reason()).isEqualTo(PipelineException.Reason.TIMED_OUT);
        assertThat(e.isRetryable()).isTrue();
        assertThrows(CancellationException.class, () -> pendingKey.get(10, TimeUnit.SECONDS));
    }

    @Test
    void expiryShouldBeDroppedOnceSealCompletes() {
        // Given
        var result = new CompletableFuture<String>();
        var expiry = SecretSealer.expireAfter(result, Duration.ofMinutes(5), "Sealing ns/app did not finish");

        // When
        result.complete("sealed");

        // Then
        assertThat(expiry).isCancelled();
        assertThat(result).isCompletedWithValue("sealed");
    }

    @Test
    void expiryShouldFailPendingSealWithItsMessage() {
        // Given
        var result = new CompletableFuture<String>();

        // When
        SecretSealer.expireAfter(result, Duration.ofMillis(50), "Sealing ns/app did not finish");

        // Then
        var e = failure(result);
        assertThat(e.reason()).isEqualTo(PipelineException.Reason.TIMED_OUT);
        assertThat(e).hasMessage("Sealing ns/app did not finish");
    }

    @Test
    void cancellingShouldAbandonOutstandingReads() {
        // Given
        var pendingSecret = new CompletableFuture<Map<String, String>>();
        when(secretStore.getPlaintext(anyString(), anyString())).thenReturn(pendingSecret);
        var future = sealer().seal(request);

        // When
        future.cancel(false);

        // Then
        assertThat(future).isCancelled();
        assertThat(pendingSecret).isCancelled();
    }

    @Test
    void shouldFailWithoutWaitingForSlowerReads() {
        // Given
        var pendingSecret = new CompletableFuture<Map<String, String>>();
        when(secretStore.getPlaintext(anyString(), anyString())).thenReturn(pendingSecret);
        when(keySource.currentPublicKey()).thenReturn(CompletableFuture.failedFuture(new NotFoundException("no cert")));

        // When
        var e = failure(sealer().seal(request));

        // Then
        assertThat(e.reason()).isEqualTo(PipelineException.Reason.NOT_FOUND);
        assertThat(pendingSecret).isCancelled();
    }

    @Test
    void shouldRejectNonPositiveTimeout() {
        var pipeline = new SealingPipeline(new HybridEncryptor(), Runnable::run, AnnotationAllowlist.none());
        assertThatThrownBy(() -> new SecretSealer(secretStore, annotationStore, keySource, pipeline, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void closeShouldRunCloseAction() {
        // Given
        var closed = new AtomicBoolean();
        var pipeline = new SealingPipeline(new HybridEncryptor(), Runnable::run, AnnotationAllowlist.none());
        var sealer = new SecretSealer(secretStore, annotationStore, keySource, pipeline, TIMEOUT, () -> closed.set(true));

        // When
        sealer.close();

        // Then
        assertThat(closed).isTrue();
        verify(keySource, times(0)).currentPublicKey();
        verifyNoInteractions(secretStore);
    }
}
