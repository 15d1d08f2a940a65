package com.boardrag.pipeline.service;

import com.boardrag.pipeline.Fixtures;
import com.boardrag.pipeline.exception.IntegrityMismatchException;
import com.boardrag.pipeline.exception.StorageException;
import com.boardrag.pipeline.infra.ObjectStat;
import com.boardrag.pipeline.infra.ObjectStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VerifiedUploaderTest {

    private static final String KEY = "k1.pdf";

    @Mock
    private ObjectStore objectStore;

    @TempDir
    Path tempDir;

    private VerifiedUploader uploader;
    private Path source;

    @BeforeEach
    void setUp() throws IOException {
        uploader = new VerifiedUploader(objectStore, Fixtures.fastTaskProperties());
        source = Files.write(tempDir.resolve(KEY), new byte[] {1, 2, 3, 4, 5});
    }

    @Test
    @DisplayName("Should upload once and verify the stored size")
    void shouldUploadAndVerify() {
        when(objectStore.stat(KEY)).thenReturn(Optional.of(new ObjectStat(KEY, 5, "application/pdf")));

        UploadReceipt receipt = uploader.upload(KEY, source, "application/pdf");

        assertThat(receipt.size()).isEqualTo(5);
        assertThat(receipt.uploadAttempts()).isEqualTo(1);
        assertThat(receipt.validationAttempts()).isEqualTo(1);
        verify(objectStore).put(KEY, source, "application/pdf");
    }

    @Test
    @DisplayName("Should retry a failing put and count the attempts")
    void shouldRetryPut() {
        doThrow(new StorageException(KEY, "connection reset"))
            .doThrow(new StorageException(KEY, "connection reset"))
            .doNothing()
            .when(objectStore).put(KEY, source, "application/pdf");
        when(objectStore.stat(KEY)).thenReturn(Optional.of(new ObjectStat(KEY, 5, "application/pdf")));

        assertThat(uploader.upload(KEY, source, "application/pdf").uploadAttempts()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should fail with an integrity mismatch when the stored size never matches")
    void shouldFailOnSizeMismatch() {
        doNothing().when(objectStore).put(KEY, source, "application/pdf");
        when(objectStore.stat(KEY)).thenReturn(Optional.of(new ObjectStat(KEY, 4, "application/pdf")));

        assertThatThrownBy(() -> uploader.upload(KEY, source, "application/pdf"))
            .isInstanceOf(IntegrityMismatchException.class)
            .satisfies(e -> {
                IntegrityMismatchException mismatch = (IntegrityMismatchException) e;
                assertThat(mismatch.getExpectedSize()).isEqualTo(5);
                assertThat(mismatch.getActualSize()).isEqualTo(4);
            });
        verify(objectStore, times(3)).stat(KEY);
    }

    @Test
    @DisplayName("Should give up after the last put attempt fails")
    void shouldGiveUpAfterRetries() {
        doThrow(new StorageException(KEY, "down")).when(objectStore).put(KEY, source, "text/plain");

        assertThatThrownBy(() -> uploader.upload(KEY, source, "text/plain")).isInstanceOf(StorageException.class);
        verify(objectStore, times(3)).put(KEY, source, "text/plain");
    }

    @Test
    @DisplayName("Should guess content types from the filename")
    void shouldGuessContentType() {
        assertThat(VerifiedUploader.contentTypeFor("report.pdf")).isEqualTo("application/pdf");
        assertThat(VerifiedUploader.contentTypeFor("unknown.zzz")).isEqualTo("application/octet-stream");
    }
}
