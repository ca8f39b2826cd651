package com.starscape.mentana.features.files.app;

import com.starscape.mentana.common.domain.Result;
import com.starscape.mentana.common.exception.DomainError;
import com.starscape.mentana.common.exception.ErrorKind;
import com.starscape.mentana.features.files.domain.FileStorage;
import com.starscape.mentana.features.files.domain.ProbeUpload;
import com.starscape.mentana.features.files.infra.InMemoryFileStorage;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class UploadProbeFileHandlerTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    @Test
    void uploadsUnderProbePrefixAndVerifies() {
        InMemoryFileStorage storage = new InMemoryFileStorage("bucket");
        UploadProbeFileHandler handler = new UploadProbeFileHandler(storage, clock);

        ProbeUpload upload = handler.handle().value();

        assertTrue(upload.key().matches("probe-files/probe-[0-9a-f]{8}\\.txt"), upload.key());
        assertTrue(upload.verified());
        assertEquals(storage.locationOf(upload.key()), upload.location());
        InMemoryFileStorage.StoredObject stored = storage.get(upload.key()).orElseThrow();
        assertEquals("text/plain", stored.contentType());
        assertEquals("Probe file created at 2024-05-01T10:00:00Z",
                new String(stored.content(), StandardCharsets.UTF_8));
        assertEquals(stored.content().length, upload.contentLength());
    }

    @Test
    void storageFailureCarriesOperation() {
        FileStorage storage = mock(FileStorage.class);
        when(storage.put(anyString(), any(byte[].class), anyString()))
                .thenReturn(Result.failure(DomainError.of(ErrorKind.PERMISSION_DENIED, "Access Denied")));

        Result<ProbeUpload> result = new UploadProbeFileHandler(storage, clock).handle();

        assertEquals(ErrorKind.PERMISSION_DENIED, result.error().kind());
        assertEquals(UploadProbeFileHandler.OPERATION, result.error().operation());
    }

    @Test
    void objectMissingAfterUploadIsUnavailable() {
        FileStorage storage = mock(FileStorage.class);
        when(storage.put(anyString(), any(byte[].class), anyString())).thenReturn(Result.success("loc"));
        when(storage.exists(anyString())).thenReturn(Result.success(false));

        Result<ProbeUpload> result = new UploadProbeFileHandler(storage, clock).handle();

        assertEquals(ErrorKind.UNAVAILABLE, result.error().kind());
    }
}
