package com.starscape.mentana.features.files.app;

import com.starscape.mentana.common.domain.Result;
import com.starscape.mentana.common.exception.DomainError;
import com.starscape.mentana.features.files.domain.FileStorage;
import com.starscape.mentana.features.files.domain.ProbeUpload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Writes a small text object to file storage and checks that it exists afterwards.
 * Used to verify end-to-end access to the bucket from a running instance.
 */
@Service
public class UploadProbeFileHandler {

    static final String OPERATION = "uploadProbeFile";
    static final String KEY_PREFIX = "probe-files/";
    static final String CONTENT_TYPE = "text/plain";

    private static final Logger log = LoggerFactory.getLogger(UploadProbeFileHandler.class);

    private final FileStorage fileStorage;
    private final Clock clock;

    @Autowired
    public UploadProbeFileHandler(FileStorage fileStorage) {
        this(fileStorage, Clock.systemUTC());
    }

    UploadProbeFileHandler(FileStorage fileStorage, Clock clock) {
        this.fileStorage = fileStorage;
        this.clock = clock;
    }

    public Result<ProbeUpload> handle() {
        String key = KEY_PREFIX + "probe-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8) + ".txt";
        byte[] content = ("Probe file created at " + Instant.now(clock)).getBytes(StandardCharsets.UTF_8);

        Result<ProbeUpload> result = fileStorage.put(key, content, CONTENT_TYPE)
                .flatMap(location -> fileStorage.exists(key)
                        .flatMap(exists -> exists
                                ? Result.<ProbeUpload>success(new ProbeUpload(key, location, content.length, true))
                                : Result.<ProbeUpload>failure(DomainError.unavailable(
                                        "Probe file " + key + " was not readable after upload"))))
                .withOperation(OPERATION);
        if (result.isSuccess()) {
            log.info("Probe file uploaded: key={}, location={}", key, result.value().location());
        }
        return result;
    }
}
