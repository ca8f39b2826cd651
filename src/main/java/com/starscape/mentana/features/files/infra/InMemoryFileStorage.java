package com.starscape.mentana.features.files.infra;

import com.starscape.mentana.common.domain.Result;
import com.starscape.mentana.common.exception.DomainError;
import com.starscape.mentana.common.health.ProbeResult;
import com.starscape.mentana.features.files.domain.FileStorage;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link FileStorage} held in a concurrent map. For tests and local runs without S3.
 */
public class InMemoryFileStorage implements FileStorage {

    private final Map<String, StoredObject> objects = new ConcurrentHashMap<>();
    private final String bucket;

    public InMemoryFileStorage(String bucket) {
        this.bucket = bucket;
    }

    @Override
    public Result<String> put(String key, byte[] content, String contentType) {
        if (key == null || key.isBlank()) {
            return Result.failure(DomainError.validation("Object key is required"));
        }
        if (content == null) {
            return Result.failure(DomainError.validation("Object content is required"));
        }
        objects.put(key, new StoredObject(Arrays.copyOf(content, content.length), contentType));
        return Result.success(locationOf(key));
    }

    @Override
    public Result<Boolean> exists(String key) {
        return Result.success(key != null && objects.containsKey(key));
    }

    @Override
    public Result<Boolean> delete(String key) {
        if (key == null || key.isBlank()) {
            return Result.failure(DomainError.validation("Object key is required"));
        }
        objects.remove(key);
        return Result.success(true);
    }

    @Override
    public String locationOf(String key) {
        return "memory://" + bucket + "/" + key;
    }

    @Override
    public ProbeResult probe() {
        return ProbeResult.reachable("in-memory bucket " + bucket + ", " + objects.size() + " objects");
    }

    public Optional<StoredObject> get(String key) {
        return Optional.ofNullable(objects.get(key));
    }

    public record StoredObject(byte[] content, String contentType) {
    }
}
