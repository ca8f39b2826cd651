package com.starscape.mentana.features.files.domain;

import com.starscape.mentana.common.domain.Result;
import com.starscape.mentana.common.health.LivenessProbe;

/**
 * Object storage port. Failures are UNAVAILABLE, PERMISSION_DENIED or VALIDATION.
 * Retry policy, if any, belongs to the adapter's client.
 */
public interface FileStorage extends LivenessProbe {

    /**
     * Stores the bytes under the key, replacing any existing object.
     *
     * @return location of the stored object
     */
    Result<String> put(String key, byte[] content, String contentType);

    /**
     * A missing object is {@code false}, not a failure.
     */
    Result<Boolean> exists(String key);

    /**
     * @return {@code true} once the key no longer exists, including when it never did
     */
    Result<Boolean> delete(String key);

    String locationOf(String key);
}
