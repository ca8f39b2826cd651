package com.starscape.mentana.features.files.domain;

/**
 * What a probe-file upload wrote and whether it could be read back.
 */
public record ProbeUpload(
    String key,
    String location,
    int contentLength,
    boolean verified
) {
}
