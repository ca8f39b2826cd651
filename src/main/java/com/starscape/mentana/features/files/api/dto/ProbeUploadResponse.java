package com.starscape.mentana.features.files.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.starscape.mentana.features.files.domain.ProbeUpload;

public record ProbeUploadResponse(
    String key,
    String location,
    @JsonProperty("content_length") int contentLength,
    boolean verified
) {

    public static ProbeUploadResponse from(ProbeUpload upload) {
        return new ProbeUploadResponse(upload.key(), upload.location(), upload.contentLength(), upload.verified());
    }
}
