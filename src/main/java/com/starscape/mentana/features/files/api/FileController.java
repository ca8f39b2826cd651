package com.starscape.mentana.features.files.api;

import com.starscape.mentana.features.files.api.dto.ProbeUploadResponse;
import com.starscape.mentana.features.files.app.UploadProbeFileHandler;
import com.starscape.mentana.features.files.domain.ProbeUpload;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/files")
public class FileController {

    private final UploadProbeFileHandler uploadProbeFileHandler;

    public FileController(UploadProbeFileHandler uploadProbeFileHandler) {
        this.uploadProbeFileHandler = uploadProbeFileHandler;
    }

    /**
     * Upload a generated text file and confirm it can be found again.
     * POST /files/probe
     */
    @PostMapping("/probe")
    public ResponseEntity<ProbeUploadResponse> uploadProbeFile() {
        ProbeUpload upload = uploadProbeFileHandler.handle().orElseThrow();
        return ResponseEntity.status(HttpStatus.CREATED).body(ProbeUploadResponse.from(upload));
    }
}
