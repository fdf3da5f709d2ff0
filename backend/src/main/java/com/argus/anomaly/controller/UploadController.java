package com.argus.anomaly.controller;

import com.argus.anomaly.dto.AlertView;
import com.argus.anomaly.dto.UploadResponse;
import com.argus.anomaly.model.JobOutcome;
import com.argus.anomaly.model.UploadJob;
import com.argus.anomaly.service.DetectionJobOrchestrator;
import com.argus.anomaly.service.FrameStorageService;
import com.argus.anomaly.service.UploadIngestionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@CrossOrigin(origins = "*") // Allow React Frontend
public class UploadController {

    private final UploadIngestionService ingestionService;
    private final DetectionJobOrchestrator orchestrator;
    private final FrameStorageService frameStorageService;

    /**
     * Stages the video and answers once detection has finished: 201 with the alert when an
     * anomaly was recorded, 200 otherwise. The servlet thread is released while the worker runs.
     */
    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public CompletableFuture<ResponseEntity<UploadResponse>> upload(
            @RequestParam(value = "video", required = false) MultipartFile video) {
        UploadJob job = ingestionService.receive(video);
        return orchestrator.process(job).thenApply(this::toResponse);
    }

    ResponseEntity<UploadResponse> toResponse(JobOutcome outcome) {
        if (!outcome.isAnomalyDetected()) {
            return ResponseEntity.ok(UploadResponse.noAnomaly());
        }
        AlertView alert = AlertView.of(outcome.getAlert(),
                frameStorageService.urlFor(outcome.getAlert().getFrameStorageKey()));
        if (outcome.isDuplicate()) {
            return ResponseEntity.ok(UploadResponse.alreadyRecorded(alert));
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(UploadResponse.created(alert));
    }
}
