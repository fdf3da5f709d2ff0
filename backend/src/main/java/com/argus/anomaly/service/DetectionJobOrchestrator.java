package com.argus.anomaly.service;

import com.argus.anomaly.config.AsyncConfig;
import com.argus.anomaly.config.DetectionProperties;
import com.argus.anomaly.exception.ContractViolationException;
import com.argus.anomaly.exception.DetectionPipelineException;
import com.argus.anomaly.exception.WorkerFailedException;
import com.argus.anomaly.model.AlertWriteResult;
import com.argus.anomaly.model.DetectionOutput;
import com.argus.anomaly.model.DetectionResult;
import com.argus.anomaly.model.FailureReason;
import com.argus.anomaly.model.JobOutcome;
import com.argus.anomaly.model.UploadJob;
import com.argus.anomaly.worker.DetectionWorker;
import com.argus.anomaly.worker.RawWorkerOutput;
import com.argus.anomaly.worker.WorkerInvocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Drives one upload from {@code RECEIVED} to {@code CLEANED}: runs the worker off the request
 * thread, interprets its output, records the alert and releases the scratch file.
 * <p>
 * The returned future only completes after the scratch file has been released, so a response
 * built from it is never sent while the file still exists. Failures complete the future with the
 * matching {@link DetectionPipelineException}.
 */
@Service
public class DetectionJobOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(DetectionJobOrchestrator.class);

    private final DetectionWorker detectionWorker;
    private final DetectionResultParser resultParser;
    private final AlertPersistenceService alertPersistenceService;
    private final FrameStorageService frameStorageService;
    private final Executor detectionExecutor;
    private final Duration workerTimeout;

    public DetectionJobOrchestrator(DetectionWorker detectionWorker,
                                    DetectionResultParser resultParser,
                                    AlertPersistenceService alertPersistenceService,
                                    FrameStorageService frameStorageService,
                                    @Qualifier(AsyncConfig.DETECTION_EXECUTOR) Executor detectionExecutor,
                                    DetectionProperties properties) {
        this.detectionWorker = detectionWorker;
        this.resultParser = resultParser;
        this.alertPersistenceService = alertPersistenceService;
        this.frameStorageService = frameStorageService;
        this.detectionExecutor = detectionExecutor;
        this.workerTimeout = properties.getWorker().getTimeout();
    }

    public CompletableFuture<JobOutcome> process(UploadJob job) {
        ScratchFileSentinel sentinel = new ScratchFileSentinel(job);
        CompletableFuture<JobOutcome> execution;
        try {
            execution = CompletableFuture.supplyAsync(() -> execute(job), detectionExecutor);
        } catch (RuntimeException e) {
            logger.error("Job {}: could not be scheduled", job.getId(), e);
            job.fail(FailureReason.UNEXPECTED);
            sentinel.close();
            return CompletableFuture.failedFuture(e);
        }
        return execution.whenComplete((outcome, error) -> sentinel.close());
    }

    JobOutcome execute(UploadJob job) {
        job.startProcessing();
        logger.info("Job {}: processing {}", job.getId(), job.getScratchPath().getFileName());
        try {
            JobOutcome outcome = run(job);
            job.complete(outcome.isAnomalyDetected());
            logger.info("Job {}: finished as {}", job.getId(), job.getState());
            return outcome;
        } catch (DetectionPipelineException e) {
            job.fail(e.getFailureReason());
            logger.error("Job {}: failed with {}: {}", job.getId(), e.getFailureReason(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            job.fail(FailureReason.UNEXPECTED);
            logger.error("Job {}: failed unexpectedly", job.getId(), e);
            throw e;
        }
    }

    private JobOutcome run(UploadJob job) {
        WorkerInvocation invocation = new WorkerInvocation(
                job.getId(), job.getScratchPath(), frameStorageService.getDirectory(), workerTimeout);

        RawWorkerOutput output = detectionWorker.submit(invocation);
        if (!output.isSuccess()) {
            if (output.getStderr() != null && !output.getStderr().isBlank()) {
                logger.error("Job {}: worker stderr:\n{}", job.getId(), output.getStderr());
            }
            throw new WorkerFailedException(output.getExitCode(), output.getStderr());
        }

        DetectionResult result = resultParser.parse(output.getStdout());
        if (result.getKind() == DetectionResult.Kind.NO_DETECTION) {
            logger.info("Job {}: no anomaly reported by worker", job.getId());
            return JobOutcome.noAnomaly(job.getId());
        }
        if (result.getKind() == DetectionResult.Kind.CONTRACT_VIOLATION) {
            throw new ContractViolationException(result.getViolation(), result.getRawOutput());
        }

        DetectionOutput payload = result.getPayload();
        if (!frameStorageService.contains(payload.getFrameKey())) {
            logger.warn("Job {}: frame {} reported by worker is not in {}",
                    job.getId(), payload.getFrameKey(), frameStorageService.getDirectory());
        }
        AlertWriteResult written = alertPersistenceService.record(payload);
        return JobOutcome.recorded(job.getId(), written.getAlert(), !written.isCreated());
    }
}
