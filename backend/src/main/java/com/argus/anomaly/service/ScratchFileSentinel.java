package com.argus.anomaly.service;

import com.argus.anomaly.exception.CleanupException;
import com.argus.anomaly.model.UploadJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns a job's scratch file and removes it exactly once, whichever way the job ends.
 * Closing never throws: a failed delete is logged and the job still counts as cleaned.
 */
public class ScratchFileSentinel implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ScratchFileSentinel.class);

    private final UploadJob job;
    private final AtomicBoolean released = new AtomicBoolean();

    public ScratchFileSentinel(UploadJob job) {
        this.job = job;
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (!released.compareAndSet(false, true)) {
            return;
        }
        Path path = job.getScratchPath();
        try {
            if (Files.deleteIfExists(path)) {
                logger.info("Job {}: cleaned up temporary file {}", job.getId(), path);
            } else {
                logger.info("Job {}: temporary file {} was already gone", job.getId(), path);
            }
        } catch (IOException | SecurityException e) {
            CleanupException failure = new CleanupException(path, e);
            logger.warn("Job {}: could not remove scratch file {}", job.getId(), failure.getPath(), failure);
        }
        if (job.getState().isTerminal()) {
            job.markCleaned();
        } else {
            logger.warn("Job {}: scratch file released while job is still {}", job.getId(), job.getState());
        }
    }
}
