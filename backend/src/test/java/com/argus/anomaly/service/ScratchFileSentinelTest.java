package com.argus.anomaly.service;

import com.argus.anomaly.model.FailureReason;
import com.argus.anomaly.model.JobState;
import com.argus.anomaly.model.UploadJob;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

public class ScratchFileSentinelTest {

    @TempDir
    Path tempDir;

    @Test
    public void testClose_DeletesFileAndMarksJobCleaned() throws IOException {
        UploadJob job = job(Files.writeString(tempDir.resolve("video-1.mp4"), "bytes"));
        job.startProcessing();
        job.complete(false);

        try (ScratchFileSentinel sentinel = new ScratchFileSentinel(job)) {
            assertFalse(sentinel.isReleased());
        }

        assertFalse(Files.exists(job.getScratchPath()));
        assertEquals(JobState.CLEANED, job.getState());
        assertEquals(JobState.NO_ANOMALY, job.getTerminalState());
    }

    @Test
    public void testClose_RunsOnlyOnce() throws IOException {
        UploadJob job = job(Files.writeString(tempDir.resolve("video-2.mp4"), "bytes"));
        job.fail(FailureReason.TIMEOUT);
        ScratchFileSentinel sentinel = new ScratchFileSentinel(job);

        sentinel.close();
        // A file reappearing at the same path is not ours any more
        Files.writeString(job.getScratchPath(), "someone else's");
        sentinel.close();

        assertTrue(Files.exists(job.getScratchPath()));
        assertTrue(sentinel.isReleased());
        assertEquals(JobState.CLEANED, job.getState());
    }

    @Test
    public void testClose_MissingFileIsNotAnError() {
        UploadJob job = job(tempDir.resolve("never-written.mp4"));
        job.fail(FailureReason.WORKER_STARTUP);

        assertDoesNotThrow(() -> new ScratchFileSentinel(job).close());
        assertEquals(JobState.CLEANED, job.getState());
    }

    @Test
    public void testClose_UndeletableFileIsLoggedNotThrown() throws IOException {
        // A non-empty directory cannot be removed with a plain delete
        Path dir = Files.createDirectory(tempDir.resolve("stuck"));
        Files.writeString(dir.resolve("child"), "x");
        UploadJob job = job(dir);
        job.fail(FailureReason.WORKER_ERROR);

        assertDoesNotThrow(() -> new ScratchFileSentinel(job).close());
        assertEquals(JobState.CLEANED, job.getState());
    }

    @Test
    @ExtendWith(OutputCaptureExtension.class)
    public void testClose_FailureLogNamesTheScratchFile(CapturedOutput output) throws IOException {
        Path dir = Files.createDirectory(tempDir.resolve("held"));
        Files.writeString(dir.resolve("child"), "x");
        UploadJob job = job(dir);
        job.fail(FailureReason.TIMEOUT);

        new ScratchFileSentinel(job).close();

        assertTrue(output.getOut().contains("could not remove scratch file " + dir));
    }

    private UploadJob job(Path path) {
        return new UploadJob(UUID.randomUUID(), path, "clip.mp4", Instant.now());
    }
}
