package com.argus.anomaly.worker;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Event log of a single worker process.
 * <p>
 * The process exit and the closing of its two pipes arrive on different threads and in no fixed
 * order. Output is released by {@link #toRawOutput()} only once the run is worker-complete:
 * both streams closed and the exit observed.
 */
public class WorkerRun {

    public enum Stream {
        STDOUT,
        STDERR
    }

    public enum Event {
        STARTED,
        OUTPUT_CHUNK,
        STREAMS_CLOSED,
        PROCESS_EXITED
    }

    private final UUID jobId;
    private final Map<Stream, ByteArrayOutputStream> buffers = new EnumMap<>(Stream.class);
    private final Set<Stream> closedStreams = EnumSet.noneOf(Stream.class);
    private final Set<Event> events = EnumSet.noneOf(Event.class);
    private Integer exitCode;

    public WorkerRun(UUID jobId) {
        this.jobId = jobId;
        for (Stream stream : Stream.values()) {
            buffers.put(stream, new ByteArrayOutputStream());
        }
    }

    public UUID getJobId() {
        return jobId;
    }

    public synchronized void started() {
        events.add(Event.STARTED);
    }

    public synchronized void outputChunk(Stream stream, byte[] bytes, int offset, int length) {
        if (closedStreams.contains(stream)) {
            throw new IllegalStateException(stream + " already closed for job " + jobId);
        }
        buffers.get(stream).write(bytes, offset, length);
        events.add(Event.OUTPUT_CHUNK);
    }

    public synchronized void streamClosed(Stream stream) {
        closedStreams.add(stream);
        if (closedStreams.size() == Stream.values().length) {
            events.add(Event.STREAMS_CLOSED);
        }
    }

    public synchronized void processExited(int code) {
        if (exitCode != null) {
            throw new IllegalStateException("Exit already recorded for job " + jobId);
        }
        exitCode = code;
        events.add(Event.PROCESS_EXITED);
    }

    public synchronized boolean isStarted() {
        return events.contains(Event.STARTED);
    }

    public synchronized boolean hasSeen(Event event) {
        return events.contains(event);
    }

    public synchronized boolean isWorkerComplete() {
        return events.contains(Event.STARTED)
                && events.contains(Event.STREAMS_CLOSED)
                && events.contains(Event.PROCESS_EXITED);
    }

    public synchronized String text(Stream stream) {
        return buffers.get(stream).toString(StandardCharsets.UTF_8);
    }

    public synchronized RawWorkerOutput toRawOutput() {
        if (!isWorkerComplete()) {
            throw new IllegalStateException("Worker for job " + jobId + " has not completed: " + events);
        }
        return new RawWorkerOutput(exitCode, text(Stream.STDOUT), text(Stream.STDERR));
    }
}
