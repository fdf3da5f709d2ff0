package com.argus.anomaly.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Receives one of the worker's pipes from a commons-exec pump thread.
 * Bytes are recorded on the {@link WorkerRun} as they arrive; complete lines are echoed to the log.
 */
class WorkerStreamSink extends OutputStream {

    private static final Logger logger = LoggerFactory.getLogger(WorkerStreamSink.class);

    private final WorkerRun run;
    private final WorkerRun.Stream stream;
    private final ByteArrayOutputStream line = new ByteArrayOutputStream();
    private boolean closed;

    WorkerStreamSink(WorkerRun run, WorkerRun.Stream stream) {
        this.run = run;
        this.stream = stream;
    }

    @Override
    public void write(int b) {
        write(new byte[]{(byte) b}, 0, 1);
    }

    @Override
    public synchronized void write(byte[] bytes, int offset, int length) {
        run.outputChunk(stream, bytes, offset, length);
        for (int i = offset; i < offset + length; i++) {
            if (bytes[i] == '\n') {
                logLine();
            } else {
                line.write(bytes[i]);
            }
        }
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (line.size() > 0) {
            logLine();
        }
        run.streamClosed(stream);
    }

    private void logLine() {
        if (logger.isDebugEnabled()) {
            String text = line.toString(StandardCharsets.UTF_8).stripTrailing();
            logger.debug("[Job {} {}]: {}", run.getJobId(), stream, text);
        }
        line.reset();
    }
}
