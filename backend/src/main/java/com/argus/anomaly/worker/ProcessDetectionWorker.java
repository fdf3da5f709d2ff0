package com.argus.anomaly.worker;

import com.argus.anomaly.config.DetectionProperties;
import com.argus.anomaly.exception.WorkerFailedException;
import com.argus.anomaly.exception.WorkerStartupException;
import com.argus.anomaly.exception.WorkerTimeoutException;
import org.apache.commons.exec.CommandLine;
import org.apache.commons.exec.DefaultExecutor;
import org.apache.commons.exec.ExecuteException;
import org.apache.commons.exec.ExecuteWatchdog;
import org.apache.commons.exec.PumpStreamHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Launches the detection script as a child process:
 * {@code <executable> [script] <input video> <frame output dir>}.
 * <p>
 * Both pipes are pumped on their own threads while the process runs, so a chatty stderr can
 * never block a worker that is still writing stdout. A {@link ForcibleWatchdog} kills the
 * process and its children once the invocation's timeout elapses.
 */
@Component
public class ProcessDetectionWorker implements DetectionWorker {

    private static final Logger logger = LoggerFactory.getLogger(ProcessDetectionWorker.class);

    private final String executable;
    private final String script;
    private final Duration stopTimeout;

    public ProcessDetectionWorker(DetectionProperties properties) {
        DetectionProperties.Worker worker = properties.getWorker();
        this.executable = worker.getExecutable();
        this.script = worker.getScript();
        this.stopTimeout = worker.getStopTimeout();
    }

    @Override
    public RawWorkerOutput submit(WorkerInvocation invocation) {
        CommandLine cmdLine = buildCommand(invocation);
        prepareOutputDirectory(invocation.getOutputDir());

        WorkerRun run = new WorkerRun(invocation.getJobId());
        WorkerStreamSink stdout = new WorkerStreamSink(run, WorkerRun.Stream.STDOUT);
        WorkerStreamSink stderr = new WorkerStreamSink(run, WorkerRun.Stream.STDERR);

        PumpStreamHandler streamHandler = new PumpStreamHandler(stdout, stderr);
        streamHandler.setStopTimeout(stopTimeout.toMillis());
        ExecuteWatchdog watchdog = new ForcibleWatchdog(invocation.getTimeout().toMillis());

        DefaultExecutor executor = new DefaultExecutor() {
            @Override
            protected Process launch(CommandLine command, Map<String, String> env, File dir) throws IOException {
                Process process = super.launch(command, env, dir);
                run.started();
                return process;
            }
        };
        executor.setStreamHandler(streamHandler);
        executor.setWatchdog(watchdog);
        // Exit codes are interpreted by the orchestrator, not by commons-exec
        executor.setExitValues(null);

        logger.info("Job {}: executing {}", invocation.getJobId(), cmdLine);
        int exitValue;
        try {
            exitValue = executor.execute(cmdLine);
        } catch (ExecuteException e) {
            if (watchdog.killedProcess()) {
                throw timedOut(invocation);
            }
            throw new WorkerFailedException(e.getExitValue(), diagnostics(run, e));
        } catch (IOException e) {
            if (watchdog.killedProcess()) {
                throw timedOut(invocation);
            }
            if (!run.isStarted()) {
                throw new WorkerStartupException("Failed to start video processing script.", e);
            }
            throw new WorkerFailedException(-1, diagnostics(run, e));
        } finally {
            stdout.close();
            stderr.close();
        }

        if (watchdog.killedProcess()) {
            throw timedOut(invocation);
        }
        run.processExited(exitValue);
        logger.info("Job {}: worker exited with code {}", invocation.getJobId(), exitValue);
        return run.toRawOutput();
    }

    private WorkerTimeoutException timedOut(WorkerInvocation invocation) {
        logger.error("Job {}: worker exceeded {} ms and was terminated",
                invocation.getJobId(), invocation.getTimeout().toMillis());
        return new WorkerTimeoutException(invocation.getTimeout());
    }

    private static String diagnostics(WorkerRun run, IOException e) {
        String stderr = run.text(WorkerRun.Stream.STDERR);
        return stderr.isEmpty() ? e.getMessage() : stderr + System.lineSeparator() + e.getMessage();
    }

    CommandLine buildCommand(WorkerInvocation invocation) {
        CommandLine cmdLine = new CommandLine(executable);
        if (script != null && !script.isBlank()) {
            Path scriptPath = Path.of(script).toAbsolutePath();
            if (!Files.isRegularFile(scriptPath)) {
                logger.error("Detection script not found at {}", scriptPath);
                throw new WorkerStartupException("Detection script not found or accessible on server.");
            }
            cmdLine.addArgument(scriptPath.toString(), false);
        }
        cmdLine.addArgument(invocation.getInputPath().toAbsolutePath().toString(), false);
        cmdLine.addArgument(invocation.getOutputDir().toAbsolutePath().toString(), false);
        return cmdLine;
    }

    private void prepareOutputDirectory(Path outputDir) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            logger.error("Failed to ensure frame directory {} exists", outputDir, e);
            throw new WorkerStartupException("Could not prepare frame storage directory.", e);
        }
    }
}
