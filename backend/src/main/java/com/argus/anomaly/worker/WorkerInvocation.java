package com.argus.anomaly.worker;

import lombok.Value;

import java.nio.file.Path;
import java.time.Duration;
import java.util.UUID;

@Value
public class WorkerInvocation {
    UUID jobId;
    /** Video to analyse; passed as the worker's first positional argument. */
    Path inputPath;
    /** Directory the worker saves detection frames into; second positional argument. */
    Path outputDir;
    Duration timeout;
}
