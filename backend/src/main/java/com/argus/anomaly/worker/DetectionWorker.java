package com.argus.anomaly.worker;

/**
 * Runs detection over one staged video.
 * <p>
 * Implementations block until the worker has finished and must enforce
 * {@link WorkerInvocation#getTimeout()} themselves: a worker that overruns is terminated and
 * {@link com.argus.anomaly.exception.WorkerTimeoutException} is thrown, with no output returned.
 * A worker that cannot be launched raises {@link com.argus.anomaly.exception.WorkerStartupException}.
 * A worker that exits nonzero is <em>not</em> an exception here; the caller inspects the exit code.
 */
public interface DetectionWorker {

    RawWorkerOutput submit(WorkerInvocation invocation);
}
