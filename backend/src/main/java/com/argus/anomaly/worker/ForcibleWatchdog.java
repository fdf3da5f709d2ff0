package com.argus.anomaly.worker;

import org.apache.commons.exec.ExecuteWatchdog;
import org.apache.commons.exec.Watchdog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

/**
 * {@link ExecuteWatchdog} that does not stop at {@link Process#destroy()}: once the timeout fires,
 * the worker and every process it spawned are killed with {@link Process#destroyForcibly()}, so a
 * worker that ignores SIGTERM still ends on time.
 */
class ForcibleWatchdog extends ExecuteWatchdog {

    private static final Logger logger = LoggerFactory.getLogger(ForcibleWatchdog.class);

    private Process process;

    ForcibleWatchdog(long timeoutMillis) {
        super(timeoutMillis);
    }

    @Override
    public synchronized void start(Process processToMonitor) {
        this.process = processToMonitor;
        super.start(processToMonitor);
    }

    @Override
    public synchronized void timeoutOccured(Watchdog w) {
        Process target = process;
        // Collected before the parent dies; orphans are no longer reachable as descendants
        List<ProcessHandle> descendants = target == null
                ? List.of()
                : target.descendants().collect(Collectors.toList());
        super.timeoutOccured(w);
        if (target == null || !killedProcess()) {
            return;
        }
        logger.debug("Force-killing worker pid {} and {} descendant(s)", target.pid(), descendants.size());
        descendants.forEach(ProcessHandle::destroyForcibly);
        target.destroyForcibly();
    }
}
