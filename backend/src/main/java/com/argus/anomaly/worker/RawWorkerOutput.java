package com.argus.anomaly.worker;

import lombok.Value;

/** Everything a worker produced before exiting on its own. */
@Value
public class RawWorkerOutput {
    int exitCode;
    String stdout;
    String stderr;

    public boolean isSuccess() {
        return exitCode == 0;
    }
}
