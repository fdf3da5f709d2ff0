package com.argus.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings for the upload-to-alert pipeline, bound from {@code app.detection.*}.
 * <p>
 * Injected into each component at construction; nothing reads these values statically.
 */
@Data
@ConfigurationProperties(prefix = "app.detection")
public class DetectionProperties {

    private final Worker worker = new Worker();
    private final Storage storage = new Storage();
    private final Upload upload = new Upload();
    private final Errors errors = new Errors();

    @Data
    public static class Worker {
        /** Interpreter or binary launched for every job. */
        private String executable = "python3";
        /** Script handed to the executable; blank means the executable is the worker itself. */
        private String script = "python/detect.py";
        private Duration timeout = Duration.ofMinutes(5);
        /** Detection threads kept alive between jobs. Extra threads are started on demand. */
        private int threads = 4;
        /** How long to wait for the stream pumps to drain after the process is gone. */
        private Duration stopTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Storage {
        private Path uploadDir = Path.of("uploads");
        private Path frameDir = Path.of("frames");
        private String frameUrlPrefix = "/frames/";
    }

    @Data
    public static class Upload {
        private DataSize maxSize = DataSize.ofMegabytes(100);
        private List<String> allowedContentTypes = new ArrayList<>(List.of("video/"));
    }

    @Data
    public static class Errors {
        private boolean exposeStackTraces = false;
    }
}
