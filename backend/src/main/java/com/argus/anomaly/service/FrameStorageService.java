package com.argus.anomaly.service;

import com.argus.anomaly.config.DetectionProperties;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Local-disk view of the frame artifact directory. The pipeline never writes frames itself;
 * it hands this directory to the worker and links alerts to the keys the worker reports.
 */
@Service
public class FrameStorageService {

    private final Path directory;
    private final String urlPrefix;

    public FrameStorageService(DetectionProperties properties) {
        this.directory = properties.getStorage().getFrameDir().toAbsolutePath();
        String prefix = properties.getStorage().getFrameUrlPrefix();
        this.urlPrefix = prefix.endsWith("/") ? prefix : prefix + "/";
    }

    public Path getDirectory() {
        return directory;
    }

    public boolean contains(String key) {
        return Files.isRegularFile(directory.resolve(key));
    }

    public String urlFor(String key) {
        if (key == null) {
            return null;
        }
        return urlPrefix + UriUtils.encodePathSegment(key, StandardCharsets.UTF_8);
    }
}
