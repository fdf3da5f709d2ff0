package com.argus.anomaly.service;

import com.argus.anomaly.config.DetectionProperties;
import com.argus.anomaly.exception.ValidationException;
import com.argus.anomaly.model.UploadJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Accepts an uploaded video, checks it against the configured limits and stages it as a
 * uniquely named scratch file. Nothing is written when a check fails.
 */
@Service
public class UploadIngestionService {

    private static final Logger logger = LoggerFactory.getLogger(UploadIngestionService.class);

    private static final Pattern SAFE_EXTENSION = Pattern.compile("[A-Za-z0-9]{1,10}");

    private final Path uploadDir;
    private final long maxBytes;
    private final List<String> allowedContentTypes;

    public UploadIngestionService(DetectionProperties properties) {
        this.uploadDir = properties.getStorage().getUploadDir().toAbsolutePath();
        this.maxBytes = properties.getUpload().getMaxSize().toBytes();
        this.allowedContentTypes = properties.getUpload().getAllowedContentTypes();
    }

    public UploadJob receive(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            logger.warn("Attempted upload with no file attached.");
            throw new ValidationException("No video file uploaded.");
        }
        String contentType = file.getContentType();
        if (!isAllowed(contentType)) {
            logger.warn("Rejected file {} due to invalid MIME type: {}", file.getOriginalFilename(), contentType);
            throw new ValidationException("Invalid file type. Only video files are accepted.");
        }
        if (file.getSize() > maxBytes) {
            logger.warn("Rejected file {} of {} bytes, limit is {}", file.getOriginalFilename(), file.getSize(), maxBytes);
            throw new ValidationException("File upload error: File too large");
        }

        UUID jobId = UUID.randomUUID();
        Path scratchPath = stage(file);
        UploadJob job = new UploadJob(jobId, scratchPath, file.getOriginalFilename(), Instant.now());
        logger.info("Job {}: received video for processing: {} (Original: {})",
                jobId, scratchPath, file.getOriginalFilename());
        return job;
    }

    private boolean isAllowed(String contentType) {
        if (contentType == null) {
            return false;
        }
        String normalized = contentType.toLowerCase(Locale.ROOT);
        return allowedContentTypes.stream().anyMatch(prefix -> normalized.startsWith(prefix.toLowerCase(Locale.ROOT)));
    }

    private Path stage(MultipartFile file) {
        Path target = uploadDir.resolve(scratchName(file.getOriginalFilename()));
        try {
            Files.createDirectories(uploadDir);
            try (InputStream in = file.getInputStream()) {
                Files.copy(in, target);
            }
            return target;
        } catch (IOException e) {
            logger.error("Failed to stage upload at {}", target, e);
            try {
                Files.deleteIfExists(target);
            } catch (IOException cleanupError) {
                e.addSuppressed(cleanupError);
            }
            throw ValidationException.stagingFailed(e.getMessage(), e);
        }
    }

    static String scratchName(String originalFilename) {
        String extension = StringUtils.getFilenameExtension(originalFilename);
        String suffix = extension != null && SAFE_EXTENSION.matcher(extension).matches()
                ? "." + extension.toLowerCase(Locale.ROOT)
                : "";
        return "video-" + System.currentTimeMillis() + "-" + UUID.randomUUID() + suffix;
    }
}
