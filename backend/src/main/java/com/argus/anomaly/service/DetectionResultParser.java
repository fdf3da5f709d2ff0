package com.argus.anomaly.service;

import com.argus.anomaly.model.DetectionOutput;
import com.argus.anomaly.model.DetectionResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns a finished worker's stdout into a {@link DetectionResult}.
 * <p>
 * The worker may print any diagnostic chatter; only lines that, once trimmed, start with
 * {@code {} and end with {@code }} are treated as result candidates. No candidate means nothing
 * was detected. Candidates that are not valid JSON (a printed Python dict, say) are skipped as
 * long as exactly one candidate is a JSON object; that object must be a complete, well-typed
 * payload or the whole output is rejected as a contract violation. Brace lines with no valid
 * object among them, or more than one object, are rejected as well.
 */
@Component
public class DetectionResultParser {

    private static final Logger logger = LoggerFactory.getLogger(DetectionResultParser.class);

    static final String ALERT_TYPE = "alert_type";
    static final String MESSAGE = "message";
    static final String FRAME_FILENAME = "frame_filename";
    static final String DETAILS = "details";

    private static final TypeReference<Map<String, Object>> DETAILS_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public DetectionResultParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public DetectionResult parse(String stdout) {
        if (stdout == null || stdout.isBlank()) {
            return DetectionResult.noDetection();
        }

        List<String> candidates = stdout.lines()
                .map(String::strip)
                .filter(line -> line.startsWith("{") && line.endsWith("}"))
                .collect(Collectors.toList());

        if (candidates.isEmpty()) {
            return DetectionResult.noDetection();
        }

        List<JsonNode> objects = new ArrayList<>();
        JsonProcessingException firstError = null;
        for (String candidate : candidates) {
            try {
                JsonNode node = objectMapper.readTree(candidate);
                if (node != null && node.isObject()) {
                    objects.add(node);
                }
            } catch (JsonProcessingException e) {
                logger.debug("Ignoring non-JSON brace line: {}", candidate);
                if (firstError == null) {
                    firstError = e;
                }
            }
        }

        if (objects.isEmpty()) {
            String cause = firstError != null ? firstError.getOriginalMessage() : "not an object";
            return violation(stdout, "result line is not valid JSON (" + cause + ")");
        }
        if (objects.size() > 1) {
            return violation(stdout, "expected at most one result line but found " + objects.size());
        }

        JsonNode root = objects.get(0);

        List<String> problems = new ArrayList<>();
        String alertType = requireText(root, ALERT_TYPE, problems);
        String message = requireText(root, MESSAGE, problems);
        String frameFilename = requireText(root, FRAME_FILENAME, problems);
        JsonNode details = root.get(DETAILS);
        if (details == null || !details.isObject()) {
            problems.add(DETAILS + " must be an object");
        }
        if (frameFilename != null && !isPlainFileName(frameFilename)) {
            problems.add(FRAME_FILENAME + " must be a bare file name");
        }
        if (!problems.isEmpty()) {
            return violation(stdout, String.join("; ", problems));
        }

        return DetectionResult.detected(DetectionOutput.builder()
                .alertType(alertType)
                .message(message)
                .frameKey(frameFilename)
                .details(objectMapper.convertValue(details, DETAILS_TYPE))
                .build());
    }

    private static String requireText(JsonNode root, String field, List<String> problems) {
        JsonNode node = root.get(field);
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            problems.add(field + " must be a non-empty string");
            return null;
        }
        return node.asText();
    }

    // The key is served back under the frames path, so it may not climb out of it.
    private static boolean isPlainFileName(String name) {
        return !name.contains("/") && !name.contains("\\") && !name.equals(".") && !name.equals("..");
    }

    private static DetectionResult violation(String stdout, String reason) {
        logger.warn("Worker output rejected: {}", reason);
        return DetectionResult.contractViolation(stdout, reason);
    }
}
