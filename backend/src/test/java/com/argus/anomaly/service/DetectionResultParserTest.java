package com.argus.anomaly.service;

import com.argus.anomaly.model.DetectionOutput;
import com.argus.anomaly.model.DetectionResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class DetectionResultParserTest {

    private static final String VALID =
            "{\"alert_type\":\"Multiple_Persons_Detected\",\"message\":\"3 persons detected\","
                    + "\"frame_filename\":\"f1.jpg\",\"details\":{\"person_count\":3}}";

    private final DetectionResultParser parser = new DetectionResultParser(new ObjectMapper());

    @Test
    public void testParse_EmptyOutputIsNoDetection() {
        assertEquals(DetectionResult.Kind.NO_DETECTION, parser.parse("").getKind());
        assertEquals(DetectionResult.Kind.NO_DETECTION, parser.parse(null).getKind());
    }

    @Test
    public void testParse_ChatterWithoutJsonIsNoDetection() {
        DetectionResult result = parser.parse("Loading model...\nProcessed 120 frames\nno anomalies\n");

        assertEquals(DetectionResult.Kind.NO_DETECTION, result.getKind());
        assertNull(result.getPayload());
    }

    @Test
    public void testParse_IgnoresChatterAroundResultLine() {
        DetectionResult result = parser.parse("Fusing layers...\n  " + VALID + "  \nSpeed: 12ms per frame\n");

        assertEquals(DetectionResult.Kind.DETECTED, result.getKind());
        DetectionOutput payload = result.getPayload();
        assertEquals("Multiple_Persons_Detected", payload.getAlertType());
        assertEquals("3 persons detected", payload.getMessage());
        assertEquals("f1.jpg", payload.getFrameKey());
        assertEquals(Map.of("person_count", 3), payload.getDetails());
    }

    @Test
    public void testParse_MissingDetailsIsContractViolation() {
        String raw = "starting\n{\"alert_type\":\"X\",\"message\":\"m\",\"frame_filename\":\"f.jpg\"}\n";

        DetectionResult result = parser.parse(raw);

        assertEquals(DetectionResult.Kind.CONTRACT_VIOLATION, result.getKind());
        assertEquals(raw, result.getRawOutput());
        assertTrue(result.getViolation().contains("details"));
        assertNull(result.getPayload());
    }

    @Test
    public void testParse_WrongFieldTypesAreContractViolations() {
        String raw = "{\"alert_type\":7,\"message\":\"\",\"frame_filename\":\"f.jpg\",\"details\":[1,2]}";

        DetectionResult result = parser.parse(raw);

        assertEquals(DetectionResult.Kind.CONTRACT_VIOLATION, result.getKind());
        assertTrue(result.getViolation().contains("alert_type"));
        assertTrue(result.getViolation().contains("message"));
        assertTrue(result.getViolation().contains("details"));
    }

    @Test
    public void testParse_BrokenJsonLineIsContractViolation() {
        String raw = "{\"alert_type\": \"X\", oops}";

        DetectionResult result = parser.parse(raw);

        assertEquals(DetectionResult.Kind.CONTRACT_VIOLATION, result.getKind());
        assertEquals(raw, result.getRawOutput());
    }

    @Test
    public void testParse_SkipsPrintedDictNextToResultLine() {
        DetectionResult result = parser.parse("{'person_count': 3, 'conf': 0.91}\n" + VALID + "\n");

        assertEquals(DetectionResult.Kind.DETECTED, result.getKind());
        assertEquals("f1.jpg", result.getPayload().getFrameKey());
    }

    @Test
    public void testParse_PrintedDictAloneIsContractViolation() {
        String raw = "{'person_count': 3}\n";

        DetectionResult result = parser.parse(raw);

        assertEquals(DetectionResult.Kind.CONTRACT_VIOLATION, result.getKind());
        assertEquals(raw, result.getRawOutput());
    }

    @Test
    public void testParse_TwoResultLinesAreContractViolation() {
        DetectionResult result = parser.parse(VALID + "\n" + VALID + "\n");

        assertEquals(DetectionResult.Kind.CONTRACT_VIOLATION, result.getKind());
    }

    @Test
    public void testParse_FrameFilenameMustNotContainPath() {
        String raw = "{\"alert_type\":\"X\",\"message\":\"m\",\"frame_filename\":\"../etc/passwd\",\"details\":{}}";

        DetectionResult result = parser.parse(raw);

        assertEquals(DetectionResult.Kind.CONTRACT_VIOLATION, result.getKind());
        assertTrue(result.getViolation().contains("frame_filename"));
    }

    @Test
    public void testParse_ExtraFieldsAreIgnored() {
        String raw = "{\"alert_type\":\"X\",\"message\":\"m\",\"frame_filename\":\"f.jpg\",\"details\":{},\"score\":0.9}";

        DetectionResult result = parser.parse(raw);

        assertEquals(DetectionResult.Kind.DETECTED, result.getKind());
        assertTrue(result.getPayload().getDetails().isEmpty());
    }
}
