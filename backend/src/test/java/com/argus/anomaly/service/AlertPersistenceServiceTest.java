package com.argus.anomaly.service;

import com.argus.anomaly.exception.PersistenceException;
import com.argus.anomaly.model.AlertRecord;
import com.argus.anomaly.model.AlertWriteResult;
import com.argus.anomaly.model.DetectionOutput;
import com.argus.anomaly.repository.AlertRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class AlertPersistenceServiceTest {

    @Mock
    private AlertRepository alertRepository;

    @InjectMocks
    private AlertPersistenceService alertPersistenceService;

    private final DetectionOutput output = DetectionOutput.builder()
            .alertType("Multiple_Persons_Detected")
            .message("3 persons detected")
            .frameKey("f1.jpg")
            .details(Map.of("person_count", 3))
            .build();

    @BeforeEach
    public void setup() {
        MockitoAnnotations.openMocks(this);
    }

    @Test
    public void testRecord_InsertsAlert() {
        when(alertRepository.saveAndFlush(any(AlertRecord.class))).thenAnswer(invocation -> {
            AlertRecord alert = invocation.getArgument(0);
            alert.setId(7L);
            return alert;
        });

        AlertWriteResult result = alertPersistenceService.record(output);

        ArgumentCaptor<AlertRecord> saved = ArgumentCaptor.forClass(AlertRecord.class);
        verify(alertRepository).saveAndFlush(saved.capture());
        assertEquals("f1.jpg", saved.getValue().getFrameStorageKey());
        assertEquals("Multiple_Persons_Detected", saved.getValue().getAlertType());
        assertEquals(Map.of("person_count", 3), saved.getValue().getDetails());
        assertTrue(result.isCreated());
        assertEquals(7L, result.getAlert().getId());
    }

    @Test
    public void testRecord_KeyConflictReturnsExistingAlert() {
        AlertRecord existing = new AlertRecord();
        existing.setId(3L);
        existing.setFrameStorageKey("f1.jpg");
        when(alertRepository.saveAndFlush(any(AlertRecord.class)))
                .thenThrow(new DataIntegrityViolationException("duplicate key value violates unique constraint"));
        when(alertRepository.findByFrameStorageKey("f1.jpg")).thenReturn(Optional.of(existing));

        AlertWriteResult result = alertPersistenceService.record(output);

        assertFalse(result.isCreated());
        assertSame(existing, result.getAlert());
    }

    @Test
    public void testRecord_UnrelatedIntegrityViolationFails() {
        when(alertRepository.saveAndFlush(any(AlertRecord.class)))
                .thenThrow(new DataIntegrityViolationException("value too long for column message"));
        when(alertRepository.findByFrameStorageKey("f1.jpg")).thenReturn(Optional.empty());

        assertThrows(PersistenceException.class, () -> alertPersistenceService.record(output));
    }

    @Test
    public void testRecord_ConnectionLossFails() {
        when(alertRepository.saveAndFlush(any(AlertRecord.class)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        PersistenceException e = assertThrows(PersistenceException.class, () -> alertPersistenceService.record(output));

        assertEquals("Database error while saving alert information.", e.getMessage());
        verify(alertRepository, never()).findByFrameStorageKey(any());
        verify(alertRepository, times(1)).saveAndFlush(any(AlertRecord.class));
    }
}
