package com.argus.anomaly.controller;

import com.argus.anomaly.dto.AlertPage;
import com.argus.anomaly.dto.AlertView;
import com.argus.anomaly.model.AlertRecord;
import com.argus.anomaly.service.AlertPersistenceService;
import com.argus.anomaly.service.FrameStorageService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

public class AlertControllerTest {

    @Mock
    private AlertPersistenceService alertService;

    @Mock
    private FrameStorageService frameStorageService;

    @InjectMocks
    private AlertController alertController;

    @BeforeEach
    public void setup() {
        MockitoAnnotations.openMocks(this);
        when(frameStorageService.urlFor("f1.jpg")).thenReturn("/frames/f1.jpg");
    }

    @Test
    public void testGetAlert_Found() {
        when(alertService.findAlert(5L)).thenReturn(Optional.of(alert(5L)));

        ResponseEntity<?> response = alertController.getAlert(5L);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        AlertView view = (AlertView) response.getBody();
        assertEquals(5L, view.getId());
        assertEquals("f1.jpg", view.getFrameFilename());
        assertEquals("/frames/f1.jpg", view.getFrameUrl());
    }

    @Test
    public void testGetAlert_NotFound() {
        when(alertService.findAlert(anyLong())).thenReturn(Optional.empty());

        ResponseEntity<?> response = alertController.getAlert(999L);

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
    }

    @Test
    public void testGetAlert_BadRequestForNonPositiveId() {
        ResponseEntity<?> response = alertController.getAlert(0L);

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        verify(alertService, never()).findAlert(anyLong());
    }

    @Test
    public void testListAlerts_Pagination() {
        when(alertService.listAlerts(1, 0)).thenReturn(List.of(alert(9L)));
        when(alertService.countAlerts()).thenReturn(2L);

        ResponseEntity<?> response = alertController.listAlerts(1, 0);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        AlertPage page = (AlertPage) response.getBody();
        assertEquals(1, page.getAlerts().size());
        assertEquals(2L, page.getPagination().getTotal());
        assertTrue(page.getPagination().isHasNextPage());
    }

    @Test
    public void testListAlerts_BadRequest() {
        ResponseEntity<?> response = alertController.listAlerts(0, -1);

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        verify(alertService, never()).listAlerts(anyInt(), anyInt());
    }

    private static AlertRecord alert(Long id) {
        AlertRecord alert = new AlertRecord();
        alert.setId(id);
        alert.setAlertType("Multiple_Persons_Detected");
        alert.setMessage("3 persons detected");
        alert.setFrameStorageKey("f1.jpg");
        alert.setDetails(Map.of("person_count", 3));
        return alert;
    }
}
