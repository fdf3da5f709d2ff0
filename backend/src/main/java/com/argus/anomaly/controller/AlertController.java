package com.argus.anomaly.controller;

import com.argus.anomaly.dto.AlertPage;
import com.argus.anomaly.dto.AlertView;
import com.argus.anomaly.dto.ErrorResponse;
import com.argus.anomaly.model.AlertRecord;
import com.argus.anomaly.service.AlertPersistenceService;
import com.argus.anomaly.service.FrameStorageService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/alerts")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class AlertController {

    private final AlertPersistenceService alertService;
    private final FrameStorageService frameStorageService;

    @GetMapping
    public ResponseEntity<?> listAlerts(
            @RequestParam(value = "limit", defaultValue = "100") int limit,
            @RequestParam(value = "offset", defaultValue = "0") int offset) {
        if (limit <= 0 || offset < 0) {
            return ResponseEntity.badRequest().body(new ErrorResponse("Invalid limit or offset parameter.", null, null));
        }
        List<AlertView> alerts = alertService.listAlerts(limit, offset).stream()
                .map(this::toView)
                .collect(Collectors.toList());
        long total = alertService.countAlerts();
        AlertPage.Pagination pagination = new AlertPage.Pagination(total, limit, offset, offset + alerts.size() < total);
        return ResponseEntity.ok(new AlertPage(alerts, pagination));
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> getAlert(@PathVariable Long id) {
        if (id == null || id <= 0) {
            return ResponseEntity.badRequest()
                    .body(new ErrorResponse("Invalid alert ID format. Must be a positive integer.", null, null));
        }
        return alertService.findAlert(id)
                .<ResponseEntity<?>>map(alert -> ResponseEntity.ok(toView(alert)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(new ErrorResponse("Alert with ID " + id + " not found.", null, null)));
    }

    private AlertView toView(AlertRecord alert) {
        return AlertView.of(alert, frameStorageService.urlFor(alert.getFrameStorageKey()));
    }
}
