package com.argus.anomaly.service;

import com.argus.anomaly.exception.PersistenceException;
import com.argus.anomaly.model.AlertRecord;
import com.argus.anomaly.model.AlertWriteResult;
import com.argus.anomaly.model.DetectionOutput;
import com.argus.anomaly.repository.AlertRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class AlertPersistenceService {

    private static final Logger logger = LoggerFactory.getLogger(AlertPersistenceService.class);

    private final AlertRepository alertRepository;

    /**
     * Inserts one alert for the payload's frame key.
     * <p>
     * The unique constraint on the key is the only guard against duplicates: if the insert
     * collides and a row for the key exists, that row is returned as already recorded. Any other
     * database failure becomes a {@link PersistenceException}; nothing is retried here.
     */
    public AlertWriteResult record(DetectionOutput output) {
        AlertRecord alert = new AlertRecord();
        alert.setAlertType(output.getAlertType());
        alert.setMessage(output.getMessage());
        alert.setFrameStorageKey(output.getFrameKey());
        alert.setDetails(output.getDetails());

        try {
            AlertRecord saved = alertRepository.saveAndFlush(alert);
            logger.info("Alert [ID: {}] inserted for frame {}", saved.getId(), saved.getFrameStorageKey());
            return AlertWriteResult.created(saved);
        } catch (DataIntegrityViolationException e) {
            Optional<AlertRecord> existing = findByFrameKey(output.getFrameKey());
            if (existing.isPresent()) {
                // Also what a reprocessed artifact looks like, so keep it visible in the logs.
                logger.warn("Frame {} already recorded as alert [ID: {}]; returning existing alert. "
                        + "Check whether the same artifact was processed twice.",
                        output.getFrameKey(), existing.get().getId());
                return AlertWriteResult.existing(existing.get());
            }
            logger.error("Integrity violation unrelated to frame key {}", output.getFrameKey(), e);
            throw new PersistenceException("Database error while saving alert information.", e);
        } catch (DataAccessException e) {
            logger.error("Database error while saving alert for frame {}", output.getFrameKey(), e);
            throw new PersistenceException("Database error while saving alert information.", e);
        }
    }

    public Optional<AlertRecord> findAlert(Long id) {
        return alertRepository.findById(id);
    }

    public List<AlertRecord> listAlerts(int limit, int offset) {
        return alertRepository.findLatest(limit, offset);
    }

    public long countAlerts() {
        return alertRepository.count();
    }

    private Optional<AlertRecord> findByFrameKey(String frameKey) {
        try {
            return alertRepository.findByFrameStorageKey(frameKey);
        } catch (DataAccessException e) {
            logger.error("Could not look up existing alert for frame {}", frameKey, e);
            throw new PersistenceException("Database error while saving alert information.", e);
        }
    }
}
