package com.argus.anomaly.model;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

@Entity
@Table(name = "alerts",
        uniqueConstraints = @UniqueConstraint(name = AlertRecord.FRAME_KEY_CONSTRAINT, columnNames = "frame_storage_key"))
@Data
public class AlertRecord {

    public static final String FRAME_KEY_CONSTRAINT = "uk_alerts_frame_storage_key";

    // Unbounded on PostgreSQL like TEXT, but still indexable on H2 where TEXT is a CLOB
    private static final String UNBOUNDED_TEXT = "varchar";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @CreationTimestamp
    @Column(nullable = false, updatable = false)
    private Instant timestamp;

    @Column(name = "alert_type", nullable = false)
    private String alertType;

    @Column(nullable = false, columnDefinition = UNBOUNDED_TEXT)
    private String message;

    @Column(name = "frame_storage_key", nullable = false, columnDefinition = UNBOUNDED_TEXT)
    private String frameStorageKey;

    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> details;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
