package com.argus.anomaly.repository;

import com.argus.anomaly.model.AlertRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AlertRepository extends JpaRepository<AlertRecord, Long> {

    Optional<AlertRecord> findByFrameStorageKey(String frameStorageKey);

    @Query(value = "SELECT * FROM alerts ORDER BY timestamp DESC, id DESC LIMIT :limit OFFSET :offset",
            nativeQuery = true)
    List<AlertRecord> findLatest(@Param("limit") int limit, @Param("offset") int offset);
}
