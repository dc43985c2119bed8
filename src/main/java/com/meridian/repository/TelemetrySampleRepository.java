package com.meridian.repository;

import com.meridian.entity.TelemetrySampleEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

@Repository
public interface TelemetrySampleRepository extends JpaRepository<TelemetrySampleEntity, Long> {

    List<TelemetrySampleEntity> findByRecordedAtAfterOrderByRecordedAtAsc(Instant after);

    @Modifying
    @Transactional
    @Query("DELETE FROM TelemetrySampleEntity s WHERE s.recordedAt < :before")
    int deleteOlderThan(@Param("before") Instant before);
}
