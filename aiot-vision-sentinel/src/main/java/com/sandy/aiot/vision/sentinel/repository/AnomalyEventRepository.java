package com.sandy.aiot.vision.sentinel.repository;

import com.sandy.aiot.vision.sentinel.entity.AnomalyEvent;
import com.sandy.aiot.vision.sentinel.entity.EventType;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface AnomalyEventRepository extends JpaRepository<AnomalyEvent, Long> {

    /**
     * Events of the same site, device set and type whose range touches
     * {@code [windowStart, windowEnd]}: {@code end_ts >= windowStart and start_ts <= windowEnd}.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select e from AnomalyEvent e where e.siteId = :siteId and e.deviceKey = :deviceKey and e.type = :type " +
            "and e.endTs >= :windowStart and e.startTs <= :windowEnd order by e.startTs asc")
    List<AnomalyEvent> findOverlappingForUpdate(@Param("siteId") Long siteId,
                                                @Param("deviceKey") String deviceKey,
                                                @Param("type") EventType type,
                                                @Param("windowStart") LocalDateTime windowStart,
                                                @Param("windowEnd") LocalDateTime windowEnd);

    boolean existsBySiteIdAndStartTsAndDeviceKey(Long siteId, LocalDateTime startTs, String deviceKey);

    List<AnomalyEvent> findBySiteIdOrderByStartTsDesc(Long siteId);

    List<AnomalyEvent> findBySiteIdAndStartTsGreaterThanEqualAndEndTsLessThanEqualOrderByStartTsDesc(Long siteId,
                                                                                                    LocalDateTime from,
                                                                                                    LocalDateTime to);
}
