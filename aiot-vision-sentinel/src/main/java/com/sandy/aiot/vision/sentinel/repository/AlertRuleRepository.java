package com.sandy.aiot.vision.sentinel.repository;

import com.sandy.aiot.vision.sentinel.entity.AlertRule;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AlertRuleRepository extends JpaRepository<AlertRule, Long> {
    List<AlertRule> findBySiteIdAndEnabledTrueOrderByIdAsc(Long siteId);

    List<AlertRule> findBySiteIdOrderByIdAsc(Long siteId);

    List<AlertRule> findAllByOrderByIdAsc();

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select a from AlertRule a where a.id = :id")
    Optional<AlertRule> findByIdForUpdate(@Param("id") Long id);
}
