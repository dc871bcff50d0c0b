package com.sandy.aiot.vision.sentinel.repository;

import com.sandy.aiot.vision.sentinel.entity.AlertEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AlertEventRepository extends JpaRepository<AlertEvent, Long> {
    List<AlertEvent> findByAlertIdOrderByTsDesc(Long alertId);
    List<AlertEvent> findAllByOrderByTsDesc();
}
