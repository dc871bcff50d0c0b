package com.sandy.aiot.vision.sentinel.repository;

import com.sandy.aiot.vision.sentinel.entity.Device;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DeviceRepository extends JpaRepository<Device, Long> {
    List<Device> findBySiteIdOrderByIdAsc(Long siteId);
    List<Device> findBySiteIdAndActiveTrueOrderByIdAsc(Long siteId);
}
