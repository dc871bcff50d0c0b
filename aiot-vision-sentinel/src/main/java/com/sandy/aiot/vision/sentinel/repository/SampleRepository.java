package com.sandy.aiot.vision.sentinel.repository;

import com.sandy.aiot.vision.sentinel.entity.Sample;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface SampleRepository extends JpaRepository<Sample, Long> {
    List<Sample> findByDeviceIdInAndMetricKeyAndTimestampBetweenOrderByTimestampAsc(Collection<Long> deviceIds, String metricKey,
                                                                                    LocalDateTime from, LocalDateTime to);

    // 任意 key, 指定时间之后的最新一条
    Optional<Sample> findTop1ByDeviceIdAndTimestampGreaterThanEqualOrderByTimestampDesc(Long deviceId, LocalDateTime since);

    Optional<Sample> findTop1ByDeviceIdOrderByTimestampDesc(Long deviceId);

    boolean existsByDeviceIdAndMetricKeyAndTimestamp(Long deviceId, String metricKey, LocalDateTime timestamp);
}
