package com.sandy.aiot.vision.sentinel.service.impl;

import com.sandy.aiot.vision.sentinel.entity.Device;
import com.sandy.aiot.vision.sentinel.entity.Sample;
import com.sandy.aiot.vision.sentinel.repository.DeviceRepository;
import com.sandy.aiot.vision.sentinel.repository.SampleRepository;
import com.sandy.aiot.vision.sentinel.service.SampleStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.*;

@Service
@Slf4j
@RequiredArgsConstructor
public class SampleStoreByJpa implements SampleStore {

    private final SampleRepository sampleRepository;
    private final DeviceRepository deviceRepository;

    @Override
    public List<Sample> loadSamples(Collection<Long> deviceIds, String key, LocalDateTime from, LocalDateTime to) {
        if (deviceIds == null || deviceIds.isEmpty() || key == null) return Collections.emptyList();
        return sampleRepository.findByDeviceIdInAndMetricKeyAndTimestampBetweenOrderByTimestampAsc(deviceIds, key, from, to);
    }

    @Override
    public Optional<Sample> findLatestSince(Long deviceId, LocalDateTime since) {
        return sampleRepository.findTop1ByDeviceIdAndTimestampGreaterThanEqualOrderByTimestampDesc(deviceId, since);
    }

    @Override
    public Optional<Sample> findLatest(Long deviceId) {
        return sampleRepository.findTop1ByDeviceIdOrderByTimestampDesc(deviceId);
    }

    @Override
    @Transactional
    public int save(List<Sample> samples) {
        if (samples == null || samples.isEmpty()) {
            return 0;
        }
        int written = 0;
        Map<Long, LocalDateTime> newestPerDevice = new HashMap<>();
        for (Sample s : samples) {
            if (s.getDeviceId() == null || s.getMetricKey() == null || s.getTimestamp() == null) {
                log.warn("Skipping incomplete sample: deviceId={}, key={}, timestamp={}", s.getDeviceId(), s.getMetricKey(), s.getTimestamp());
                continue;
            }
            if (sampleRepository.existsByDeviceIdAndMetricKeyAndTimestamp(s.getDeviceId(), s.getMetricKey(), s.getTimestamp())) {
                continue;
            }
            sampleRepository.save(s);
            written++;
            newestPerDevice.merge(s.getDeviceId(), s.getTimestamp(), (a, b) -> a.isAfter(b) ? a : b);
        }
        newestPerDevice.forEach(this::touchLastSeen);
        log.debug("Saved {} of {} samples", written, samples.size());
        return written;
    }

    private void touchLastSeen(Long deviceId, LocalDateTime ts) {
        Optional<Device> opt = deviceRepository.findById(deviceId);
        if (opt.isEmpty()) return;
        Device d = opt.get();
        if (d.getLastSeenAt() == null || d.getLastSeenAt().isBefore(ts)) {
            d.setLastSeenAt(ts);
            deviceRepository.save(d);
        }
    }
}
