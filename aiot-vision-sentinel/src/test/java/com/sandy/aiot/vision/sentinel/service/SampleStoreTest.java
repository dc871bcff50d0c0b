package com.sandy.aiot.vision.sentinel.service;

import com.sandy.aiot.vision.sentinel.entity.Device;
import com.sandy.aiot.vision.sentinel.entity.Sample;
import com.sandy.aiot.vision.sentinel.repository.DeviceRepository;
import com.sandy.aiot.vision.sentinel.repository.SampleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class SampleStoreTest {
    private static final LocalDateTime T0 = LocalDateTime.of(2026, 1, 10, 6, 0);

    @Autowired SampleStore sampleStore;
    @Autowired SampleRepository sampleRepository;
    @Autowired DeviceRepository deviceRepository;

    private Device device;

    @BeforeEach
    void setUp() {
        sampleRepository.deleteAll();
        device = deviceRepository.save(Device.builder().siteId(1L).name("Chiller").type("temp").build());
    }

    private Sample sample(LocalDateTime ts, String key, double v) {
        return Sample.builder().deviceId(device.getId()).metricKey(key).timestamp(ts).value(v).build();
    }

    @Test
    void saveSkipsDuplicatesAndIncompleteRows() {
        int written = sampleStore.save(List.of(
                sample(T0, "temp", 4.0),
                sample(T0.plusMinutes(1), "temp", 4.2),
                sample(T0.plusMinutes(1), "temp", 9.9),
                Sample.builder().deviceId(device.getId()).metricKey("temp").value(1).build()));

        assertEquals(2, written);
        assertEquals(0, sampleStore.save(List.of(sample(T0, "temp", 5.0))));
        assertEquals(T0.plusMinutes(1), deviceRepository.findById(device.getId()).orElseThrow().getLastSeenAt());
    }

    @Test
    void loadIsOrderedAndBoundedByKeyAndRange() {
        sampleStore.save(List.of(
                sample(T0.plusMinutes(2), "temp", 3),
                sample(T0, "temp", 1),
                sample(T0.plusMinutes(1), "temp", 2),
                sample(T0.plusMinutes(1), "humidity", 60),
                sample(T0.plusMinutes(10), "temp", 9)));

        List<Sample> loaded = sampleStore.loadSamples(List.of(device.getId()), "temp", T0, T0.plusMinutes(2));

        assertEquals(List.of(1.0, 2.0, 3.0), loaded.stream().map(Sample::getValue).toList());
        assertEquals(9.0, sampleStore.findLatest(device.getId()).orElseThrow().getValue());
        assertTrue(sampleStore.findLatestSince(device.getId(), T0.plusMinutes(11)).isEmpty());
        assertEquals(9.0, sampleStore.findLatestSince(device.getId(), T0.plusMinutes(10)).orElseThrow().getValue());
    }
}
