package com.sandy.aiot.vision.sentinel.detect;

import com.sandy.aiot.vision.sentinel.entity.Device;
import com.sandy.aiot.vision.sentinel.entity.Site;
import com.sandy.aiot.vision.sentinel.repository.AnomalyEventRepository;
import com.sandy.aiot.vision.sentinel.repository.DeviceRepository;
import com.sandy.aiot.vision.sentinel.repository.SiteRepository;
import com.sandy.aiot.vision.sentinel.service.SampleStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;

@SpringBootTest
@ActiveProfiles("test")
class EventDetectionStorageFailureTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2026, 2, 1, 8, 0);

    @MockBean SampleStore sampleStore;
    @Autowired EventDetectionService detectionService;
    @Autowired SiteRepository siteRepository;
    @Autowired DeviceRepository deviceRepository;
    @Autowired AnomalyEventRepository eventRepository;

    private Site site;
    private Device meter;
    private Device sensor;

    @BeforeEach
    void setUp() {
        eventRepository.deleteAll();
        deviceRepository.deleteAll();
        siteRepository.deleteAll();
        site = siteRepository.save(Site.builder().name("Plant F").build());
        meter = deviceRepository.save(Device.builder()
                .siteId(site.getId()).name("Main meter").type("power").unit("W")
                .capabilities(new HashSet<>(Set.of(Device.CAP_HISTORICAL)))
                .build());
        sensor = deviceRepository.save(Device.builder()
                .siteId(site.getId()).name("Line sensor").type("voltage").unit("V")
                .capabilities(new HashSet<>(Set.of(Device.CAP_HISTORICAL)))
                .build());
    }

    @Test
    void storageFailureWhileLoadingAbortsThePass() {
        given(sampleStore.loadSamples(any(), anyString(), any(), any()))
                .willThrow(new DataAccessResourceFailureException("connection refused"));

        assertThrows(DataAccessException.class,
                () -> detectionService.detect(site.getId(), T0, T0.plusHours(1)));
        assertEquals(0, eventRepository.count());
    }

    @Test
    void otherLoadErrorIsRecordedAndTheNextDeviceStillScanned() {
        given(sampleStore.loadSamples(eq(List.of(meter.getId())), anyString(), any(), any()))
                .willThrow(new IllegalStateException("corrupt series"));
        given(sampleStore.loadSamples(eq(List.of(sensor.getId())), anyString(), any(), any()))
                .willReturn(List.of());

        DetectionReport report = detectionService.detect(site.getId(), T0, T0.plusHours(1));

        assertEquals(2, report.getDevicesScanned());
        assertEquals(1, report.getFailures().size());
        assertEquals(meter.getId(), report.getFailures().get(0).deviceId());
    }
}
