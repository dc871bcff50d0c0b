package com.sandy.aiot.vision.sentinel.scheduler;

import com.sandy.aiot.vision.sentinel.alert.AlertEvaluationService;
import com.sandy.aiot.vision.sentinel.detect.EventDetectionService;
import com.sandy.aiot.vision.sentinel.entity.AlertRule;
import com.sandy.aiot.vision.sentinel.entity.Device;
import com.sandy.aiot.vision.sentinel.entity.Sample;
import com.sandy.aiot.vision.sentinel.entity.Site;
import com.sandy.aiot.vision.sentinel.repository.*;
import com.sandy.aiot.vision.sentinel.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.task.TaskSchedulingProperties;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.core.env.Environment;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class MonitorJobSchedulerTest {
    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 1, 12, 0);

    @Autowired ApplicationContext context;
    @Autowired SiteRepository siteRepository;
    @Autowired DeviceRepository deviceRepository;
    @Autowired SampleRepository sampleRepository;
    @Autowired AlertRuleRepository ruleRepository;
    @Autowired AlertEventRepository alertEventRepository;
    @Autowired AnomalyEventRepository eventRepository;
    @Autowired EventDetectionService detectionService;
    @Autowired AlertEvaluationService evaluationService;
    @Autowired MutableClock clock;
    @Autowired TaskSchedulingProperties schedulingProperties;
    @Autowired Environment environment;

    @BeforeEach
    void setUp() {
        clock.setUtc(NOW);
        alertEventRepository.deleteAll();
        ruleRepository.deleteAll();
        eventRepository.deleteAll();
        sampleRepository.deleteAll();
        deviceRepository.deleteAll();
        siteRepository.deleteAll();
    }

    @Test
    void disabledInTestProfile() {
        assertTrue(context.getBeansOfType(MonitorJobScheduler.class).isEmpty());
    }

    @Test
    void detectionAndEvaluationGetTheirOwnThreadsAndMailIsBounded() {
        assertEquals(2, schedulingProperties.getPool().getSize());
        assertEquals("monitor-", schedulingProperties.getThreadNamePrefix());
        assertEquals("10000", environment.getProperty("spring.mail.properties.mail.smtp.connectiontimeout"));
        assertEquals("10000", environment.getProperty("spring.mail.properties.mail.smtp.timeout"));
        assertEquals("10000", environment.getProperty("spring.mail.properties.mail.smtp.writetimeout"));
    }

    @Test
    void everySiteEvaluatedAndInvalidZoneFallsBack() {
        Site bad = siteRepository.save(Site.builder().name("Bad tz").tz("Mars/Olympus").build());
        Site good = siteRepository.save(Site.builder().name("Good").build());
        for (Site site : new Site[]{bad, good}) {
            Device d = deviceRepository.save(Device.builder().siteId(site.getId()).name("m").type("power").build());
            sampleRepository.save(Sample.builder().deviceId(d.getId()).metricKey("power").timestamp(NOW).value(10).build());
            ruleRepository.save(AlertRule.builder().siteId(site.getId()).name("Any draw").createdAt(NOW)
                    .ruleJson("{\"type\":\"threshold\",\"device_ids\":[" + d.getId() + "],\"key\":\"power\",\"op\":\"gt\",\"value\":0}")
                    .build());
        }

        MonitorJobScheduler scheduler = new MonitorJobScheduler(siteRepository, detectionService, evaluationService);
        scheduler.scheduledEvaluation();
        scheduler.scheduledDetection();

        assertEquals(2, alertEventRepository.count());
    }
}
