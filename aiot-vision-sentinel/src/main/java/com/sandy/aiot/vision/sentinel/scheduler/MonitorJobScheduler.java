package com.sandy.aiot.vision.sentinel.scheduler;

import com.sandy.aiot.vision.sentinel.alert.AlertEvaluationService;
import com.sandy.aiot.vision.sentinel.detect.EventDetectionService;
import com.sandy.aiot.vision.sentinel.entity.Site;
import com.sandy.aiot.vision.sentinel.repository.SiteRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Fixed-delay drivers for both engines. A failing site is logged and retried on the next tick.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "monitor.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class MonitorJobScheduler {

    private final SiteRepository siteRepository;
    private final EventDetectionService detectionService;
    private final AlertEvaluationService evaluationService;

    @Scheduled(fixedDelayString = "${monitor.scheduler.detect-interval-ms:300000}", initialDelayString = "${monitor.scheduler.initial-delay-ms:10000}")
    public void scheduledDetection() {
        List<Site> sites = siteRepository.findAll();
        for (Site site : sites) {
            try {
                detectionService.detectRecent(site.getId());
            } catch (Exception e) {
                log.error("Scheduled event detection failed siteId={} name={}: {}", site.getId(), site.getName(), e.getMessage(), e);
            }
        }
    }

    @Scheduled(fixedDelayString = "${monitor.scheduler.evaluate-interval-ms:30000}", initialDelayString = "${monitor.scheduler.initial-delay-ms:10000}")
    public void scheduledEvaluation() {
        List<Site> sites = siteRepository.findAll();
        for (Site site : sites) {
            try {
                evaluationService.evaluate(site.getId());
            } catch (Exception e) {
                log.error("Scheduled alert evaluation failed siteId={} name={}: {}", site.getId(), site.getName(), e.getMessage(), e);
            }
        }
    }
}
