package com.sandy.aiot.vision.sentinel.controller;

import com.sandy.aiot.vision.sentinel.detect.DetectionReport;
import com.sandy.aiot.vision.sentinel.detect.EventDetectionService;
import com.sandy.aiot.vision.sentinel.entity.AnomalyEvent;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Anomaly event listing and on-demand detection.
 */
@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
@Slf4j
public class EventController {

    private final EventDetectionService detectionService;

    @GetMapping
    public List<AnomalyEvent> list(@RequestParam("site_id") Long siteId,
                                   @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
                                   @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to,
                                   @RequestParam(value = "device_id", required = false) List<Long> deviceIds) {
        return detectionService.findEvents(siteId, from, to, deviceIds);
    }

    /** Without from/to the trailing detection window ending now is scanned. Both or neither must be given. */
    @PostMapping("/detect")
    public DetectResp detect(@RequestParam("site_id") Long siteId,
                             @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
                             @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to) {
        if ((from == null) != (to == null)) {
            throw new IllegalArgumentException("from and to must be given together");
        }
        DetectionReport report = from == null
                ? detectionService.detectRecent(siteId)
                : detectionService.detect(siteId, from, to);
        DetectResp resp = new DetectResp();
        resp.setSiteId(siteId);
        resp.setFrom(report.getFrom());
        resp.setTo(report.getTo());
        resp.setDevicesScanned(report.getDevicesScanned());
        resp.setCreated(report.getCreated());
        resp.setMerged(report.getMerged());
        resp.setDuplicates(report.getDuplicates());
        resp.setFailures(report.getFailures());
        resp.setEvents(report.getEvents());
        return resp;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ActionResp> badRequest(IllegalArgumentException e) {
        log.warn("Rejected detection request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(ActionResp.fail(e.getMessage()));
    }

    @Data
    public static class DetectResp {
        private Long siteId;
        private LocalDateTime from;
        private LocalDateTime to;
        private int devicesScanned;
        private int created;
        private int merged;
        private int duplicates;
        private List<DetectionReport.DeviceFailure> failures;
        private List<AnomalyEvent> events;
    }
}
