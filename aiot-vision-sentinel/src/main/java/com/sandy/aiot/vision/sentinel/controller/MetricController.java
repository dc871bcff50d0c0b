package com.sandy.aiot.vision.sentinel.controller;

import com.sandy.aiot.vision.sentinel.service.MetricSeriesService;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Time-series reads for charts and batch appends of readings.
 */
@RestController
@RequestMapping("/api/metrics")
@RequiredArgsConstructor
@Slf4j
public class MetricController {

    private final MetricSeriesService metricSeriesService;
    private final Clock clock;

    /** Defaults to the last 24 hours of {@code power}. */
    @GetMapping
    public MetricSeriesService.MetricSeries series(@RequestParam(value = "site_id", required = false) Long siteId,
                                                   @RequestParam(value = "device_id", required = false) List<Long> deviceIds,
                                                   @RequestParam(value = "key", defaultValue = "power") String key,
                                                   @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
                                                   @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to,
                                                   @RequestParam(value = "res", defaultValue = "raw") String res) {
        LocalDateTime end = to == null ? LocalDateTime.now(clock) : to;
        LocalDateTime start = from == null ? end.minusHours(24) : from;
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("from must not be after to");
        }
        return metricSeriesService.query(siteId, deviceIds, key, start, end, MetricSeriesService.Resolution.fromCode(res));
    }

    @PostMapping
    public ActionResp ingest(@RequestBody List<IngestReq> body) {
        List<MetricSeriesService.IngestPoint> points = body.stream()
                .map(r -> new MetricSeriesService.IngestPoint(r.getDeviceId(), r.getKey(), r.getTs(), r.getValue()))
                .collect(Collectors.toList());
        int written = metricSeriesService.ingest(points);
        return ActionResp.ok("Stored " + written + " of " + points.size() + " samples");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ActionResp> badRequest(IllegalArgumentException e) {
        log.warn("Rejected metrics request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(ActionResp.fail(e.getMessage()));
    }

    @Data
    public static class IngestReq {
        private Long deviceId;
        private String key;
        private LocalDateTime ts;
        private Double value;
    }
}
