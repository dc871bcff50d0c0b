package com.sandy.aiot.vision.sentinel.detect;

import com.sandy.aiot.vision.sentinel.entity.AnomalyEvent;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one detection pass over a site.
 */
@Getter
public class DetectionReport {

    public record DeviceFailure(Long deviceId, String reason) {}

    private final Long siteId;
    private final LocalDateTime from;
    private final LocalDateTime to;
    private int devicesScanned;
    private int created;
    private int merged;
    private int duplicates;
    private final List<AnomalyEvent> events = new ArrayList<>();
    private final List<DeviceFailure> failures = new ArrayList<>();

    public DetectionReport(Long siteId, LocalDateTime from, LocalDateTime to) {
        this.siteId = siteId;
        this.from = from;
        this.to = to;
    }

    void deviceScanned() {
        devicesScanned++;
    }

    void record(AnomalyEventWriter.Result result) {
        switch (result.outcome()) {
            case CREATED -> {
                created++;
                events.add(result.event());
            }
            case MERGED -> {
                merged++;
                if (events.stream().noneMatch(e -> e.getId().equals(result.event().getId()))) {
                    events.add(result.event());
                }
            }
            case DUPLICATE -> duplicates++;
        }
    }

    void fail(Long deviceId, String reason) {
        failures.add(new DeviceFailure(deviceId, reason));
    }

    /** Events created or merged by this pass. */
    public List<AnomalyEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }

    public List<DeviceFailure> getFailures() {
        return Collections.unmodifiableList(failures);
    }

    public int touchedCount() {
        return created + merged;
    }
}
