package com.sandy.aiot.vision.sentinel.detect;

import com.sandy.aiot.vision.sentinel.entity.AnomalyEvent;
import com.sandy.aiot.vision.sentinel.entity.Device;
import com.sandy.aiot.vision.sentinel.entity.Sample;
import com.sandy.aiot.vision.sentinel.repository.AnomalyEventRepository;
import com.sandy.aiot.vision.sentinel.repository.DeviceRepository;
import com.sandy.aiot.vision.sentinel.service.SampleStore;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Rolling anomaly detector. For every active device of a site that keeps history it scores the
 * device's primary metric with a centered rolling median/MAD z-score and stores spike and sag runs
 * as {@link AnomalyEvent}s. Re-running over an overlapping range widens existing events.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EventDetectionService {

    private final DeviceRepository deviceRepository;
    private final SampleStore sampleStore;
    private final AnomalyEventWriter eventWriter;
    private final AnomalyEventRepository eventRepository;
    private final Clock clock;

    @Value("${monitor.detector.window-minutes:15}")
    private int windowMinutes;
    @Value("${monitor.detector.z-threshold:3.0}")
    private double zThreshold;
    @Value("${monitor.detector.min-duration-points:3}")
    private int minDurationPoints;
    @Value("${monitor.detector.min-samples:10}")
    private int minSamples;
    @Value("${monitor.detector.lookback-minutes:60}")
    private int lookbackMinutes;

    private AnomalyRunFinder runFinder;

    @PostConstruct
    public void init() {
        runFinder = new AnomalyRunFinder(Duration.ofMinutes(windowMinutes), zThreshold, minDurationPoints);
        log.info("Event detector initialized: window={}min k={} minDurationPoints={} minSamples={}",
                windowMinutes, zThreshold, minDurationPoints, minSamples);
    }

    /**
     * Detects over the trailing {@code lookback-minutes} ending now.
     */
    public DetectionReport detectRecent(Long siteId) {
        LocalDateTime to = LocalDateTime.now(clock);
        return detect(siteId, to.minusMinutes(lookbackMinutes), to);
    }

    /**
     * Storage failures, while loading or persisting, propagate and abort the pass for this site.
     * Any other error reading one device's samples is recorded in the report and the device skipped.
     */
    public DetectionReport detect(Long siteId, LocalDateTime from, LocalDateTime to) {
        DetectionReport report = new DetectionReport(siteId, from, to);
        if (from == null || to == null || from.isAfter(to)) {
            log.warn("Detection skipped, invalid range siteId={} from={} to={}", siteId, from, to);
            return report;
        }
        List<Device> devices = deviceRepository.findBySiteIdAndActiveTrueOrderByIdAsc(siteId);
        for (Device device : devices) {
            if (!device.hasCapability(Device.CAP_HISTORICAL) && !device.hasCapability(Device.CAP_REALTIME)) continue;
            report.deviceScanned();
            List<Sample> samples;
            try {
                samples = sampleStore.loadSamples(List.of(device.getId()), device.getType(), from, to);
            } catch (DataAccessException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("Failed to load samples deviceId={} key={} error={}", device.getId(), device.getType(), e.getMessage());
                report.fail(device.getId(), e.getMessage());
                continue;
            }
            if (samples.size() < minSamples) {
                log.debug("Not enough samples for detection deviceId={} key={} count={}", device.getId(), device.getType(), samples.size());
                continue;
            }
            List<AnomalyCandidate> runs = runFinder.find(samples);
            for (AnomalyCandidate run : runs) {
                report.record(eventWriter.persist(siteId, Set.of(device.getId()), run));
            }
        }
        log.info("Detection completed siteId={} range=[{} .. {}] devices={} created={} merged={} duplicates={} failures={}",
                siteId, from, to, report.getDevicesScanned(), report.getCreated(), report.getMerged(),
                report.getDuplicates(), report.getFailures().size());
        return report;
    }

    /** Count of events created or merged. */
    public int runDetection(Long siteId, LocalDateTime from, LocalDateTime to) {
        return detect(siteId, from, to).touchedCount();
    }

    /**
     * Events of a site, newest first. {@code from} bounds start_ts, {@code to} bounds end_ts and
     * a non-empty {@code deviceIds} keeps events that share at least one device.
     */
    public List<AnomalyEvent> findEvents(Long siteId, LocalDateTime from, LocalDateTime to, Collection<Long> deviceIds) {
        List<AnomalyEvent> events = (from != null && to != null)
                ? eventRepository.findBySiteIdAndStartTsGreaterThanEqualAndEndTsLessThanEqualOrderByStartTsDesc(siteId, from, to)
                : eventRepository.findBySiteIdOrderByStartTsDesc(siteId);
        return events.stream()
                .filter(e -> from == null || !e.getStartTs().isBefore(from))
                .filter(e -> to == null || !e.getEndTs().isAfter(to))
                .filter(e -> deviceIds == null || deviceIds.isEmpty() || e.getDeviceIds().stream().anyMatch(deviceIds::contains))
                .collect(Collectors.toList());
    }
}
