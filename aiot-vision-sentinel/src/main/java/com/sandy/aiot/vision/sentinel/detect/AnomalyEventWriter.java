package com.sandy.aiot.vision.sentinel.detect;

import com.sandy.aiot.vision.sentinel.entity.AnomalyEvent;
import com.sandy.aiot.vision.sentinel.entity.EventMeta;
import com.sandy.aiot.vision.sentinel.repository.AnomalyEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Writes detected runs as events. A run that lands within {@code debounce-seconds} of an existing
 * event of the same site, device set and type widens that event instead of creating a new row.
 * The lookup and the write share one transaction and the matched rows are locked.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AnomalyEventWriter {

    private final AnomalyEventRepository eventRepository;

    @Value("${monitor.detector.debounce-seconds:60}")
    private long debounceSeconds;

    public record Result(PersistOutcome outcome, AnomalyEvent event) {}

    @Transactional
    public Result persist(Long siteId, Set<Long> deviceIds, AnomalyCandidate c) {
        String deviceKey = AnomalyEvent.deviceKeyOf(deviceIds);
        LocalDateTime windowStart = c.startTs().minusSeconds(debounceSeconds);
        LocalDateTime windowEnd = c.endTs().plusSeconds(debounceSeconds);
        List<AnomalyEvent> overlapping = eventRepository.findOverlappingForUpdate(siteId, deviceKey, c.type(), windowStart, windowEnd);
        if (!overlapping.isEmpty()) {
            AnomalyEvent existing = overlapping.get(0);
            boolean widened = widen(existing, c);
            eventRepository.save(existing);
            log.debug("Merged {} run into event id={} siteId={} devices={} range=[{} .. {}] widened={}",
                    c.type().code(), existing.getId(), siteId, deviceKey, existing.getStartTs(), existing.getEndTs(), widened);
            return new Result(PersistOutcome.MERGED, existing);
        }
        if (eventRepository.existsBySiteIdAndStartTsAndDeviceKey(siteId, c.startTs(), deviceKey)) {
            log.debug("Duplicate event suppressed siteId={} devices={} start={}", siteId, deviceKey, c.startTs());
            return new Result(PersistOutcome.DUPLICATE, null);
        }
        AnomalyEvent event = AnomalyEvent.builder()
                .siteId(siteId)
                .startTs(c.startTs())
                .endTs(c.endTs())
                .type(c.type())
                .severity(c.severity())
                .deviceIds(new TreeSet<>(deviceIds))
                .deviceKey(deviceKey)
                .meta(EventMeta.builder()
                        .peakValue(c.peakValue())
                        .zmax(c.zmax())
                        .baselineMu(c.baselineMu())
                        .baselineSigma(c.baselineSigma())
                        .build())
                .build();
        eventRepository.save(event);
        log.info("Created {} event id={} siteId={} devices={} range=[{} .. {}] severity={} zmax={}",
                c.type().code(), event.getId(), siteId, deviceKey, c.startTs(), c.endTs(), event.getSeverity(),
                String.format("%.2f", c.zmax()));
        return new Result(PersistOutcome.CREATED, event);
    }

    /** Union of both ranges; severity, peak and zmax only move up. */
    private boolean widen(AnomalyEvent existing, AnomalyCandidate c) {
        boolean changed = false;
        if (c.startTs().isBefore(existing.getStartTs())) {
            existing.setStartTs(c.startTs());
            changed = true;
        }
        if (c.endTs().isAfter(existing.getEndTs())) {
            existing.setEndTs(c.endTs());
            changed = true;
        }
        EventMeta meta = existing.getMeta();
        if (meta != null && c.zmax() > meta.getZmax()) {
            meta.setZmax(c.zmax());
            meta.setPeakValue(c.peakValue());
            existing.setSeverity(Math.max(existing.getSeverity(), c.severity()));
            changed = true;
        }
        return changed;
    }
}
