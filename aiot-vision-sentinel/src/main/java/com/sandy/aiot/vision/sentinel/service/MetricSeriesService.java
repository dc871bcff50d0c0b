package com.sandy.aiot.vision.sentinel.service;

import com.sandy.aiot.vision.sentinel.entity.Device;
import com.sandy.aiot.vision.sentinel.entity.Sample;
import com.sandy.aiot.vision.sentinel.repository.DeviceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Chart-facing reads and batch appends over the {@link SampleStore}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MetricSeriesService {

    private final SampleStore sampleStore;
    private final DeviceRepository deviceRepository;

    public enum Resolution {
        RAW("raw", 0), MINUTE("1m", 1), QUARTER_HOUR("15m", 15);

        private final String code;
        private final int minutes;

        Resolution(String code, int minutes) {
            this.code = code;
            this.minutes = minutes;
        }

        public static Resolution fromCode(String code) {
            if (code == null || code.isBlank()) return RAW;
            for (Resolution r : values()) {
                if (r.code.equalsIgnoreCase(code.trim())) return r;
            }
            throw new IllegalArgumentException("Unsupported resolution: " + code);
        }

        LocalDateTime bucketOf(LocalDateTime ts) {
            LocalDateTime minute = ts.truncatedTo(ChronoUnit.MINUTES);
            return minute.minusMinutes(minute.getMinute() % minutes);
        }
    }

    public record SeriesPoint(LocalDateTime t, Long deviceId, double value, String deviceName) {}

    public record DeviceInfo(Long id, String name, String type, String unit) {}

    public record MetricSeries(List<SeriesPoint> series, List<DeviceInfo> devices) {}

    /** One reading to append; {@code key} falls back to the device type. */
    public record IngestPoint(Long deviceId, String key, LocalDateTime ts, Double value) {}

    /**
     * Series of {@code key} over {@code [from, to]}. Explicit device ids win over the site's devices.
     * Non-raw resolutions average each device's samples per bucket.
     */
    public MetricSeries query(Long siteId, List<Long> deviceIds, String key, LocalDateTime from, LocalDateTime to,
                              Resolution resolution) {
        List<Long> ids;
        if (deviceIds != null && !deviceIds.isEmpty()) {
            ids = deviceIds;
        } else if (siteId != null) {
            ids = deviceRepository.findBySiteIdOrderByIdAsc(siteId).stream().map(Device::getId).collect(Collectors.toList());
        } else {
            throw new IllegalArgumentException("site_id or device_id is required");
        }
        List<Sample> samples = sampleStore.loadSamples(ids, key, from, to);
        if (samples.isEmpty()) {
            return new MetricSeries(List.of(), List.of());
        }
        Set<Long> present = samples.stream().map(Sample::getDeviceId).collect(Collectors.toCollection(TreeSet::new));
        Map<Long, Device> devices = deviceRepository.findAllById(present).stream()
                .collect(Collectors.toMap(Device::getId, Function.identity()));

        List<SeriesPoint> series = new ArrayList<>();
        if (resolution == Resolution.RAW) {
            for (Sample s : samples) {
                series.add(new SeriesPoint(s.getTimestamp(), s.getDeviceId(), s.getValue(), nameOf(devices, s.getDeviceId())));
            }
        } else {
            // samples arrive oldest first, so insertion order of the buckets is chronological
            Map<LocalDateTime, Map<Long, double[]>> buckets = new LinkedHashMap<>();
            for (Sample s : samples) {
                double[] acc = buckets.computeIfAbsent(resolution.bucketOf(s.getTimestamp()), b -> new TreeMap<>())
                        .computeIfAbsent(s.getDeviceId(), d -> new double[2]);
                acc[0] += s.getValue();
                acc[1]++;
            }
            buckets.forEach((bucket, perDevice) -> perDevice.forEach((deviceId, acc) ->
                    series.add(new SeriesPoint(bucket, deviceId, acc[0] / acc[1], nameOf(devices, deviceId)))));
        }
        List<DeviceInfo> infos = present.stream()
                .map(id -> {
                    Device d = devices.get(id);
                    return d == null ? new DeviceInfo(id, "Device " + id, null, null)
                            : new DeviceInfo(id, d.getName(), d.getType(), d.getUnit());
                })
                .collect(Collectors.toList());
        return new MetricSeries(series, infos);
    }

    /** Validates and appends a batch. Unknown devices reject the whole batch. */
    public int ingest(List<IngestPoint> points) {
        if (points == null || points.isEmpty()) return 0;
        Map<Long, Device> devices = new HashMap<>();
        List<Sample> rows = new ArrayList<>(points.size());
        for (IngestPoint p : points) {
            if (p.deviceId() == null || p.ts() == null || p.value() == null) {
                throw new IllegalArgumentException("device_id, ts and value are required");
            }
            Device device = devices.computeIfAbsent(p.deviceId(), id -> deviceRepository.findById(id)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown device: " + id)));
            String key = p.key() == null || p.key().isBlank() ? device.getType() : p.key().trim();
            rows.add(Sample.builder().deviceId(device.getId()).metricKey(key).timestamp(p.ts()).value(p.value()).build());
        }
        int written = sampleStore.save(rows);
        log.info("Ingested {} of {} samples for {} device(s)", written, rows.size(), devices.size());
        return written;
    }

    private static String nameOf(Map<Long, Device> devices, Long deviceId) {
        Device d = devices.get(deviceId);
        return d == null || d.getName() == null ? "Device " + deviceId : d.getName();
    }
}
