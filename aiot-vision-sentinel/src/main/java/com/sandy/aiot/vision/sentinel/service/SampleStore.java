package com.sandy.aiot.vision.sentinel.service;

import com.sandy.aiot.vision.sentinel.entity.Sample;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Read/append access to the time-series samples.
 */
public interface SampleStore {
    /** Samples of the given devices and key with {@code from <= ts <= to}, oldest first. */
    List<Sample> loadSamples(Collection<Long> deviceIds, String key, LocalDateTime from, LocalDateTime to);

    /** Newest sample of any key for the device at or after {@code since}. */
    Optional<Sample> findLatestSince(Long deviceId, LocalDateTime since);

    Optional<Sample> findLatest(Long deviceId);

    /** Appends samples, skipping rows whose (device, key, ts) already exists. Returns rows written. */
    int save(List<Sample> samples);
}
