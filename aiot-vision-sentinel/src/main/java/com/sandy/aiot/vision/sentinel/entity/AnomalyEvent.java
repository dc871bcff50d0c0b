package com.sandy.aiot.vision.sentinel.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * A detected spike or sag over a set of devices. Extended in place when a later run lands
 * within the debounce distance, never deleted here.
 */
@Entity
@Table(name = "events",
        uniqueConstraints = @UniqueConstraint(name = "uq_event_site_start_devices", columnNames = {"site_id", "start_ts", "device_key"}),
        indexes = {
                @Index(name = "ix_event_site_key_type", columnList = "site_id, device_key, type"),
                @Index(name = "ix_event_start", columnList = "start_ts")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyEvent {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    @Column(name = "site_id", nullable = false)
    private Long siteId;
    @Column(name = "start_ts", nullable = false)
    private LocalDateTime startTs;
    @Column(name = "end_ts", nullable = false)
    private LocalDateTime endTs;
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private EventType type;
    /** 1..5 */
    private int severity;
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "event_devices", joinColumns = @JoinColumn(name = "event_id"))
    @Column(name = "device_id")
    @Builder.Default
    private Set<Long> deviceIds = new TreeSet<>();
    /** Sorted, comma-joined device ids; identifies the device set in merge lookups. */
    @JsonIgnore
    @Column(name = "device_key", nullable = false, length = 255)
    private String deviceKey;
    @Embedded
    private EventMeta meta;

    public static String deviceKeyOf(Collection<Long> deviceIds) {
        return new TreeSet<>(deviceIds).stream().map(String::valueOf).collect(Collectors.joining(","));
    }
}
