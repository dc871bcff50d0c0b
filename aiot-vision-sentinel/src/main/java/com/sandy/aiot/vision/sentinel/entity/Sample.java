package com.sandy.aiot.vision.sentinel.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One sensor reading. Rows are never updated once written.
 */
@Entity
@Table(name = "samples",
        uniqueConstraints = @UniqueConstraint(name = "uq_sample_device_key_ts", columnNames = {"device_id", "metric_key", "ts"}),
        indexes = @Index(name = "ix_sample_device_ts", columnList = "device_id, ts"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Sample {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    @Column(name = "device_id", nullable = false)
    private Long deviceId;
    @Column(name = "metric_key", nullable = false, length = 32)
    private String metricKey;
    @Column(name = "ts", nullable = false)
    private LocalDateTime timestamp;
    @Column(name = "\"value\"", nullable = false)
    private double value;
}
