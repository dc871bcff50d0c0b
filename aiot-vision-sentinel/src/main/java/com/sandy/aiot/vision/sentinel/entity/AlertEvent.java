package com.sandy.aiot.vision.sentinel.entity;

import com.fasterxml.jackson.annotation.JsonRawValue;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/** Append-only record of one alert firing. */
@Entity
@Table(name = "alert_events", indexes = @Index(name = "ix_alert_event_alert_ts", columnList = "alert_id, ts"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertEvent {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    @Column(name = "alert_id", nullable = false)
    private Long alertId;
    @Column(nullable = false)
    private LocalDateTime ts;
    @JsonRawValue
    @Lob
    @Column(nullable = false, columnDefinition = "CLOB")
    private String payload;
}
