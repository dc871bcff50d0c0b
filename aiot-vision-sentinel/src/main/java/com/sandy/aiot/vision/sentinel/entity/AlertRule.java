package com.sandy.aiot.vision.sentinel.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * User defined alert rule. The rule body is kept as JSON and parsed into a
 * {@link com.sandy.aiot.vision.sentinel.alert.rule.RuleDefinition} whenever it is evaluated.
 * The evaluator only writes {@code lastFiredAt} and {@code snoozedUntil}.
 */
@Entity
@Table(name = "alerts")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertRule {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    @Column(nullable = false)
    private Long siteId;
    @Column(nullable = false, length = 128)
    private String name;
    @Builder.Default
    private boolean enabled = true;
    @Lob
    @Column(name = "rule_json", nullable = false, columnDefinition = "CLOB")
    private String ruleJson;
    private LocalDateTime snoozedUntil;
    private LocalDateTime lastFiredAt;
    private LocalDateTime createdAt;
}
