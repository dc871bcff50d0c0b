package com.sandy.aiot.vision.sentinel.alert;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandy.aiot.vision.sentinel.entity.AlertEvent;
import com.sandy.aiot.vision.sentinel.entity.AlertRule;
import com.sandy.aiot.vision.sentinel.repository.AlertEventRepository;
import com.sandy.aiot.vision.sentinel.repository.AlertRuleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;

/**
 * Authoritative fire decision. The rule row is locked, the cooldown re-checked against the stored
 * {@code last_fired_at}, then {@code last_fired_at} and the {@link AlertEvent} are written in the
 * same transaction. Two overlapping evaluator passes therefore record at most one firing per
 * cooldown window.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AlertFiringService {

    private final AlertRuleRepository ruleRepository;
    private final AlertEventRepository alertEventRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Value("${monitor.alert.cooldown-seconds:300}")
    private long cooldownSeconds;

    public record Firing(AlertRule rule, AlertEvent event) {}

    /**
     * @param enforceCooldown false for manual test firings
     * @return empty when the rule is gone or still cooling down
     */
    @Transactional
    public Optional<Firing> fire(Long alertId, Map<String, Object> payload, boolean enforceCooldown) {
        Optional<AlertRule> opt = ruleRepository.findByIdForUpdate(alertId);
        if (opt.isEmpty()) {
            log.warn("Alert rule disappeared before firing alertId={}", alertId);
            return Optional.empty();
        }
        AlertRule rule = opt.get();
        LocalDateTime now = LocalDateTime.now(clock);
        if (enforceCooldown && isCoolingDown(rule, now)) {
            log.info("Alert firing suppressed by cooldown alertId={} lastFiredAt={} cooldown={}s", alertId, rule.getLastFiredAt(), cooldownSeconds);
            return Optional.empty();
        }
        rule.setLastFiredAt(now);
        ruleRepository.save(rule);
        AlertEvent event = alertEventRepository.save(AlertEvent.builder()
                .alertId(alertId)
                .ts(now)
                .payload(toJson(payload))
                .build());
        log.info("Alert fired alertId={} name={} type={} eventId={}", alertId, rule.getName(), payload.get("type"), event.getId());
        return Optional.of(new Firing(rule, event));
    }

    /** True while {@code now - last_fired_at < cooldown}. */
    public boolean isCoolingDown(AlertRule rule, LocalDateTime now) {
        LocalDateTime last = rule.getLastFiredAt();
        if (last == null) return false;
        return Duration.between(last, now).compareTo(Duration.ofSeconds(cooldownSeconds)) < 0;
    }

    private String toJson(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize alert payload", e);
        }
    }
}
