package com.sandy.aiot.vision.sentinel.alert;

import com.fasterxml.jackson.databind.JsonNode;
import com.sandy.aiot.vision.sentinel.alert.rule.AlertPreset;
import com.sandy.aiot.vision.sentinel.alert.rule.InvalidRuleException;
import com.sandy.aiot.vision.sentinel.alert.rule.RuleDefinition;
import com.sandy.aiot.vision.sentinel.alert.rule.RuleDefinitionCodec;
import com.sandy.aiot.vision.sentinel.alert.rule.Schedule;
import com.sandy.aiot.vision.sentinel.entity.AlertEvent;
import com.sandy.aiot.vision.sentinel.entity.AlertRule;
import com.sandy.aiot.vision.sentinel.repository.AlertEventRepository;
import com.sandy.aiot.vision.sentinel.repository.AlertRuleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Rule management used by the REST layer: creation (custom or preset), snooze, listings.
 * Rule bodies are validated and normalised before they are stored.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AlertRuleService {

    public static final int DEFAULT_SNOOZE_MINUTES = 30;

    private final AlertRuleRepository ruleRepository;
    private final AlertEventRepository alertEventRepository;
    private final RuleDefinitionCodec codec;
    private final Clock clock;

    /**
     * @throws InvalidRuleException when the body does not describe a valid rule
     */
    public AlertRule createRule(Long siteId, String name, JsonNode ruleJson, boolean enabled) {
        if (siteId == null) throw new InvalidRuleException("site_id is required");
        if (name == null || name.isBlank()) throw new InvalidRuleException("name is required");
        RuleDefinition def = codec.parse(ruleJson);
        return save(siteId, name.trim(), def, enabled);
    }

    public AlertRule createPreset(Long siteId, String presetCode, List<Long> deviceIds, Double threshold,
                                  Schedule schedule, Integer durationMinutes) {
        if (siteId == null) throw new InvalidRuleException("site_id is required");
        AlertPreset.Built built = AlertPreset.fromCode(presetCode).build(deviceIds, threshold, schedule, durationMinutes);
        return save(siteId, built.name(), built.definition(), true);
    }

    private AlertRule save(Long siteId, String name, RuleDefinition def, boolean enabled) {
        AlertRule rule = ruleRepository.save(AlertRule.builder()
                .siteId(siteId)
                .name(name)
                .enabled(enabled)
                .ruleJson(codec.toJson(def))
                .createdAt(LocalDateTime.now(clock))
                .build());
        log.info("Created alert rule id={} siteId={} name={} type={}", rule.getId(), siteId, name, def.type().code());
        return rule;
    }

    @Transactional
    public Optional<AlertRule> snooze(Long alertId, Integer minutes) {
        int m = minutes == null ? DEFAULT_SNOOZE_MINUTES : minutes;
        if (m < 0) throw new IllegalArgumentException("minutes must be >= 0");
        return ruleRepository.findByIdForUpdate(alertId).map(rule -> {
            rule.setSnoozedUntil(LocalDateTime.now(clock).plusMinutes(m));
            AlertRule saved = ruleRepository.save(rule);
            log.info("Alert snoozed alertId={} until={}", alertId, saved.getSnoozedUntil());
            return saved;
        });
    }

    public List<AlertRule> listRules(Long siteId) {
        return siteId == null ? ruleRepository.findAllByOrderByIdAsc() : ruleRepository.findBySiteIdOrderByIdAsc(siteId);
    }

    /** Firings newest first, optionally bounded by {@code from <= ts <= to}. */
    public List<AlertEvent> findAlertEvents(Long alertId, LocalDateTime from, LocalDateTime to) {
        List<AlertEvent> events = alertId == null
                ? alertEventRepository.findAllByOrderByTsDesc()
                : alertEventRepository.findByAlertIdOrderByTsDesc(alertId);
        return events.stream()
                .filter(e -> from == null || !e.getTs().isBefore(from))
                .filter(e -> to == null || !e.getTs().isAfter(to))
                .collect(Collectors.toList());
    }
}
