package com.sandy.aiot.vision.sentinel.alert;

import com.sandy.aiot.vision.sentinel.alert.rule.*;
import com.sandy.aiot.vision.sentinel.entity.AlertRule;
import com.sandy.aiot.vision.sentinel.entity.Device;
import com.sandy.aiot.vision.sentinel.entity.Sample;
import com.sandy.aiot.vision.sentinel.notify.NotificationRequest;
import com.sandy.aiot.vision.sentinel.notify.NotificationService;
import com.sandy.aiot.vision.sentinel.repository.AlertRuleRepository;
import com.sandy.aiot.vision.sentinel.repository.DeviceRepository;
import com.sandy.aiot.vision.sentinel.repository.SiteRepository;
import com.sandy.aiot.vision.sentinel.service.SampleStore;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.*;
import java.util.*;

/**
 * Evaluates the enabled alert rules of a site. Per rule: parse, snooze gate, schedule gate,
 * type-specific condition, cooldown-guarded firing. Notifications for the pass are sent after
 * every rule has been evaluated; a failed delivery never undoes the firing record.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AlertEvaluationService {

    private final AlertRuleRepository ruleRepository;
    private final SiteRepository siteRepository;
    private final DeviceRepository deviceRepository;
    private final SampleStore sampleStore;
    private final RuleDefinitionCodec codec;
    private final AlertFiringService firingService;
    private final NotificationService notificationService;
    private final Clock clock;

    @Value("${monitor.alert.enabled:true}")
    private boolean enabled;
    @Value("${monitor.alert.threshold-lookback-seconds:300}")
    private long thresholdLookbackSeconds;
    @Value("${monitor.alert.default-zone:UTC}")
    private String defaultZone;

    private record PendingNotification(AlertRule rule, NotificationTargets targets, Map<String, Object> payload, LocalDateTime firedAt) {}

    @PostConstruct
    public void init() {
        log.info("Alert evaluator initialized: enabled={} thresholdLookback={}s defaultZone={}", enabled, thresholdLookbackSeconds, defaultZone);
    }

    /**
     * A storage failure aborts the rest of the pass and is rethrown after the notifications of
     * rules already fired have been sent.
     */
    public EvaluationReport evaluate(Long siteId) {
        EvaluationReport report = new EvaluationReport(siteId);
        if (!enabled) return report;
        List<AlertRule> rules = ruleRepository.findBySiteIdAndEnabledTrueOrderByIdAsc(siteId);
        if (rules.isEmpty()) {
            log.debug("No enabled alert rules siteId={}", siteId);
            return report;
        }
        LocalDateTime now = LocalDateTime.now(clock);
        LocalTime localNow = LocalTime.now(clock.withZone(zoneOf(siteId)));
        List<PendingNotification> pending = new ArrayList<>();
        try {
            for (AlertRule rule : rules) {
                evaluateRule(rule, now, localNow, report, pending);
            }
        } finally {
            for (PendingNotification p : pending) {
                for (NotificationRequest request : notificationService.buildRequests(p.rule(), p.targets(), p.payload(), p.firedAt())) {
                    report.delivered(notificationService.deliver(request));
                }
            }
        }
        log.info("Alert evaluation completed siteId={} rules={} evaluated={} fired={} skipped={} failures={} deliveryFailures={}",
                siteId, rules.size(), report.getRulesEvaluated(), report.firedCount(), report.getSkipped().size(),
                report.getFailures().size(), report.getDeliveryFailures().size());
        return report;
    }

    /** Number of alerts fired. */
    public int runAlertEvaluation(Long siteId) {
        return evaluate(siteId).firedCount();
    }

    /**
     * Fires the rule right away with a test payload, ignoring snooze, schedule and cooldown.
     */
    public Optional<EvaluationReport> fireTest(Long alertId) {
        Optional<AlertRule> opt = ruleRepository.findById(alertId);
        if (opt.isEmpty()) return Optional.empty();
        AlertRule rule = opt.get();
        EvaluationReport report = new EvaluationReport(rule.getSiteId());
        NotificationTargets targets = NotificationTargets.NONE;
        try {
            targets = codec.parse(rule.getRuleJson()).targets();
        } catch (InvalidRuleException e) {
            log.warn("Test firing malformed rule alertId={} error={}, no notification targets", alertId, e.getMessage());
            report.fail(alertId, e.getMessage());
        }
        LocalDateTime now = LocalDateTime.now(clock);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "test");
        payload.put("message", "This is a test alert");
        payload.put("timestamp", now.toString());
        Optional<AlertFiringService.Firing> firing = firingService.fire(alertId, payload, false);
        if (firing.isPresent()) {
            report.fired(alertId);
            for (NotificationRequest request : notificationService.buildRequests(firing.get().rule(), targets, payload, now)) {
                report.delivered(notificationService.deliver(request));
            }
        }
        return Optional.of(report);
    }

    private void evaluateRule(AlertRule rule, LocalDateTime now, LocalTime localNow,
                              EvaluationReport report, List<PendingNotification> pending) {
        RuleDefinition def;
        try {
            def = codec.parse(rule.getRuleJson());
        } catch (InvalidRuleException e) {
            log.warn("Skipping malformed alert rule alertId={} name={} error={}", rule.getId(), rule.getName(), e.getMessage());
            report.fail(rule.getId(), e.getMessage());
            return;
        }
        if (rule.getSnoozedUntil() != null && now.isBefore(rule.getSnoozedUntil())) {
            log.debug("Alert snoozed alertId={} until={}", rule.getId(), rule.getSnoozedUntil());
            report.skip(rule.getId(), EvaluationReport.SkipReason.SNOOZED);
            return;
        }
        if (def.schedule() != null && !def.schedule().contains(localNow)) {
            log.debug("Alert outside schedule alertId={} schedule={}-{} now={}", rule.getId(),
                    def.schedule().startText(), def.schedule().endText(), localNow);
            report.skip(rule.getId(), EvaluationReport.SkipReason.OUT_OF_SCHEDULE);
            return;
        }
        report.evaluated();
        Optional<Map<String, Object>> trigger;
        try {
            trigger = checkCondition(def.condition(), now);
        } catch (DataAccessException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Failed evaluating alert rule alertId={} error={}", rule.getId(), e.getMessage(), e);
            report.fail(rule.getId(), e.getMessage());
            return;
        }
        if (trigger.isEmpty()) return;
        if (firingService.isCoolingDown(rule, now)) {
            log.debug("Alert condition met but cooling down alertId={} lastFiredAt={}", rule.getId(), rule.getLastFiredAt());
            report.skip(rule.getId(), EvaluationReport.SkipReason.COOLDOWN);
            return;
        }
        Optional<AlertFiringService.Firing> firing = firingService.fire(rule.getId(), trigger.get(), true);
        if (firing.isEmpty()) {
            report.skip(rule.getId(), EvaluationReport.SkipReason.COOLDOWN);
            return;
        }
        report.fired(rule.getId());
        if (!def.targets().isEmpty()) {
            pending.add(new PendingNotification(firing.get().rule(), def.targets(), trigger.get(), now));
        }
    }

    Optional<Map<String, Object>> checkCondition(RuleCondition condition, LocalDateTime now) {
        if (condition instanceof ThresholdCondition t) {
            return checkSustained(t, RuleType.THRESHOLD, now);
        }
        if (condition instanceof TimeWindowCondition tw) {
            return checkSustained(tw.threshold(), RuleType.TIMEWINDOW, now);
        }
        if (condition instanceof NoDataCondition nd) {
            return checkNoData(nd, now);
        }
        throw new IllegalStateException("Unhandled rule condition " + condition.getClass().getSimpleName());
    }

    /**
     * Walks samples newest to oldest. A passing sample opens a run if none is open; the condition
     * holds once the run spans {@code durationSec}. A failing sample closes the run.
     */
    private Optional<Map<String, Object>> checkSustained(ThresholdCondition t, RuleType type, LocalDateTime now) {
        long lookback = Math.max(thresholdLookbackSeconds, t.durationSec());
        List<Sample> samples = new ArrayList<>(sampleStore.loadSamples(t.deviceIds(), t.key(), now.minusSeconds(lookback), now));
        if (samples.isEmpty()) {
            log.debug("No recent samples for {} rule devices={} key={}", type.code(), t.deviceIds(), t.key());
            return Optional.empty();
        }
        Collections.reverse(samples);
        Duration required = Duration.ofSeconds(t.durationSec());
        LocalDateTime runStart = null;
        boolean met = false;
        for (Sample s : samples) {
            if (t.op().test(s.getValue(), t.value())) {
                if (runStart == null) runStart = s.getTimestamp();
                if (Duration.between(s.getTimestamp(), runStart).compareTo(required) >= 0) {
                    met = true;
                    break;
                }
            } else {
                runStart = null;
            }
        }
        if (!met) return Optional.empty();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", type.code());
        payload.put("condition", t.describe());
        payload.put("duration", t.durationSec() + "s");
        payload.put("devices", t.deviceIds());
        payload.put("trigger_value", samples.get(0).getValue());
        return Optional.of(payload);
    }

    /**
     * The first silent device in rule order is the trigger; every silent device is listed.
     */
    private Optional<Map<String, Object>> checkNoData(NoDataCondition nd, LocalDateTime now) {
        LocalDateTime since = now.minusSeconds(nd.durationSec());
        Device trigger = null;
        List<Long> silent = new ArrayList<>();
        for (Long deviceId : nd.deviceIds()) {
            Optional<Device> device = deviceRepository.findById(deviceId);
            if (device.isEmpty()) {
                log.warn("No-data rule references unknown device deviceId={}", deviceId);
                continue;
            }
            if (sampleStore.findLatestSince(deviceId, since).isEmpty()) {
                silent.add(deviceId);
                if (trigger == null) trigger = device.get();
            }
        }
        if (trigger == null) return Optional.empty();
        LocalDateTime lastSeen = sampleStore.findLatest(trigger.getId())
                .map(Sample::getTimestamp)
                .orElse(trigger.getLastSeenAt());
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", RuleType.NODATA.code());
        payload.put("device_id", trigger.getId());
        payload.put("device_name", trigger.getName());
        payload.put("duration", nd.durationSec() + "s");
        payload.put("last_seen", lastSeen == null ? null : lastSeen.toString());
        payload.put("silent_device_ids", silent);
        return Optional.of(payload);
    }

    private ZoneId zoneOf(Long siteId) {
        String tz = siteRepository.findById(siteId).map(s -> s.getTz()).orElse(null);
        if (tz == null || tz.isBlank()) tz = defaultZone;
        try {
            return ZoneId.of(tz);
        } catch (DateTimeException e) {
            log.warn("Invalid time zone '{}' for siteId={}, falling back to {}", tz, siteId, defaultZone);
            return ZoneId.of(defaultZone);
        }
    }
}
