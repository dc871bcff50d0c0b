package com.sandy.aiot.vision.sentinel.alert;

import com.sandy.aiot.vision.sentinel.notify.DeliveryResult;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one evaluator pass over a site.
 */
@Getter
public class EvaluationReport {

    public enum SkipReason { SNOOZED, OUT_OF_SCHEDULE, COOLDOWN }

    public record RuleSkip(Long alertId, SkipReason reason) {}

    public record RuleFailure(Long alertId, String reason) {}

    private final Long siteId;
    private int rulesEvaluated;
    private final List<Long> firedAlertIds = new ArrayList<>();
    private final List<RuleSkip> skipped = new ArrayList<>();
    private final List<RuleFailure> failures = new ArrayList<>();
    private final List<DeliveryResult> deliveries = new ArrayList<>();

    public EvaluationReport(Long siteId) {
        this.siteId = siteId;
    }

    void evaluated() {
        rulesEvaluated++;
    }

    void fired(Long alertId) {
        firedAlertIds.add(alertId);
    }

    void skip(Long alertId, SkipReason reason) {
        skipped.add(new RuleSkip(alertId, reason));
    }

    void fail(Long alertId, String reason) {
        failures.add(new RuleFailure(alertId, reason));
    }

    void delivered(List<DeliveryResult> results) {
        deliveries.addAll(results);
    }

    public List<Long> getFiredAlertIds() {
        return Collections.unmodifiableList(firedAlertIds);
    }

    public List<RuleSkip> getSkipped() {
        return Collections.unmodifiableList(skipped);
    }

    public List<RuleFailure> getFailures() {
        return Collections.unmodifiableList(failures);
    }

    public List<DeliveryResult> getDeliveries() {
        return Collections.unmodifiableList(deliveries);
    }

    public List<DeliveryResult> getDeliveryFailures() {
        return deliveries.stream().filter(d -> !d.success()).toList();
    }

    public int firedCount() {
        return firedAlertIds.size();
    }
}
