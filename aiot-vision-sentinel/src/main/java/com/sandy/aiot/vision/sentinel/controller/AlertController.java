package com.sandy.aiot.vision.sentinel.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandy.aiot.vision.sentinel.alert.AlertEvaluationService;
import com.sandy.aiot.vision.sentinel.alert.AlertRuleService;
import com.sandy.aiot.vision.sentinel.alert.EvaluationReport;
import com.sandy.aiot.vision.sentinel.alert.rule.InvalidRuleException;
import com.sandy.aiot.vision.sentinel.alert.rule.Schedule;
import com.sandy.aiot.vision.sentinel.entity.AlertEvent;
import com.sandy.aiot.vision.sentinel.entity.AlertRule;
import com.sandy.aiot.vision.sentinel.notify.DeliveryResult;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Alert rule management: listing, creation (custom or preset), test firing, snooze,
 * manual evaluation and the firing history.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class AlertController {

    private final AlertRuleService ruleService;
    private final AlertEvaluationService evaluationService;
    private final ObjectMapper objectMapper;

    @GetMapping("/alerts")
    public List<AlertItem> list(@RequestParam(value = "site_id", required = false) Long siteId) {
        return ruleService.listRules(siteId).stream().map(this::toItem).collect(Collectors.toList());
    }

    @PostMapping("/alerts")
    public ResponseEntity<?> create(@RequestBody CreateReq req) {
        AlertRule rule;
        if (req.getPresetType() != null && !req.getPresetType().isBlank()) {
            Schedule schedule = req.getSchedule() == null ? null : Schedule.of(req.getSchedule().getStart(), req.getSchedule().getEnd());
            rule = ruleService.createPreset(req.getSiteId(), req.getPresetType(), req.getDeviceIds(), req.getThreshold(),
                    schedule, req.getDurationMinutes());
        } else {
            rule = ruleService.createRule(req.getSiteId(), req.getName(), req.getRuleJson(),
                    req.getEnabled() == null || req.getEnabled());
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(toItem(rule));
    }

    @PostMapping("/alerts/{id}/test")
    public ResponseEntity<?> test(@PathVariable Long id) {
        Optional<EvaluationReport> report = evaluationService.fireTest(id);
        if (report.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ActionResp.fail("Alert not found"));
        }
        return ResponseEntity.ok(toEvalResp(report.get()));
    }

    @PostMapping("/alerts/{id}/snooze")
    public ResponseEntity<SnoozeResp> snooze(@PathVariable Long id, @RequestBody(required = false) SnoozeReq req) {
        Integer minutes = req == null ? null : req.getMinutes();
        return ruleService.snooze(id, minutes)
                .map(rule -> {
                    SnoozeResp resp = new SnoozeResp();
                    resp.setSuccess(true);
                    resp.setSnoozedUntil(rule.getSnoozedUntil());
                    return ResponseEntity.ok(resp);
                })
                .orElseGet(() -> {
                    SnoozeResp resp = new SnoozeResp();
                    resp.setSuccess(false);
                    resp.setMessage("Alert not found");
                    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(resp);
                });
    }

    @PostMapping("/alerts/evaluate")
    public EvalResp evaluate(@RequestParam("site_id") Long siteId) {
        return toEvalResp(evaluationService.evaluate(siteId));
    }

    @GetMapping("/alert-events")
    public List<AlertEvent> alertEvents(@RequestParam(value = "alert_id", required = false) Long alertId,
                                        @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
                                        @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to) {
        return ruleService.findAlertEvents(alertId, from, to);
    }

    @ExceptionHandler({InvalidRuleException.class, IllegalArgumentException.class})
    public ResponseEntity<ActionResp> badRequest(RuntimeException e) {
        log.warn("Rejected alert request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(ActionResp.fail(e.getMessage()));
    }

    private AlertItem toItem(AlertRule a) {
        AlertItem it = new AlertItem();
        it.setId(a.getId());
        it.setSiteId(a.getSiteId());
        it.setName(a.getName());
        it.setEnabled(a.isEnabled());
        try {
            it.setRuleJson(objectMapper.readTree(a.getRuleJson()));
        } catch (JsonProcessingException e) {
            it.setRuleJson(objectMapper.getNodeFactory().textNode(a.getRuleJson()));
        }
        it.setSnoozedUntil(a.getSnoozedUntil());
        it.setLastFiredAt(a.getLastFiredAt());
        it.setCreatedAt(a.getCreatedAt());
        return it;
    }

    private EvalResp toEvalResp(EvaluationReport r) {
        EvalResp resp = new EvalResp();
        resp.setSiteId(r.getSiteId());
        resp.setRulesEvaluated(r.getRulesEvaluated());
        resp.setFiredAlertIds(r.getFiredAlertIds());
        resp.setSkipped(r.getSkipped());
        resp.setFailures(r.getFailures());
        resp.setDeliveries(r.getDeliveries());
        return resp;
    }

    @Data
    public static class AlertItem {
        private Long id;
        private Long siteId;
        private String name;
        private boolean enabled;
        private JsonNode ruleJson;
        private LocalDateTime snoozedUntil;
        private LocalDateTime lastFiredAt;
        private LocalDateTime createdAt;
    }

    @Data
    public static class ScheduleReq {
        private String start;
        private String end;
    }

    @Data
    public static class CreateReq {
        private Long siteId;
        private String name;
        private JsonNode ruleJson;
        private Boolean enabled;
        // preset fields
        private String presetType;
        private List<Long> deviceIds;
        private Double threshold;
        private ScheduleReq schedule;
        private Integer durationMinutes;
    }

    @Data
    public static class SnoozeReq {
        private Integer minutes;
    }

    @Data
    public static class SnoozeResp {
        private boolean success;
        private String message;
        private LocalDateTime snoozedUntil;
    }

    @Data
    public static class EvalResp {
        private Long siteId;
        private int rulesEvaluated;
        private List<Long> firedAlertIds;
        private List<EvaluationReport.RuleSkip> skipped;
        private List<EvaluationReport.RuleFailure> failures;
        private List<DeliveryResult> deliveries;
    }
}
