package com.sandy.aiot.vision.sentinel.alert.rule;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts between the rule JSON stored on {@code alerts.rule_json} and {@link RuleDefinition}.
 * Field names: type, device_ids, key, op, value, duration_sec, schedule{start,end}, action{email,webhook}.
 */
@Component
@RequiredArgsConstructor
public class RuleDefinitionCodec {

    private final ObjectMapper objectMapper;

    @Value("${monitor.alert.nodata-default-seconds:300}")
    private long nodataDefaultSeconds = 300;

    public RuleDefinition parse(String json) {
        if (json == null || json.isBlank()) throw new InvalidRuleException("rule_json is empty");
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new InvalidRuleException("rule_json is not valid JSON: " + e.getOriginalMessage(), e);
        }
        return parse(root);
    }

    public RuleDefinition parse(JsonNode root) {
        if (root == null || !root.isObject()) throw new InvalidRuleException("rule_json must be an object");
        RuleType type = RuleType.fromCode(requiredText(root, "type"));
        RuleCondition condition = switch (type) {
            case THRESHOLD -> threshold(root);
            case TIMEWINDOW -> new TimeWindowCondition(threshold(root));
            case NODATA -> new NoDataCondition(deviceIds(root), root.path("duration_sec").asLong(nodataDefaultSeconds));
        };
        return new RuleDefinition(condition, schedule(root), targets(root));
    }

    public String toJson(RuleDefinition def) {
        try {
            return objectMapper.writeValueAsString(toNode(def));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize rule definition", e);
        }
    }

    public ObjectNode toNode(RuleDefinition def) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("type", def.type().code());
        ArrayNode ids = root.putArray("device_ids");
        def.condition().deviceIds().forEach(ids::add);
        ThresholdCondition threshold = null;
        if (def.condition() instanceof ThresholdCondition t) {
            threshold = t;
        } else if (def.condition() instanceof TimeWindowCondition tw) {
            threshold = tw.threshold();
        } else if (def.condition() instanceof NoDataCondition nd) {
            root.put("duration_sec", nd.durationSec());
        }
        if (threshold != null) {
            root.put("key", threshold.key());
            root.put("op", threshold.op().code());
            root.put("value", threshold.value());
            root.put("duration_sec", threshold.durationSec());
        }
        if (def.schedule() != null) {
            ObjectNode schedule = root.putObject("schedule");
            schedule.put("start", def.schedule().startText());
            schedule.put("end", def.schedule().endText());
        }
        ObjectNode action = root.putObject("action");
        ArrayNode email = action.putArray("email");
        def.targets().emails().forEach(email::add);
        ArrayNode webhook = action.putArray("webhook");
        def.targets().webhooks().forEach(webhook::add);
        return root;
    }

    private ThresholdCondition threshold(JsonNode root) {
        JsonNode value = root.get("value");
        if (value == null || !value.isNumber()) throw new InvalidRuleException("value must be a number");
        return new ThresholdCondition(
                deviceIds(root),
                requiredText(root, "key"),
                Comparison.fromCode(requiredText(root, "op")),
                value.asDouble(),
                root.path("duration_sec").asLong(0));
    }

    private List<Long> deviceIds(JsonNode root) {
        JsonNode node = root.get("device_ids");
        if (node == null || !node.isArray() || node.isEmpty()) throw new InvalidRuleException("device_ids must be a non-empty array");
        List<Long> ids = new ArrayList<>();
        for (JsonNode n : node) {
            if (!n.canConvertToLong()) throw new InvalidRuleException("device_ids must hold integers, got " + n);
            ids.add(n.asLong());
        }
        return ids;
    }

    private Schedule schedule(JsonNode root) {
        JsonNode node = root.get("schedule");
        if (node == null || node.isNull()) return null;
        if (!node.isObject()) throw new InvalidRuleException("schedule must be an object");
        return Schedule.of(node.path("start").asText(null), node.path("end").asText(null));
    }

    private NotificationTargets targets(JsonNode root) {
        JsonNode action = root.get("action");
        if (action == null || action.isNull()) return NotificationTargets.NONE;
        return new NotificationTargets(textList(action, "email"), textList(action, "webhook"));
    }

    private List<String> textList(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) return List.of();
        if (!node.isArray()) throw new InvalidRuleException("action." + field + " must be an array");
        List<String> out = new ArrayList<>();
        node.forEach(n -> {
            if (!n.asText().isBlank()) out.add(n.asText().trim());
        });
        return out;
    }

    private String requiredText(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull() || node.asText().isBlank()) throw new InvalidRuleException(field + " is required");
        return node.asText();
    }
}
