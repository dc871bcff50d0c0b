package com.sandy.aiot.vision.sentinel.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sandy.aiot.vision.sentinel.alert.rule.NotificationTargets;
import com.sandy.aiot.vision.sentinel.entity.AlertRule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns a fired alert into email/webhook requests and pushes them through the
 * {@link NotificationDispatcher}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class NotificationService {

    private final NotificationDispatcher dispatcher;
    private final ObjectMapper objectMapper;

    @Value("${monitor.notify.subject-prefix:[AIoT Vision] Alert: }")
    private String subjectPrefix;

    public List<NotificationRequest> buildRequests(AlertRule rule, NotificationTargets targets,
                                                   Map<String, Object> payload, LocalDateTime firedAt) {
        List<NotificationRequest> requests = new ArrayList<>();
        if (!targets.emails().isEmpty()) {
            requests.add(NotificationRequest.builder()
                    .channel(NotificationChannel.EMAIL)
                    .destinations(targets.emails())
                    .subject(subjectPrefix + rule.getName())
                    .body(emailBody(rule, payload, firedAt))
                    .build());
        }
        if (!targets.webhooks().isEmpty()) {
            requests.add(NotificationRequest.builder()
                    .channel(NotificationChannel.WEBHOOK)
                    .destinations(targets.webhooks())
                    .body(webhookBody(rule, payload, firedAt))
                    .build());
        }
        return requests;
    }

    /** One result per email request, one per webhook url. */
    public List<DeliveryResult> deliver(NotificationRequest request) {
        List<DeliveryResult> results = new ArrayList<>();
        switch (request.getChannel()) {
            case EMAIL -> results.add(dispatcher.sendEmail(request.getDestinations(), request.getSubject(), request.getBody()));
            case WEBHOOK -> {
                for (String url : request.getDestinations()) {
                    results.add(dispatcher.sendWebhook(url, request.getBody()));
                }
            }
        }
        results.stream().filter(r -> !r.success()).forEach(r ->
                log.warn("Notification delivery failed channel={} destination={} reason={}", r.channel(), r.destination(), r.reason()));
        return results;
    }

    private String emailBody(AlertRule rule, Map<String, Object> payload, LocalDateTime firedAt) {
        String details;
        try {
            details = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            details = String.valueOf(payload);
        }
        return "Alert: " + rule.getName() + "\n" +
                "Site: " + rule.getSiteId() + "\n" +
                "Time: " + firedAt + "\n" +
                "Type: " + payload.get("type") + "\n\n" +
                "Details:\n" + details + "\n\n" +
                "---\nAIoT Vision Sentinel\n";
    }

    private String webhookBody(AlertRule rule, Map<String, Object> payload, LocalDateTime firedAt) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("alert_id", rule.getId());
        root.put("alert_name", rule.getName());
        root.put("site_id", rule.getSiteId());
        root.put("timestamp", firedAt.toString());
        root.set("payload", objectMapper.valueToTree(payload));
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize webhook body", e);
        }
    }
}
