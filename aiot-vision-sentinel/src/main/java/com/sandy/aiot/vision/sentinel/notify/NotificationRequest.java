package com.sandy.aiot.vision.sentinel.notify;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One delivery to hand to the dispatcher. For webhooks {@code body} is the JSON document and
 * {@code subject} is unused.
 */
@Value
@Builder
public class NotificationRequest {
    NotificationChannel channel;
    List<String> destinations;
    String subject;
    String body;
}
