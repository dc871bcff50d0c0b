package com.sandy.aiot.vision.sentinel.notify;

import java.util.List;

/**
 * Best-effort delivery. Implementations never throw for delivery problems; they return a failed
 * {@link DeliveryResult} instead.
 */
public interface NotificationDispatcher {
    DeliveryResult sendEmail(List<String> addresses, String subject, String body);

    DeliveryResult sendWebhook(String url, String jsonPayload);
}
