package com.sandy.aiot.vision.sentinel.alert.rule;

import java.util.List;

public record NotificationTargets(List<String> emails, List<String> webhooks) {

    public static final NotificationTargets NONE = new NotificationTargets(List.of(), List.of());

    public NotificationTargets {
        emails = emails == null ? List.of() : List.copyOf(emails);
        webhooks = webhooks == null ? List.of() : List.copyOf(webhooks);
    }

    public boolean isEmpty() {
        return emails.isEmpty() && webhooks.isEmpty();
    }
}
