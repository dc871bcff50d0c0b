package com.sandy.aiot.vision.sentinel.notify;

public enum NotificationChannel {
    EMAIL,
    WEBHOOK
}
