package com.sandy.aiot.vision.sentinel.notify;

public record DeliveryResult(NotificationChannel channel, String destination, boolean success, String reason) {

    public static DeliveryResult ok(NotificationChannel channel, String destination) {
        return new DeliveryResult(channel, destination, true, null);
    }

    public static DeliveryResult failure(NotificationChannel channel, String destination, String reason) {
        return new DeliveryResult(channel, destination, false, reason);
    }
}
