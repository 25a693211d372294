package com.cybergrader.modules.notification;

public record NotificationResult(String status, String message) {

    public static NotificationResult sent(String message) {
        return new NotificationResult("sent", message);
    }

    public static NotificationResult skipped(String message) {
        return new NotificationResult("skipped", message);
    }

    public static NotificationResult failed(String message) {
        return new NotificationResult("error", message);
    }
}
