package com.cybergrader.modules.notification;

/**
 * Best-effort outbound notification. Implementations report failure through
 * the returned {@link NotificationResult} and never throw.
 */
public interface Notifier {

    NotificationResult notify(String subject, String body);
}
