package com.cybergrader.modules.notification;

import lombok.extern.slf4j.Slf4j;

/** Used when no mail sender or admin address is configured. */
@Slf4j
public class LoggingNotifier implements Notifier {

    @Override
    public NotificationResult notify(String subject, String body) {
        log.info("{}\n{}", subject, body);
        return NotificationResult.skipped("email not configured");
    }
}
