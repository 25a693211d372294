package com.cybergrader.modules.notification;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.web.util.HtmlUtils;

/**
 * Mails notifications to the configured admin address.
 */
@Slf4j
@RequiredArgsConstructor
public class EmailNotifier implements Notifier {

    private final JavaMailSender mailSender;
    private final String fromEmail;
    private final String adminEmail;

    @Override
    public NotificationResult notify(String subject, String body) {
        try {
            MimeMessage message = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, true, "UTF-8");

            helper.setFrom(fromEmail);
            helper.setTo(adminEmail);
            helper.setSubject(subject);

            String html = String.format("""
                    <html><body>
                    <h2>%s</h2>
                    <pre>%s</pre>
                    <p>Cyber Grader</p>
                    </body></html>
                    """, HtmlUtils.htmlEscape(subject), HtmlUtils.htmlEscape(body));

            helper.setText(html, true);
            mailSender.send(message);
            log.info("Notification '{}' sent to {}", subject, adminEmail);
            return NotificationResult.sent("sent to " + adminEmail);
        } catch (MailException | MessagingException e) {
            log.error("Failed to send notification '{}' to {}: {}", subject, adminEmail, e.getMessage());
            return NotificationResult.failed(e.getMessage());
        }
    }
}
