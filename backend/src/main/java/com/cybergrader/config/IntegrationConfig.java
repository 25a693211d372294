package com.cybergrader.config;

import com.cybergrader.modules.content.ContentFetcher;
import com.cybergrader.modules.content.GitContentFetcher;
import com.cybergrader.modules.content.LocalContentFetcher;
import com.cybergrader.modules.export.DisabledSheetSync;
import com.cybergrader.modules.export.SheetSync;
import com.cybergrader.modules.notification.EmailNotifier;
import com.cybergrader.modules.notification.LoggingNotifier;
import com.cybergrader.modules.notification.Notifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;

import java.time.Clock;

/** Outside collaborators: the content repository, mail and the score spreadsheet. */
@Slf4j
@Configuration
public class IntegrationConfig {

    @Bean
    public ContentFetcher contentFetcher(GraderProperties properties, Clock clock) {
        GraderProperties.Content content = properties.getContent();
        if (content.hasRepo()) {
            return new GitContentFetcher(content.getRepoUrl(), content.getRepoBranch(), content.getRepoPath(), clock);
        }
        return new LocalContentFetcher(content.getRoot());
    }

    @Bean
    public Notifier notifier(ObjectProvider<JavaMailSender> mailSender, GraderProperties properties) {
        GraderProperties.Notifications settings = properties.getNotifications();
        JavaMailSender sender = mailSender.getIfAvailable();
        if (sender == null || settings.getAdminEmail() == null || settings.getAdminEmail().isBlank()) {
            log.info("Admin email not configured, notifications go to the log");
            return new LoggingNotifier();
        }
        return new EmailNotifier(sender, settings.getFromEmail(), settings.getAdminEmail());
    }

    @Bean
    public SheetSync sheetSync() {
        return new DisabledSheetSync();
    }
}
