package com.cybergrader.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Process-wide settings, bound once from {@code grader.*} and injected where needed.
 */
@Data
@ConfigurationProperties(prefix = "grader")
public class GraderProperties {

    private Content content = new Content();
    private Store store = new Store();
    private Notifications notifications = new Notifications();

    @Data
    public static class Content {
        /** Bundled content root, used directly or as the fallback when cloning fails. */
        private Path root = Path.of("content");
        private String repoUrl;
        private Path repoPath = Path.of(System.getProperty("java.io.tmpdir"), "cyber-grader-content");
        private String repoBranch = "main";
        private String refreshSchedule = "nightly";
        private String refreshCron = "0 0 3 * * *";
        private boolean refreshEnabled = false;
        private boolean syncOnStartup = true;

        public boolean hasRepo() {
            return repoUrl != null && !repoUrl.isBlank();
        }
    }

    @Data
    public static class Store {
        private Backend backend = Backend.AUTO;
        private String databaseUrl;
        private String databaseUsername;
        private String databasePassword;
        private String databaseSchema = "public";
        private String backupSchedule = "nightly";
        private String supabaseUrl;
        private String supabaseKey;
        private Duration timeout = Duration.ofSeconds(5);

        public boolean hasDatabase() {
            return databaseUrl != null && !databaseUrl.isBlank();
        }

        public boolean hasSupabase() {
            return supabaseUrl != null && !supabaseUrl.isBlank()
                    && supabaseKey != null && !supabaseKey.isBlank();
        }
    }

    @Data
    public static class Notifications {
        private String adminEmail;
        private String fromEmail = "noreply@cybergrader.local";
    }

    public enum Backend {
        AUTO, MEMORY, POSTGRES, SUPABASE
    }
}
