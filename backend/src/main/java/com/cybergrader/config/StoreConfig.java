package com.cybergrader.config;

import com.cybergrader.config.GraderProperties.Backend;
import com.cybergrader.modules.content.ContentWorkspace;
import com.cybergrader.modules.grading.SubmissionValidator;
import com.cybergrader.modules.store.CoreStore;
import com.cybergrader.modules.store.DurableBackend;
import com.cybergrader.modules.store.GradingStore;
import com.cybergrader.modules.store.JdbcDurableBackend;
import com.cybergrader.modules.store.PersistingStore;
import com.cybergrader.modules.store.StoreRowMapper;
import com.cybergrader.modules.store.SupabaseDurableBackend;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Builds the single {@link GradingStore}. The backend is picked from
 * {@code grader.store.backend}; {@code auto} prefers a database URL, then
 * Supabase credentials, then memory. Persistent stores are closed with the
 * context through their {@code close()} method.
 */
@Slf4j
@Configuration
public class StoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public GradingStore gradingStore(GraderProperties properties,
            SubmissionValidator validator,
            ContentWorkspace workspace,
            Clock clock,
            RestTemplateBuilder restTemplateBuilder) {
        CoreStore core = new CoreStore(workspace::root, validator, clock);
        GraderProperties.Store settings = properties.getStore();
        Backend backend = resolveBackend(settings);
        log.info("Store backend: {} (configured {})", backend, settings.getBackend());

        StoreRowMapper rows = new StoreRowMapper();
        DurableBackend durable = switch (backend) {
            case MEMORY, AUTO -> null;
            case POSTGRES -> new JdbcDurableBackend(
                    settings.getDatabaseUrl(),
                    settings.getDatabaseUsername(),
                    settings.getDatabasePassword(),
                    settings.getDatabaseSchema(),
                    settings.getTimeout(),
                    rows);
            case SUPABASE -> new SupabaseDurableBackend(
                    settings.getSupabaseUrl(),
                    settings.getSupabaseKey(),
                    restTemplateBuilder
                            .setConnectTimeout(settings.getTimeout())
                            .setReadTimeout(settings.getTimeout())
                            .build(),
                    rows);
        };
        if (durable == null) {
            return core;
        }
        PersistingStore store = new PersistingStore(core, durable);
        store.start();
        return store;
    }

    static Backend resolveBackend(GraderProperties.Store settings) {
        if (settings.getBackend() != Backend.AUTO) {
            return settings.getBackend();
        }
        if (settings.hasDatabase()) {
            return Backend.POSTGRES;
        }
        if (settings.hasSupabase()) {
            return Backend.SUPABASE;
        }
        return Backend.MEMORY;
    }
}
