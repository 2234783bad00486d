package com.netdesk.ticket.config;

import java.nio.file.Path;
import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.netdesk.ticket.integration.props.IntegrationProperties;
import com.netdesk.ticket.polling.ExclusiveLease;
import com.netdesk.ticket.polling.FileLockExclusiveLease;
import com.netdesk.ticket.repository.TicketRepository;

import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Miscellaneous application-wide beans that don't belong in specific features
 * (e.g. utility infrastructure shared across services).
 */
@Configuration
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Dedicated workers for notification delivery, so a slow broker never occupies
     * request threads.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler notificationScheduler(IntegrationProperties properties) {
        return Schedulers.newBoundedElastic(
            4,
            properties.getNotifications().getMaxInFlight(),
            "ticket-notify"
        );
    }

    @Bean
    public ExclusiveLease exclusiveLease(IntegrationProperties properties) {
        return new FileLockExclusiveLease(Path.of(properties.getPolling().getLockDirectory()));
    }

    /**
     * Performs a lightweight startup check by counting existing records. This gives
     * operators a hint that the database connection is alive before any traffic hits
     * the service.
     */
    @Bean
    public ApplicationRunner databaseProbe(TicketRepository repository) {
        return args -> repository.count()
            .subscribe(
                count -> log.info("Ticket coordinator started. Existing ticket count: {}", count),
                error -> log.error("Database probe failed: {}", error.getMessage())
            );
    }
}
