package com.netdesk.ticket;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

import com.netdesk.ticket.config.TicketProperties;
import com.netdesk.ticket.integration.props.IntegrationProperties;

/**
 * Spring Boot entry point for the NetDesk ticket coordinator.
 *
 * <p>The service owns the ticket lifecycle, fans change events out to every process
 * of the deployment and runs the chat feeds, polling each feed from exactly one
 * process at a time.</p>
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties({TicketProperties.class, IntegrationProperties.class})
public class TicketCoordinatorApp {

    public static void main(String[] args) {
        SpringApplication.run(TicketCoordinatorApp.class, args);
    }
}
