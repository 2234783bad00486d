package com.netdesk.ticket.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Business rules of the ticket subsystem: the per-client creation quota and the
 * throttle applied to interactive chat commands.
 */
@Validated
@ConfigurationProperties(prefix = "tickets")
public class TicketProperties {

    @Valid
    @NestedConfigurationProperty
    private final QuotaProperties quota = new QuotaProperties();

    @Valid
    @NestedConfigurationProperty
    private final InteractiveProperties interactive = new InteractiveProperties();

    /**
     * Subject that marks a ticket as a live chat session; free text sent by the client
     * is appended to the most recent open or pending ticket with this subject.
     */
    @NotBlank
    private String liveSupportSubject = "Live support request";

    @NotBlank
    private String generalSupportSubject = "General support";

    public QuotaProperties getQuota() {
        return quota;
    }

    public InteractiveProperties getInteractive() {
        return interactive;
    }

    public String getLiveSupportSubject() {
        return liveSupportSubject;
    }

    public void setLiveSupportSubject(String liveSupportSubject) {
        this.liveSupportSubject = liveSupportSubject;
    }

    public String getGeneralSupportSubject() {
        return generalSupportSubject;
    }

    public void setGeneralSupportSubject(String generalSupportSubject) {
        this.generalSupportSubject = generalSupportSubject;
    }

    public static class QuotaProperties {

        /**
         * Maximum tickets a single client may open inside the trailing window.
         */
        @Min(1)
        private int limit = 3;

        @NotNull
        private Duration window = Duration.ofHours(24);

        public int getLimit() {
            return limit;
        }

        public void setLimit(int limit) {
            this.limit = limit;
        }

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }
    }

    public static class InteractiveProperties {

        @Min(1)
        private int limit = 5;

        @NotNull
        private Duration window = Duration.ofSeconds(10);

        @NotNull
        private Duration sweepInterval = Duration.ofMinutes(5);

        /**
         * Actors idle for longer than this are dropped from the limiter table.
         */
        @NotNull
        private Duration maxAge = Duration.ofMinutes(5);

        public int getLimit() {
            return limit;
        }

        public void setLimit(int limit) {
            this.limit = limit;
        }

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }

        public Duration getSweepInterval() {
            return sweepInterval;
        }

        public void setSweepInterval(Duration sweepInterval) {
            this.sweepInterval = sweepInterval;
        }

        public Duration getMaxAge() {
            return maxAge;
        }

        public void setMaxAge(Duration maxAge) {
            this.maxAge = maxAge;
        }
    }
}
