package com.netdesk.ticket.integration.props;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

import com.netdesk.ticket.integration.Feed;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Configuration properties describing how the coordinator talks to other processes
 * and to the external chat feeds.
 *
 * <p>The structure mirrors {@code application.yml}. Validation ensures missing critical
 * settings are caught at startup instead of failing during runtime calls.</p>
 */
@Validated
@ConfigurationProperties(prefix = "integration")
public class IntegrationProperties {

    @Valid
    @NestedConfigurationProperty
    private final NotificationProperties notifications = new NotificationProperties();

    @Valid
    @NestedConfigurationProperty
    private final FeedsProperties feeds = new FeedsProperties();

    @Valid
    @NestedConfigurationProperty
    private final PollingProperties polling = new PollingProperties();

    public NotificationProperties getNotifications() {
        return notifications;
    }

    public FeedsProperties getFeeds() {
        return feeds;
    }

    public PollingProperties getPolling() {
        return polling;
    }

    public static class NotificationProperties {

        /**
         * Pub/sub channel shared by every process of the deployment.
         */
        @NotBlank
        private String channel = "ticket-events";

        /**
         * Local endpoint used when the broker cannot be reached.
         */
        @NotBlank
        private String fallbackUrl = "http://127.0.0.1:8080/api/internal/notify-monitor-update";

        @NotNull
        private Duration attemptTimeout = Duration.ofSeconds(1);

        /**
         * Upper bound on concurrently running delivery attempts; events beyond it are dropped.
         */
        @Min(1)
        private int maxInFlight = 64;

        /**
         * Whether this process relays channel events to its own websocket sessions.
         */
        private boolean subscribe = true;

        public String getChannel() {
            return channel;
        }

        public void setChannel(String channel) {
            this.channel = channel;
        }

        public String getFallbackUrl() {
            return fallbackUrl;
        }

        public void setFallbackUrl(String fallbackUrl) {
            this.fallbackUrl = fallbackUrl;
        }

        public Duration getAttemptTimeout() {
            return attemptTimeout;
        }

        public void setAttemptTimeout(Duration attemptTimeout) {
            this.attemptTimeout = attemptTimeout;
        }

        public int getMaxInFlight() {
            return maxInFlight;
        }

        public void setMaxInFlight(int maxInFlight) {
            this.maxInFlight = maxInFlight;
        }

        public boolean isSubscribe() {
            return subscribe;
        }

        public void setSubscribe(boolean subscribe) {
            this.subscribe = subscribe;
        }
    }

    public enum DeliveryMode {
        /**
         * Webhook when an https external URL is configured, long polling otherwise.
         */
        AUTO,
        POLLING,
        WEBHOOK
    }

    public static class FeedsProperties {

        @NotNull
        private DeliveryMode mode = DeliveryMode.AUTO;

        /**
         * Public base URL the chat platform calls in webhook mode.
         */
        private String externalUrl;

        @Valid
        @NestedConfigurationProperty
        private final FeedProperties client = new FeedProperties("client_feed");

        @Valid
        @NestedConfigurationProperty
        private final FeedProperties tech = new FeedProperties("tech_feed");

        public boolean useWebhook() {
            if (mode == DeliveryMode.WEBHOOK) {
                return true;
            }
            return mode == DeliveryMode.AUTO
                && StringUtils.hasText(externalUrl)
                && externalUrl.startsWith("https");
        }

        public FeedProperties get(Feed feed) {
            return switch (feed) {
                case CLIENT -> client;
                case TECH -> tech;
            };
        }

        public DeliveryMode getMode() {
            return mode;
        }

        public void setMode(DeliveryMode mode) {
            this.mode = mode;
        }

        public String getExternalUrl() {
            return externalUrl;
        }

        public void setExternalUrl(String externalUrl) {
            this.externalUrl = externalUrl;
        }

        public FeedProperties getClient() {
            return client;
        }

        public FeedProperties getTech() {
            return tech;
        }
    }

    public static class FeedProperties {

        private boolean enabled = true;

        private String token;

        @NotBlank
        private String baseUrl = "https://api.telegram.org";

        /**
         * Name of the exclusive lease guarding this feed's polling loop.
         */
        @NotBlank
        private String lockKey;

        @NotNull
        private Duration pollTimeout = Duration.ofSeconds(25);

        public FeedProperties() {
        }

        FeedProperties(String lockKey) {
            this.lockKey = lockKey;
        }

        public boolean isActive() {
            return enabled && StringUtils.hasText(token);
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getToken() {
            return token;
        }

        public void setToken(String token) {
            this.token = token;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getLockKey() {
            return lockKey;
        }

        public void setLockKey(String lockKey) {
            this.lockKey = lockKey;
        }

        public Duration getPollTimeout() {
            return pollTimeout;
        }

        public void setPollTimeout(Duration pollTimeout) {
            this.pollTimeout = pollTimeout;
        }
    }

    public static class PollingProperties {

        @NotBlank
        private String lockDirectory = System.getProperty("java.io.tmpdir");

        /**
         * How long a stopping loop may finish its current update before it is cancelled.
         */
        @NotNull
        private Duration shutdownGrace = Duration.ofSeconds(5);

        @NotNull
        private Duration retryBackoff = Duration.ofSeconds(2);

        @NotNull
        private Duration retryMaxBackoff = Duration.ofSeconds(60);

        public String getLockDirectory() {
            return lockDirectory;
        }

        public void setLockDirectory(String lockDirectory) {
            this.lockDirectory = lockDirectory;
        }

        public Duration getShutdownGrace() {
            return shutdownGrace;
        }

        public void setShutdownGrace(Duration shutdownGrace) {
            this.shutdownGrace = shutdownGrace;
        }

        public Duration getRetryBackoff() {
            return retryBackoff;
        }

        public void setRetryBackoff(Duration retryBackoff) {
            this.retryBackoff = retryBackoff;
        }

        public Duration getRetryMaxBackoff() {
            return retryMaxBackoff;
        }

        public void setRetryMaxBackoff(Duration retryMaxBackoff) {
            this.retryMaxBackoff = retryMaxBackoff;
        }
    }
}
