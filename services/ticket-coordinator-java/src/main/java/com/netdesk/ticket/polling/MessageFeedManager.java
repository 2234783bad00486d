package com.netdesk.ticket.polling;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import com.netdesk.ticket.inbound.InboundEventDispatcher;
import com.netdesk.ticket.integration.Feed;
import com.netdesk.ticket.integration.FeedTransports;
import com.netdesk.ticket.integration.MessageTransport;
import com.netdesk.ticket.integration.props.IntegrationProperties;

import reactor.core.publisher.Mono;

/**
 * Starts and stops the chat feeds of this process.
 *
 * <p>On start every configured feed can send. In webhook mode the webhook is
 * registered and nothing is polled. In polling mode the process tries to become the
 * feed's leader; the leader clears any webhook and starts the consuming loop, the
 * others run send-only. On stop the loops are stopped and the leases released.</p>
 */
@Component
public class MessageFeedManager implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(MessageFeedManager.class);

    private static final Duration SETUP_TIMEOUT = Duration.ofSeconds(15);

    private final FeedTransports feedTransports;
    private final PollingCoordinator coordinator;
    private final InboundEventDispatcher dispatcher;
    private final IntegrationProperties.FeedsProperties feedsProperties;
    private final IntegrationProperties.PollingProperties pollingProperties;

    private final Map<Feed, FeedMode> modes = new EnumMap<>(Feed.class);
    private final Map<Feed, FeedPollingLoop> loops = new EnumMap<>(Feed.class);
    private volatile boolean running;

    public MessageFeedManager(
        FeedTransports feedTransports,
        PollingCoordinator coordinator,
        InboundEventDispatcher dispatcher,
        IntegrationProperties properties
    ) {
        this.feedTransports = feedTransports;
        this.coordinator = coordinator;
        this.dispatcher = dispatcher;
        this.feedsProperties = properties.getFeeds();
        this.pollingProperties = properties.getPolling();
    }

    @Override
    public synchronized void start() {
        for (Feed feed : Feed.values()) {
            FeedMode mode = startFeed(feed);
            modes.put(feed, mode);
        }
        running = true;
    }

    @Override
    public synchronized void stop() {
        loops.values().forEach(loop -> loop.stop(pollingProperties.getShutdownGrace()));
        loops.clear();
        coordinator.releaseAll();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    public synchronized FeedMode mode(Feed feed) {
        return modes.getOrDefault(feed, FeedMode.DISABLED);
    }

    public boolean isPolling(Feed feed) {
        return mode(feed) == FeedMode.POLLING_LEADER;
    }

    public synchronized Optional<FeedPollingLoop.State> loopState(Feed feed) {
        return Optional.ofNullable(loops.get(feed)).map(FeedPollingLoop::state);
    }

    public Optional<MessageTransport> sender(Feed feed) {
        return feedTransports.get(feed);
    }

    private FeedMode startFeed(Feed feed) {
        Optional<MessageTransport> transport = feedTransports.get(feed);
        if (transport.isEmpty()) {
            return FeedMode.DISABLED;
        }
        IntegrationProperties.FeedProperties properties = feedsProperties.get(feed);

        if (feedsProperties.useWebhook()) {
            String url = webhookUrl(feed, properties);
            transport.get().registerWebhook(url)
                .timeout(SETUP_TIMEOUT)
                .doOnError(error -> log.error("Registering the webhook of the {} feed failed: {}", feed.pathSegment(), error.getMessage()))
                .onErrorResume(error -> Mono.empty())
                .block();
            log.info("The {} feed runs in webhook mode", feed.pathSegment());
            return FeedMode.WEBHOOK;
        }

        if (!coordinator.tryAcquireLeadership(properties.getLockKey())) {
            log.info("Another process polls the {} feed; running send-only", feed.pathSegment());
            return FeedMode.SEND_ONLY;
        }

        transport.get().clearWebhook(false)
            .timeout(SETUP_TIMEOUT)
            .doOnError(error -> log.warn("Clearing the webhook of the {} feed failed: {}", feed.pathSegment(), error.getMessage()))
            .onErrorResume(error -> Mono.empty())
            .block();

        FeedPollingLoop loop = new FeedPollingLoop(
            transport.get(),
            dispatcher::dispatch,
            properties.getPollTimeout(),
            pollingProperties
        );
        loops.put(feed, loop);
        loop.start();
        return FeedMode.POLLING_LEADER;
    }

    private String webhookUrl(Feed feed, IntegrationProperties.FeedProperties properties) {
        String base = feedsProperties.getExternalUrl();
        if (base == null || base.isBlank()) {
            throw new IllegalStateException("integration.feeds.external-url is required in webhook mode");
        }
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return "%s/api/webhooks/%s/%s".formatted(base, feed.pathSegment(), properties.getToken());
    }
}
