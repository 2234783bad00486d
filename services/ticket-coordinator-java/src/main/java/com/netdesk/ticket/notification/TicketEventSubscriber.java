package com.netdesk.ticket.notification;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.data.redis.connection.ReactiveSubscription;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.netdesk.ticket.integration.props.IntegrationProperties;

import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Relays events published by any process on the shared channel to this process's
 * live sessions. The subscription is re-established with backoff when the broker
 * connection drops.
 */
@Component
public class TicketEventSubscriber implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(TicketEventSubscriber.class);

    private final ReactiveStringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final LiveUpdateBroadcaster broadcaster;
    private final IntegrationProperties.NotificationProperties properties;

    private volatile Disposable subscription;

    public TicketEventSubscriber(
        ReactiveStringRedisTemplate redisTemplate,
        ObjectMapper objectMapper,
        LiveUpdateBroadcaster broadcaster,
        IntegrationProperties integrationProperties
    ) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.broadcaster = broadcaster;
        this.properties = integrationProperties.getNotifications();
    }

    @Override
    public void start() {
        if (!properties.isSubscribe()) {
            log.info("Live update relay disabled; not subscribing to '{}'", properties.getChannel());
            return;
        }
        String channel = properties.getChannel();
        subscription = Flux.defer(() -> redisTemplate.listenToChannel(channel))
            .map(ReactiveSubscription.Message::getMessage)
            .concatMap(this::decode)
            .retryWhen(Retry.backoff(Long.MAX_VALUE, Duration.ofSeconds(1))
                .maxBackoff(Duration.ofSeconds(30))
                .doBeforeRetry(signal -> log.warn("Subscription to '{}' lost ({}); reconnecting",
                    channel, signal.failure().getMessage())))
            .subscribe(
                broadcaster::broadcast,
                error -> log.error("Live update relay on '{}' stopped", channel, error)
            );
        log.info("Relaying events from channel '{}' to live sessions", channel);
    }

    @Override
    public void stop() {
        Disposable current = subscription;
        if (current != null) {
            current.dispose();
            subscription = null;
        }
    }

    @Override
    public boolean isRunning() {
        Disposable current = subscription;
        return current != null && !current.isDisposed();
    }

    private Mono<TicketEvent> decode(String json) {
        try {
            return Mono.just(objectMapper.readValue(json, TicketEvent.class));
        } catch (JsonProcessingException e) {
            log.warn("Ignoring malformed event on '{}': {}", properties.getChannel(), e.getOriginalMessage());
            return Mono.empty();
        }
    }
}
