package com.netdesk.ticket.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.netdesk.ticket.integration.props.IntegrationProperties;

import reactor.core.publisher.Mono;

/**
 * Primary transport: publishes the JSON event on the shared Redis channel that every
 * process of the deployment subscribes to.
 */
@Component(RedisNotificationTransport.NAME)
public class RedisNotificationTransport implements NotificationTransport {

    public static final String NAME = "redisNotificationTransport";

    private static final Logger log = LoggerFactory.getLogger(RedisNotificationTransport.class);

    private final ReactiveStringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String channel;

    public RedisNotificationTransport(
        ReactiveStringRedisTemplate redisTemplate,
        ObjectMapper objectMapper,
        IntegrationProperties properties
    ) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.channel = properties.getNotifications().getChannel();
    }

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public Mono<Void> send(TicketEvent event) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(event))
            .flatMap(json -> redisTemplate.convertAndSend(channel, json))
            .doOnNext(receivers -> log.debug("Published {} for ticket {} on '{}' to {} subscribers",
                event.type(), event.ticketId(), channel, receivers))
            .then();
    }
}
