package com.netdesk.ticket.inbound;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.fasterxml.jackson.databind.JsonNode;
import com.netdesk.ticket.integration.Feed;
import com.netdesk.ticket.integration.props.IntegrationProperties;
import com.netdesk.ticket.integration.telegram.TelegramBotClient;

import reactor.core.publisher.Mono;

/**
 * Receives feed updates pushed by the chat platform in webhook mode. The bot token in
 * the path authenticates the caller. The platform always gets {@code ok} back, so it
 * does not redeliver updates this process chose to ignore.
 */
@RestController
@RequestMapping(path = "/api/webhooks", produces = MediaType.APPLICATION_JSON_VALUE)
public class WebhookController {

    private static final Logger log = LoggerFactory.getLogger(WebhookController.class);

    private static final Map<String, String> OK = Map.of("status", "ok");

    private final InboundEventDispatcher dispatcher;
    private final IntegrationProperties.FeedsProperties feeds;

    public WebhookController(InboundEventDispatcher dispatcher, IntegrationProperties properties) {
        this.dispatcher = dispatcher;
        this.feeds = properties.getFeeds();
    }

    @PostMapping(path = "/{feed}/{token}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Map<String, String>> receive(
        @PathVariable("feed") String feedSegment,
        @PathVariable String token,
        @RequestBody JsonNode update
    ) {
        Feed feed;
        try {
            feed = Feed.fromPathSegment(feedSegment);
        } catch (IllegalArgumentException e) {
            log.warn("Webhook call for unknown feed '{}' ignored", feedSegment);
            return Mono.just(OK);
        }
        IntegrationProperties.FeedProperties properties = feeds.get(feed);
        if (!properties.isActive() || !tokenMatches(token, properties.getToken())) {
            log.warn("Webhook token mismatch for the {} feed", feed.pathSegment());
            return Mono.just(OK);
        }
        return TelegramBotClient.parseUpdate(update, feed)
            .map(dispatcher::dispatch)
            .orElseGet(Mono::empty)
            .onErrorResume(error -> {
                log.error("Handling webhook update on the {} feed failed", feed.pathSegment(), error);
                return Mono.empty();
            })
            .thenReturn(OK);
    }

    private static boolean tokenMatches(String presented, String expected) {
        return MessageDigest.isEqual(
            presented.getBytes(StandardCharsets.UTF_8),
            expected.getBytes(StandardCharsets.UTF_8)
        );
    }
}
