package com.netdesk.ticket.integration.telegram;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import com.fasterxml.jackson.databind.JsonNode;
import com.netdesk.ticket.inbound.InboundEvent;
import com.netdesk.ticket.integration.Feed;
import com.netdesk.ticket.integration.LeadershipLostException;
import com.netdesk.ticket.integration.MessageTransport;
import com.netdesk.ticket.integration.TransportException;
import com.netdesk.ticket.integration.props.IntegrationProperties;

import reactor.core.publisher.Mono;

/**
 * Minimal Telegram Bot API client. Only implements the operations the coordinator
 * needs: sending, long polling and webhook registration.
 *
 * <p>The bot token is part of every request path and is never logged. Telegram answers
 * {@code 409 Conflict} when a second consumer polls the same bot, which is reported as
 * {@link LeadershipLostException}.</p>
 */
public class TelegramBotClient implements MessageTransport {

    private static final Logger log = LoggerFactory.getLogger(TelegramBotClient.class);

    // headroom over the server-side long-poll wait before the request counts as hung
    private static final Duration RESPONSE_GRACE = Duration.ofSeconds(10);

    private static final Duration CALL_TIMEOUT = Duration.ofSeconds(30);

    private final Feed feed;
    private final WebClient webClient;
    private final AtomicLong nextOffset = new AtomicLong();

    public TelegramBotClient(Feed feed, WebClient.Builder builder, IntegrationProperties.FeedProperties properties) {
        this.feed = feed;
        this.webClient = builder.clone()
            .baseUrl(StringUtils.trimTrailingCharacter(properties.getBaseUrl(), '/') + "/bot" + properties.getToken())
            .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
            .build();
    }

    @Override
    public Feed feed() {
        return feed;
    }

    @Override
    public Mono<String> send(String contactRef, String text, String mediaRef) {
        Mono<JsonNode> call = StringUtils.hasText(mediaRef)
            ? post("/sendPhoto", Map.of("chat_id", contactRef, "photo", mediaRef, "caption", text))
            : post("/sendMessage", Map.of("chat_id", contactRef, "text", text));
        return call
            .map(body -> body.path("result").path("message_id").asText())
            .doOnNext(messageId -> log.debug("Sent message {} to {} on the {} feed", messageId, contactRef, feed.pathSegment()));
    }

    @Override
    public Mono<List<InboundEvent>> receive(Duration timeout) {
        return webClient.get()
            .uri(uri -> uri.path("/getUpdates")
                .queryParam("offset", nextOffset.get())
                .queryParam("timeout", timeout.toSeconds())
                .build())
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(timeout.plus(RESPONSE_GRACE))
            .onErrorMap(error -> translate("getUpdates", error))
            .map(this::acknowledge);
    }

    @Override
    public Mono<Void> registerWebhook(String url) {
        return post("/setWebhook", Map.of("url", url))
            .doOnNext(body -> log.info("Webhook registered for the {} feed", feed.pathSegment()))
            .then();
    }

    @Override
    public Mono<Void> clearWebhook(boolean dropPending) {
        return post("/deleteWebhook", Map.of("drop_pending_updates", dropPending))
            .doOnNext(body -> log.info("Webhook cleared for the {} feed", feed.pathSegment()))
            .then();
    }

    /**
     * Converts one Telegram update into an inbound event. Plain messages, photo
     * messages and inline-button presses are understood; anything else is skipped.
     */
    public static Optional<InboundEvent> parseUpdate(JsonNode update, Feed feed) {
        long updateId = update.path("update_id").asLong();

        JsonNode callback = update.path("callback_query");
        if (!callback.isMissingNode()) {
            JsonNode chat = callback.path("message").path("chat");
            if (chat.isMissingNode()) {
                return Optional.empty();
            }
            return Optional.of(new InboundEvent(
                feed,
                updateId,
                chat.path("id").asText(),
                callback.path("from").path("first_name").asText(null),
                callback.path("data").asText(""),
                null
            ));
        }

        JsonNode message = update.has("message") ? update.path("message") : update.path("edited_message");
        if (message.isMissingNode()) {
            return Optional.empty();
        }
        String text = message.has("text")
            ? message.path("text").asText()
            : message.path("caption").asText("");
        String mediaRef = null;
        JsonNode photos = message.path("photo");
        if (photos.isArray() && !photos.isEmpty()) {
            // sizes are ordered smallest first
            mediaRef = photos.get(photos.size() - 1).path("file_id").asText(null);
        }
        return Optional.of(new InboundEvent(
            feed,
            updateId,
            message.path("chat").path("id").asText(),
            message.path("from").path("first_name").asText(null),
            text,
            mediaRef
        ));
    }

    private List<InboundEvent> acknowledge(JsonNode body) {
        List<InboundEvent> events = new ArrayList<>();
        for (JsonNode update : body.path("result")) {
            long updateId = update.path("update_id").asLong();
            nextOffset.accumulateAndGet(updateId + 1, Math::max);
            parseUpdate(update, feed).ifPresent(events::add);
        }
        if (!events.isEmpty()) {
            log.debug("Received {} updates on the {} feed", events.size(), feed.pathSegment());
        }
        return events;
    }

    private Mono<JsonNode> post(String method, Map<String, Object> payload) {
        return webClient.post()
            .uri(method)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(payload)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(CALL_TIMEOUT)
            .onErrorMap(error -> translate(method, error));
    }

    private Throwable translate(String method, Throwable error) {
        if (error instanceof TransportException) {
            return error;
        }
        if (error instanceof WebClientResponseException response) {
            if (response.getStatusCode().value() == HttpStatus.CONFLICT.value()) {
                return new LeadershipLostException(
                    "Another consumer is polling the %s feed".formatted(feed.pathSegment()), error);
            }
            return new TransportException(
                "%s on the %s feed answered %d".formatted(method, feed.pathSegment(), response.getStatusCode().value()), error);
        }
        // anything else (dropped connection, timeout, undecodable body) is worth another attempt
        return new TransportException(
            "%s on the %s feed failed: %s".formatted(method, feed.pathSegment(), error.getMessage()), error);
    }
}
