package com.netdesk.ticket.integration.telegram;

import java.util.EnumMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import com.netdesk.ticket.integration.Feed;
import com.netdesk.ticket.integration.FeedTransports;
import com.netdesk.ticket.integration.MessageTransport;
import com.netdesk.ticket.integration.props.IntegrationProperties;

@Configuration
public class TelegramConfig {

    private static final Logger log = LoggerFactory.getLogger(TelegramConfig.class);

    /**
     * One bot client per enabled feed that has a token. Feeds without one stay silent.
     */
    @Bean
    public FeedTransports feedTransports(WebClient.Builder builder, IntegrationProperties properties) {
        Map<Feed, MessageTransport> transports = new EnumMap<>(Feed.class);
        for (Feed feed : Feed.values()) {
            IntegrationProperties.FeedProperties feedProperties = properties.getFeeds().get(feed);
            if (feedProperties.isActive()) {
                transports.put(feed, new TelegramBotClient(feed, builder, feedProperties));
            } else {
                log.info("The {} feed is disabled or has no token; it will neither send nor receive", feed.pathSegment());
            }
        }
        return new FeedTransports(transports);
    }
}
