package com.netdesk.ticket.polling;

import java.util.Optional;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;

import com.netdesk.ticket.integration.Feed;

import reactor.core.publisher.Mono;

/**
 * Reports each feed's mode under {@code /actuator/health}. A consuming loop that lost
 * leadership or crashed turns the indicator down, since only a restart brings it back.
 */
@Component
public class FeedHealthIndicator implements ReactiveHealthIndicator {

    private final MessageFeedManager feedManager;

    public FeedHealthIndicator(MessageFeedManager feedManager) {
        this.feedManager = feedManager;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromSupplier(() -> {
            Health.Builder builder = Health.up();
            for (Feed feed : Feed.values()) {
                FeedMode mode = feedManager.mode(feed);
                Optional<FeedPollingLoop.State> loopState = feedManager.loopState(feed);
                String detail = loopState.map(state -> mode + " (" + state + ")").orElse(mode.name());
                builder.withDetail(feed.pathSegment(), detail);
                if (loopState.filter(state -> state == FeedPollingLoop.State.LEADERSHIP_LOST
                    || state == FeedPollingLoop.State.FAILED).isPresent()) {
                    builder.down();
                }
            }
            return builder.build();
        });
    }
}
