package com.netdesk.ticket.polling;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.netdesk.ticket.inbound.InboundEvent;
import com.netdesk.ticket.integration.LeadershipLostException;
import com.netdesk.ticket.integration.MessageTransport;
import com.netdesk.ticket.integration.TransportException;
import com.netdesk.ticket.integration.props.IntegrationProperties;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.reactor.retry.RetryOperator;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Consuming loop of one feed, run only by the process that leads it.
 *
 * <p>Each cycle long-polls the transport and hands the events to the handler one at a
 * time, in order. Transient transport failures are retried with exponential backoff
 * for as long as the loop runs. A conflict reported by the feed ends the loop for
 * good. After {@link #stop} no further event is handed out; the event being handled
 * may finish within the grace period.</p>
 */
public class FeedPollingLoop {

    private static final Logger log = LoggerFactory.getLogger(FeedPollingLoop.class);

    public enum State {
        NEW,
        RUNNING,
        STOPPED,
        LEADERSHIP_LOST,
        FAILED
    }

    private final MessageTransport transport;
    private final Function<InboundEvent, Mono<Void>> handler;
    private final Duration pollTimeout;
    private final Retry retry;
    private final String feedName;

    private final AtomicBoolean running = new AtomicBoolean();
    private final AtomicReference<State> state = new AtomicReference<>(State.NEW);
    private final CountDownLatch finished = new CountDownLatch(1);
    private volatile Disposable subscription;

    public FeedPollingLoop(
        MessageTransport transport,
        Function<InboundEvent, Mono<Void>> handler,
        Duration pollTimeout,
        IntegrationProperties.PollingProperties properties
    ) {
        this.transport = transport;
        this.handler = handler;
        this.pollTimeout = pollTimeout;
        this.feedName = transport.feed().pathSegment();
        this.retry = Retry.of("feed-" + feedName, RetryConfig.custom()
            .maxAttempts(Integer.MAX_VALUE)
            .intervalFunction(IntervalFunction.ofExponentialBackoff(
                properties.getRetryBackoff(), 2.0, properties.getRetryMaxBackoff()))
            .retryOnException(this::isTransient)
            .build());
        this.retry.getEventPublisher().onRetry(event -> log.warn(
            "Polling the {} feed failed (attempt {}): {}; retrying in {}",
            feedName,
            event.getNumberOfRetryAttempts(),
            event.getLastThrowable() == null ? "unknown" : event.getLastThrowable().getMessage(),
            event.getWaitInterval()));
    }

    public void start() {
        if (!state.compareAndSet(State.NEW, State.RUNNING)) {
            throw new IllegalStateException("Polling loop for the %s feed was already started".formatted(feedName));
        }
        running.set(true);
        Mono<Void> cycle = Mono.defer(() -> transport.receive(pollTimeout))
            .transformDeferred(RetryOperator.of(retry))
            .flatMapMany(Flux::fromIterable)
            .concatMap(event -> Mono.defer(() -> running.get() ? handle(event) : Mono.<Void>empty()))
            .then();

        subscription = cycle
            .repeat(running::get)
            .subscribe(
                ignored -> { },
                this::onError,
                this::onComplete
            );
        log.info("Polling the {} feed", feedName);
    }

    /**
     * Stops handing out events and waits up to {@code grace} for the current one, then
     * cancels whatever is still pending (usually the open long poll).
     */
    public void stop(Duration grace) {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        try {
            if (!finished.await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.debug("Polling loop for the {} feed still busy after {}; cancelling", feedName, grace);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        Disposable current = subscription;
        if (current != null) {
            current.dispose();
        }
        state.compareAndSet(State.RUNNING, State.STOPPED);
        finished.countDown();
        log.info("Stopped polling the {} feed", feedName);
    }

    public State state() {
        return state.get();
    }

    public boolean isRunning() {
        return running.get();
    }

    private Mono<Void> handle(InboundEvent event) {
        return Mono.defer(() -> handler.apply(event))
            .onErrorResume(error -> {
                log.error("Handling update {} from the {} feed failed", event.updateId(), feedName, error);
                return Mono.empty();
            });
    }

    private boolean isTransient(Throwable error) {
        return error instanceof TransportException
            && !(error instanceof LeadershipLostException)
            && running.get();
    }

    private void onError(Throwable error) {
        boolean wasRunning = running.getAndSet(false);
        if (error instanceof LeadershipLostException) {
            state.set(State.LEADERSHIP_LOST);
            log.error("{}; polling stopped in this process until it is restarted", error.getMessage());
        } else if (wasRunning) {
            state.set(State.FAILED);
            log.error("Polling loop for the {} feed crashed", feedName, error);
        } else {
            state.compareAndSet(State.RUNNING, State.STOPPED);
        }
        finished.countDown();
    }

    private void onComplete() {
        running.set(false);
        state.compareAndSet(State.RUNNING, State.STOPPED);
        finished.countDown();
    }
}
