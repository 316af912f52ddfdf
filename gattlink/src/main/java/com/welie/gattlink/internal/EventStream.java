package com.welie.gattlink.internal;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * A live broadcast of events. Subscribers only see events emitted after they subscribed; nothing is buffered.
 *
 * <p>Events are delivered synchronously on the emitting thread, in subscription order, so subscribers must not block.
 *
 * @param <T> the event type
 */
public final class EventStream<T> {
    private static final String TAG = EventStream.class.getSimpleName();
    private final Logger logger = LoggerFactory.getLogger(TAG);

    @NotNull
    private final String name;

    @NotNull
    private final List<Consumer<? super T>> subscribers = new CopyOnWriteArrayList<>();

    public EventStream(@NotNull final String name) {
        this.name = Objects.requireNonNull(name, "no valid name provided");
    }

    public void emit(@NotNull final T event) {
        Objects.requireNonNull(event, "no valid event provided");

        for (Consumer<? super T> subscriber : subscribers) {
            try {
                subscriber.accept(event);
            } catch (RuntimeException e) {
                logger.error(String.format("subscriber of '%s' failed on %s", name, event), e);
            }
        }
    }

    @NotNull
    public Subscription subscribe(@NotNull final Consumer<? super T> subscriber) {
        Objects.requireNonNull(subscriber, "no valid subscriber provided");

        subscribers.add(subscriber);
        return () -> subscribers.remove(subscriber);
    }

    /**
     * Completes with the first future event that matches the predicate. The underlying subscription is removed as soon
     * as the returned future completes, including when it is cancelled.
     */
    @NotNull
    public CompletableFuture<T> first(@NotNull final Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "no valid predicate provided");

        final CompletableFuture<T> future = new CompletableFuture<>();
        final Subscription subscription = subscribe(event -> {
            if (!future.isDone() && predicate.test(event)) {
                future.complete(event);
            }
        });
        future.whenComplete((event, throwable) -> subscription.close());
        return future;
    }

    public int getSubscriberCount() {
        return subscribers.size();
    }
}
