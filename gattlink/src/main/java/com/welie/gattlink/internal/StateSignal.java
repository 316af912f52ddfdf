package com.welie.gattlink.internal;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Holds a current value and tells listeners about every change. A new listener is first handed the current value.
 *
 * <p>Updates and deliveries are serialized, so every listener sees the values in the order they were set.
 *
 * @param <T> the value type
 */
public final class StateSignal<T> {

    private final Object lock = new Object();

    @NotNull
    private volatile T value;

    @NotNull
    private final List<Consumer<? super T>> listeners = new CopyOnWriteArrayList<>();

    public StateSignal(@NotNull final T initialValue) {
        this.value = Objects.requireNonNull(initialValue, "no valid initial value provided");
    }

    @NotNull
    public T getValue() {
        return value;
    }

    public void setValue(@NotNull final T newValue) {
        Objects.requireNonNull(newValue, "no valid value provided");

        synchronized (lock) {
            value = newValue;
            listeners.forEach(listener -> listener.accept(newValue));
        }
    }

    @NotNull
    public T updateAndGet(@NotNull final UnaryOperator<T> update) {
        Objects.requireNonNull(update, "no valid update function provided");

        synchronized (lock) {
            final T newValue = update.apply(value);
            setValue(newValue);
            return newValue;
        }
    }

    @NotNull
    public Subscription subscribe(@NotNull final Consumer<? super T> listener) {
        Objects.requireNonNull(listener, "no valid listener provided");

        synchronized (lock) {
            listeners.add(listener);
            listener.accept(value);
        }
        return () -> listeners.remove(listener);
    }

    /**
     * Completes with the current value if it matches, otherwise with the first future value that does.
     */
    @NotNull
    public CompletableFuture<T> first(@NotNull final Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "no valid predicate provided");

        final CompletableFuture<T> future = new CompletableFuture<>();
        final Subscription subscription = subscribe(current -> {
            if (!future.isDone() && predicate.test(current)) {
                future.complete(current);
            }
        });
        future.whenComplete((current, throwable) -> subscription.close());
        return future;
    }

    public int getListenerCount() {
        return listeners.size();
    }
}
