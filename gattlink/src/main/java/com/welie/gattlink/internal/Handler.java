package com.welie.gattlink.internal;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.concurrent.ScheduledThreadPoolExecutor;

/**
 * Runs posted work in order on a single named thread.
 */
public class Handler {

    public static final String RUNNABLE_IS_NULL = "runnable is null";

    @NotNull
    private final ScheduledThreadPoolExecutor executor;

    public Handler(@NotNull final String name) {
        Objects.requireNonNull(name, "name is null");

        executor = new ScheduledThreadPoolExecutor(1, runnable -> {
            final Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        });
        executor.setRemoveOnCancelPolicy(true);
    }

    public final void post(@NotNull final Runnable runnable) {
        Objects.requireNonNull(runnable, RUNNABLE_IS_NULL);

        executor.execute(runnable);
    }

    public final boolean isShutdown() {
        return executor.isShutdown();
    }

    /**
     * Stop accepting work. Work that was already posted still runs.
     */
    public final void shutdown() {
        executor.shutdown();
    }

    /**
     * Stop accepting work, drop anything queued and interrupt the running task.
     */
    public final void shutdownNow() {
        executor.shutdownNow();
    }
}
