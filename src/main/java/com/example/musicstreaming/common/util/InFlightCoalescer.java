package com.example.musicstreaming.common.util;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Runs at most one in-flight asynchronous operation per key.
 * <p>
 * Callers that arrive while an operation for the same key is pending join it and observe its single
 * outcome. The entry is inserted before the operation is awaited and removed on settlement only if the
 * map still holds the very future that was inserted, so a newer operation installed under the same key
 * is never cleared by an older one draining.
 * <p>
 * The future handed out completes after the entry was removed: work chained on it (a queued follow-up,
 * for instance) always finds the slot free.
 */
public final class InFlightCoalescer {

    private InFlightCoalescer() {
    }

    public static <T> CompletableFuture<T> coalesce(ConcurrentMap<String, CompletableFuture<T>> inFlight,
                                                    String key,
                                                    Supplier<CompletableFuture<T>> factory) {
        CompletableFuture<T> source;
        CompletableFuture<T> tracked;
        synchronized (inFlight) {
            CompletableFuture<T> existing = inFlight.get(key);
            if (existing != null) {
                return existing;
            }
            source = start(factory);
            tracked = new CompletableFuture<>();
            inFlight.put(key, tracked);
        }

        source.whenComplete((value, error) -> {
            inFlight.remove(key, tracked);
            if (error != null) {
                tracked.completeExceptionally(unwrap(error));
            } else {
                tracked.complete(value);
            }
        });
        return tracked;
    }

    /**
     * Strips the {@link CompletionException}/{@link ExecutionException} wrappers async stages add.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static <T> CompletableFuture<T> start(Supplier<CompletableFuture<T>> factory) {
        try {
            CompletableFuture<T> future = factory.get();
            if (future == null) {
                return CompletableFuture.failedFuture(new IllegalStateException("factory returned no future"));
            }
            return future;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
