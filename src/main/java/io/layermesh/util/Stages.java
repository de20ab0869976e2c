package io.layermesh.util;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Helpers for values that may or may not be asynchronous.
 *
 * <p>Everything here keeps input order in its output, and nothing here schedules work on
 * another thread: stages that are already complete are chained on the caller's thread.
 */
public final class Stages {
    private static final CompletionStage<Void> DONE = CompletableFuture.completedFuture(null);

    private Stages() {
    }

    public static CompletionStage<Void> done() {
        return DONE;
    }

    /**
     * Wraps a plain value in a completed stage, or returns the value itself when it already is a
     * stage.
     */
    @SuppressWarnings("unchecked")
    public static <T> CompletionStage<T> of(Object value) {
        if (value instanceof CompletionStage) {
            return (CompletionStage<T>) value;
        }
        return CompletableFuture.completedFuture((T) value);
    }

    public static <T> CompletionStage<T> failed(Throwable error) {
        return CompletableFuture.failedFuture(unwrap(error));
    }

    /**
     * Runs {@code action} for each item, starting the next one only after the previous stage
     * completed.
     */
    public static <T> CompletionStage<Void> forEachSequential(
            Iterable<T> items,
            Function<? super T, ? extends CompletionStage<?>> action
    ) {
        CompletionStage<Void> chain = done();
        for (T item : items) {
            chain = chain.thenCompose(ignored -> action.apply(item).thenApply(finished -> (Void) null));
        }
        return chain;
    }

    /**
     * Starts {@code mapper} for every item, then collects the results in input order.
     */
    public static <T, R> CompletionStage<List<R>> mapAll(
            List<T> items,
            Function<? super T, ? extends CompletionStage<R>> mapper
    ) {
        List<CompletableFuture<R>> futures = new ArrayList<>(items.size());
        for (T item : items) {
            futures.add(mapper.apply(item).toCompletableFuture());
        }
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    List<R> results = new ArrayList<>(futures.size());
                    for (CompletableFuture<R> future : futures) {
                        results.add(future.join());
                    }
                    return results;
                });
    }

    /**
     * Runs {@code body}, then {@code cleanup} whatever the outcome. A body failure wins over a
     * cleanup failure, which is attached to it as suppressed.
     */
    public static <T> CompletionStage<T> withFinally(
            Supplier<? extends CompletionStage<T>> body,
            Supplier<? extends CompletionStage<?>> cleanup
    ) {
        CompletionStage<T> stage = attempt(body);
        CompletableFuture<T> result = new CompletableFuture<>();
        stage.whenComplete((value, error) -> {
            CompletionStage<?> cleanupStage;
            try {
                cleanupStage = cleanup.get();
            } catch (RuntimeException e) {
                cleanupStage = failed(e);
            }
            cleanupStage.whenComplete((ignored, cleanupError) -> {
                if (error != null) {
                    Throwable cause = unwrap(error);
                    if (cleanupError != null) {
                        cause.addSuppressed(unwrap(cleanupError));
                    }
                    result.completeExceptionally(cause);
                } else if (cleanupError != null) {
                    result.completeExceptionally(unwrap(cleanupError));
                } else {
                    result.complete(value);
                }
            });
        });
        return result;
    }

    /**
     * Calls {@code supplier}, turning a synchronous throw into a failed stage.
     */
    public static <T> CompletionStage<T> attempt(Supplier<? extends CompletionStage<T>> supplier) {
        try {
            return supplier.get();
        } catch (RuntimeException e) {
            return failed(e);
        }
    }

    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
