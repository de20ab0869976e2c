package io.layermesh.util;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;

final class StagesTest {

    @Test
    void ofPassesStagesThroughAndWrapsValues() {
        CompletableFuture<String> pending = new CompletableFuture<>();

        Assertions.assertSame(pending, Stages.of(pending));
        Assertions.assertEquals("value", Stages.of("value").toCompletableFuture().join());
    }

    @Test
    void forEachSequentialWaitsForEachStage() {
        List<String> events = new ArrayList<>();
        CompletableFuture<Void> gate = new CompletableFuture<>();

        CompletionStage<Void> all = Stages.forEachSequential(List.of("a", "b"), item -> {
            events.add("start " + item);
            return "a".equals(item) ? gate : Stages.done();
        });

        Assertions.assertEquals(List.of("start a"), events);
        gate.complete(null);
        all.toCompletableFuture().join();
        Assertions.assertEquals(List.of("start a", "start b"), events);
    }

    @Test
    void mapAllKeepsInputOrder() {
        CompletableFuture<Integer> slow = new CompletableFuture<>();
        CompletionStage<List<Integer>> mapped = Stages.mapAll(List.of(1, 2, 3),
                item -> item == 1 ? slow : CompletableFuture.completedFuture(item * 10));

        slow.complete(10);

        Assertions.assertEquals(List.of(10, 20, 30), mapped.toCompletableFuture().join());
    }

    @Test
    void withFinallyRunsCleanupAfterFailureAndKeepsBodyError() {
        List<String> events = new ArrayList<>();

        CompletionStage<Object> stage = Stages.withFinally(() -> {
            throw new IllegalStateException("body");
        }, () -> {
            events.add("cleanup");
            throw new IllegalArgumentException("cleanup");
        });

        CompletionException error = Assertions.assertThrows(CompletionException.class, () -> stage.toCompletableFuture().join());
        Assertions.assertEquals(List.of("cleanup"), events);
        Assertions.assertEquals("body", error.getCause().getMessage());
        Assertions.assertEquals("cleanup", error.getCause().getSuppressed()[0].getMessage());
    }

    @Test
    void withFinallyReportsCleanupFailureAfterSuccess() {
        CompletionStage<String> stage = Stages.withFinally(
                () -> CompletableFuture.completedFuture("ok"),
                () -> Stages.failed(new IllegalStateException("close failed")));

        CompletionException error = Assertions.assertThrows(CompletionException.class, () -> stage.toCompletableFuture().join());
        Assertions.assertEquals("close failed", error.getCause().getMessage());
    }

    @Test
    void unwrapStripsCompletionWrappers() {
        IllegalStateException cause = new IllegalStateException("inner");

        Assertions.assertSame(cause, Stages.unwrap(new CompletionException(new CompletionException(cause))));
        Assertions.assertSame(cause, Stages.unwrap(cause));
    }
}
