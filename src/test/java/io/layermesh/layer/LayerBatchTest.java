package io.layermesh.layer;

import com.fasterxml.jackson.databind.JsonNode;
import io.layermesh.error.AuthorizationException;
import io.layermesh.exposure.Permission;
import io.layermesh.model.ModelClass;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

final class LayerBatchTest {

    @Test
    void queriesIssuedInOneBatchShareOneRoundTrip() {
        List<QueryRequest> delivered = new ArrayList<>();
        Layer frontend = frontend(delivered);

        List<Object> results = await(frontend.batch(layer -> List.of(
                layer.sendQuery(echo("a")),
                layer.sendQuery(echo("b")),
                layer.sendQuery(echo("c"))
        )));

        Assertions.assertEquals(1, delivered.size());
        JsonNode combined = delivered.get(0).query();
        Assertions.assertTrue(combined.isArray());
        Assertions.assertEquals(3, combined.size());
        Assertions.assertEquals(List.of(
                Map.of("result", "a"),
                Map.of("result", "b"),
                Map.of("result", "c")
        ), results);
        Assertions.assertFalse(frontend.isBatched());
    }

    @Test
    void eachCallerGetsItsOwnSlice() {
        Layer frontend = frontend(new ArrayList<>());
        List<CompletionStage<Object>> calls = new ArrayList<>();

        await(frontend.batch(layer -> {
            calls.add(layer.sendQuery(echo("first")));
            calls.add(layer.sendQuery(echo("second")));
            Assertions.assertTrue(layer.isBatched());
            Assertions.assertFalse(calls.get(0).toCompletableFuture().isDone());
            return calls;
        }));

        Assertions.assertEquals(Map.of("result", "first"), await(calls.get(0)));
        Assertions.assertEquals(Map.of("result", "second"), await(calls.get(1)));
    }

    @Test
    void aFailedCombinedCallRejectsEveryCallerInTheSlice() {
        List<QueryRequest> delivered = new ArrayList<>();
        Layer frontend = frontend(delivered);
        List<CompletionStage<Object>> calls = new ArrayList<>();

        CompletionStage<List<Object>> batch = frontend.batch(layer -> {
            calls.add(layer.sendQuery(echo("a")));
            calls.add(layer.sendQuery(Map.of("Echo=>", Map.of("hidden=>result", Map.of("()", List.of())))));
            calls.add(layer.sendQuery(echo("c")));
            return calls;
        });

        Assertions.assertThrows(AuthorizationException.class, () -> await(batch));
        Assertions.assertEquals(1, delivered.size());
        for (CompletionStage<Object> call : calls) {
            Assertions.assertThrows(AuthorizationException.class, () -> await(call));
        }
        Assertions.assertFalse(frontend.isBatched());
    }

    @Test
    void queriesOfAFailedOperationAreRejectedAndNotCarriedOver() {
        List<QueryRequest> delivered = new ArrayList<>();
        Layer frontend = frontend(delivered);
        List<CompletionStage<Object>> abandoned = new ArrayList<>();

        CompletionStage<List<Object>> failed = frontend.batch(layer -> {
            abandoned.add(layer.sendQuery(echo("stale")));
            throw new IllegalStateException("operation failed");
        });

        IllegalStateException error = Assertions.assertThrows(IllegalStateException.class, () -> await(failed));
        Assertions.assertEquals("operation failed", error.getMessage());
        Assertions.assertTrue(abandoned.get(0).toCompletableFuture().isDone());
        IllegalStateException rejected = Assertions.assertThrows(IllegalStateException.class, () -> await(abandoned.get(0)));
        Assertions.assertEquals("operation failed", rejected.getMessage());
        Assertions.assertFalse(frontend.isBatched());
        Assertions.assertEquals(0, delivered.size());

        List<Object> results = await(frontend.batch(layer -> List.of(layer.sendQuery(echo("fresh")))));

        Assertions.assertEquals(List.of(Map.of("result", "fresh")), results);
        Assertions.assertEquals(1, delivered.size());
        Assertions.assertEquals(1, delivered.get(0).query().size());
    }

    @Test
    void nestedBatchesEndWithTheOutermostOne() {
        List<QueryRequest> delivered = new ArrayList<>();
        Layer frontend = frontend(delivered);

        List<Object> results = await(frontend.batch(outer -> List.of(
                outer.sendQuery(echo("outer")),
                outer.batch(inner -> {
                    Assertions.assertTrue(inner.isBatched());
                    return List.of(inner.sendQuery(echo("inner")));
                }).thenApply(innerResults -> innerResults.get(0))
        )));

        Assertions.assertEquals(List.of(Map.of("result", "outer"), Map.of("result", "inner")), results);
        Assertions.assertEquals(1, delivered.size());
        Assertions.assertFalse(frontend.isBatched());
    }

    @Test
    void queriesOutsideABatchGoOutOneByOne() {
        List<QueryRequest> delivered = new ArrayList<>();
        Layer frontend = frontend(delivered);

        Assertions.assertEquals(Map.of("result", "a"), await(frontend.sendQuery(echo("a"))));
        Assertions.assertEquals(Map.of("result", "b"), await(frontend.sendQuery(echo("b"))));
        Assertions.assertEquals(2, delivered.size());
        Assertions.assertTrue(delivered.get(0).query().isObject());
    }

    @Test
    void executorSchedulerLetsLateQueriesJoinTheBatch() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            List<QueryRequest> delivered = new ArrayList<>();
            Layer backend = backend();
            Layer frontend = Layer.builder()
                    .name("frontend")
                    .parent(backend)
                    .scheduler(Scheduler.using(executor))
                    .transport(recording(delivered))
                    .build();
            CompletableFuture<Object> late = new CompletableFuture<>();

            CompletionStage<List<Object>> batch = frontend.batch(layer -> {
                CompletionStage<Object> early = layer.sendQuery(echo("early"));
                executor.execute(() -> layer.sendQuery(echo("late")).whenComplete((value, error) -> {
                    if (error != null) {
                        late.completeExceptionally(error);
                    } else {
                        late.complete(value);
                    }
                }));
                return List.of(early);
            });

            Assertions.assertEquals(List.of(Map.of("result", "early")),
                    batch.toCompletableFuture().get(5, TimeUnit.SECONDS));
            Assertions.assertEquals(Map.of("result", "late"), late.get(5, TimeUnit.SECONDS));
            Assertions.assertEquals(1, delivered.size());
        } finally {
            executor.shutdownNow();
        }
    }

    private static Layer backend() {
        ModelClass echo = new ModelClass()
                .defineMethod("echo", (self, args) -> args.get(0))
                .defineMethod("hidden", (self, args) -> "hidden")
                .markExposed()
                .exposeMethod("echo", Permission.allow());
        return Layer.builder().name("backend").register("Echo", echo).build();
    }

    private static Layer frontend(List<QueryRequest> delivered) {
        return Layer.builder()
                .name("frontend")
                .parent(backend())
                .transport(recording(delivered))
                .build();
    }

    private static QueryTransport recording(List<QueryRequest> delivered) {
        return (parent, request) -> {
            delivered.add(request);
            return parent.receiveQuery(request);
        };
    }

    private static Map<String, Object> echo(String value) {
        return Map.of("Echo=>", Map.of("echo=>result", Map.of("()", List.of(value))));
    }

    private static <T> T await(CompletionStage<T> stage) {
        try {
            return stage.toCompletableFuture().join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }
}
