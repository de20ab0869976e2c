package io.layermesh.layer;

import io.layermesh.util.Stages;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;

/**
 * Source of the yield point a batch waits on before each flush, so that queries issued by
 * pending work can join the batch.
 */
@FunctionalInterface
public interface Scheduler {

    CompletionStage<Void> yieldPoint();

    /**
     * Continues on the caller's thread. Queries issued synchronously inside the batched
     * operation are already queued when the flush starts.
     */
    static Scheduler immediate() {
        return Stages::done;
    }

    /**
     * Resumes on {@code executor}, after the tasks already queued there.
     */
    static Scheduler using(Executor executor) {
        if (executor == null) {
            throw new IllegalArgumentException("executor is required");
        }
        return () -> CompletableFuture.runAsync(() -> { }, executor);
    }
}
