package io.layermesh.layer;

import java.util.concurrent.CompletionStage;

/**
 * Called once per received query, before the query runs or after its result is serialized.
 */
@FunctionalInterface
public interface ReceivedQueryHook {

    CompletionStage<?> onReceivedQuery(Layer layer);
}
