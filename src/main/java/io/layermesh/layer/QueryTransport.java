package io.layermesh.layer;

import java.util.concurrent.CompletionStage;

/**
 * Carries a request envelope from a layer to its parent and brings the response back.
 */
@FunctionalInterface
public interface QueryTransport {

    CompletionStage<QueryResponse> deliver(Layer parent, QueryRequest request);
}
