package io.layermesh.layer;

import java.util.concurrent.CompletionStage;

/**
 * In-process transport: the parent layer receives the envelope directly.
 */
public final class DirectTransport implements QueryTransport {
    public static final DirectTransport INSTANCE = new DirectTransport();

    private DirectTransport() {
    }

    @Override
    public CompletionStage<QueryResponse> deliver(Layer parent, QueryRequest request) {
        return parent.receiveQuery(request);
    }
}
