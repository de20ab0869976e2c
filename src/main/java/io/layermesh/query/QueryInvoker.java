package io.layermesh.query;

import java.util.concurrent.CompletionStage;

/**
 * Evaluates an already deserialized query against a receiver.
 */
public interface QueryInvoker {

    CompletionStage<Object> invoke(Object receiver, Object query, Authorizer authorizer);
}
