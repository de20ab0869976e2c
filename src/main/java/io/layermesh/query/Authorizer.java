package io.layermesh.query;

import io.layermesh.exposure.Operation;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Decides whether one step of a query may touch a property of the current receiver.
 */
@FunctionalInterface
public interface Authorizer {
    Authorizer ALLOW_ALL = (receiver, name, operation, params) ->
            CompletableFuture.completedFuture(true);

    /**
     * @param receiver the value the property would be read from or called on
     * @param name property name
     * @param operation {@link Operation#GET} or {@link Operation#CALL}
     * @param params call arguments, empty for reads
     */
    CompletionStage<Boolean> authorize(Object receiver, String name, Operation operation, List<Object> params);
}
