package io.layermesh.query;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * A value a query can be evaluated against.
 */
public interface QueryReceiver {

    Optional<Object> getQueryProperty(String name);

    CompletionStage<Object> callQueryMethod(String name, List<Object> args);
}
