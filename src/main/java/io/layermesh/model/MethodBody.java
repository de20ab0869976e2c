package io.layermesh.model;

import java.util.List;

/**
 * Implementation of a method defined on a {@link Registerable}. May return a plain value or a
 * {@link java.util.concurrent.CompletionStage}.
 */
@FunctionalInterface
public interface MethodBody {

    Object invoke(Registerable self, List<Object> args) throws Exception;
}
