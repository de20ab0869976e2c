package io.layermesh.exposure;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * Something that carries an exposure table and a whole-entity "exposed" flag.
 */
public interface Exposable {

    boolean isExposed();

    void exposeProperty(ExposedProperty property);

    Optional<ExposedProperty> getExposedProperty(String name);

    Map<String, ExposedProperty> getExposedProperties();

    /**
     * Fully resolved answer for {@code operation} on {@code property}, asking the owner when the
     * setting does not decide by itself.
     */
    CompletionStage<Boolean> operationIsAllowed(ExposedProperty property, Operation operation);
}
