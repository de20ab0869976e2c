package io.layermesh.serialization;

import io.layermesh.exposure.Exposable;
import io.layermesh.exposure.ExposedProperty;

import java.util.concurrent.CompletionStage;

/**
 * Restricts which properties of an item are written or accepted while crossing a boundary.
 */
@FunctionalInterface
public interface PropertyFilter {

    CompletionStage<Boolean> test(Exposable owner, ExposedProperty property);
}
