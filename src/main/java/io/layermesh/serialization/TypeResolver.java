package io.layermesh.serialization;

import java.util.Optional;

/**
 * Looks up the item a typed object's {@code _type} refers to.
 */
@FunctionalInterface
public interface TypeResolver {
    TypeResolver NONE = typeName -> Optional.empty();

    Optional<Object> resolve(String typeName);
}
