package io.layermesh.exposure;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Decides the permissions that are not fixed booleans: role settings and unset settings.
 * Resolution may complete asynchronously.
 */
@FunctionalInterface
public interface PermissionResolver {
    PermissionResolver DENY_ALL = (target, property, operation, setting) -> CompletableFuture.completedFuture(false);

    /**
     * @param target the item (class-like or instance-like) that owns the property
     * @param setting the configured setting, or {@code null} when none was given
     */
    CompletionStage<Boolean> resolve(Object target, ExposedProperty property, Operation operation, Permission setting);
}
