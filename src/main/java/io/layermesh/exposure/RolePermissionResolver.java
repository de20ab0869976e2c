package io.layermesh.exposure;

import java.util.Collection;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Grants role settings when the current caller holds at least one of the listed roles.
 * Unset settings stay denied.
 */
public final class RolePermissionResolver implements PermissionResolver {
    private final Supplier<? extends Collection<String>> currentRoles;

    public RolePermissionResolver(Supplier<? extends Collection<String>> currentRoles) {
        if (currentRoles == null) {
            throw new IllegalArgumentException("current role supplier is required");
        }
        this.currentRoles = currentRoles;
    }

    @Override
    public CompletionStage<Boolean> resolve(Object target, ExposedProperty property, Operation operation, Permission setting) {
        if (setting == null || setting.roles().isEmpty()) {
            return CompletableFuture.completedFuture(false);
        }
        Collection<String> held = currentRoles.get();
        if (held == null || held.isEmpty()) {
            return CompletableFuture.completedFuture(false);
        }
        Set<String> wanted = setting.roles();
        for (String role : held) {
            if (wanted.contains(role)) {
                return CompletableFuture.completedFuture(true);
            }
        }
        return CompletableFuture.completedFuture(false);
    }
}
