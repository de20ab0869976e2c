package io.layermesh.exposure;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Permission setting for one operation of an exposed property: a fixed yes/no, or a set of
 * role names left to a {@link PermissionResolver}.
 */
public record Permission(Boolean fixed, Set<String> roles) {
    private static final Permission ALLOW = new Permission(Boolean.TRUE, Set.of());
    private static final Permission DENY = new Permission(Boolean.FALSE, Set.of());

    public Permission {
        roles = roles == null ? Set.of() : Set.copyOf(roles);
        if (fixed == null && roles.isEmpty()) {
            throw new IllegalArgumentException("permission needs a fixed value or at least one role");
        }
        if (fixed != null && !roles.isEmpty()) {
            throw new IllegalArgumentException("permission cannot be both fixed and role based");
        }
    }

    public static Permission allow() {
        return ALLOW;
    }

    public static Permission deny() {
        return DENY;
    }

    public static Permission of(boolean allowed) {
        return allowed ? ALLOW : DENY;
    }

    public static Permission role(String role) {
        if (role == null || role.isBlank()) {
            throw new IllegalArgumentException("role cannot be empty");
        }
        return new Permission(null, Set.of(role.trim()));
    }

    public static Permission anyOf(Collection<String> roles) {
        if (roles == null || roles.isEmpty()) {
            throw new IllegalArgumentException("role set cannot be empty");
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String role : roles) {
            if (role == null || role.isBlank()) {
                throw new IllegalArgumentException("role cannot be empty");
            }
            normalized.add(role.trim());
        }
        return new Permission(null, normalized);
    }

    public Decision decide() {
        if (fixed == null) {
            return Decision.DELEGATE;
        }
        return fixed ? Decision.ALLOW : Decision.DENY;
    }
}
