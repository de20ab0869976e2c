package io.layermesh.exposure;

/**
 * Outcome of checking a permission setting without asking its owner.
 */
public enum Decision {
    ALLOW,
    DENY,
    /** The setting is a role, a role set, or unset: the owner's {@link PermissionResolver} decides. */
    DELEGATE
}
