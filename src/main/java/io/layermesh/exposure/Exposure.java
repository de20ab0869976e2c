package io.layermesh.exposure;

import java.util.Map;

/**
 * Entry points for building exposure tables and asking them questions.
 */
public final class Exposure {

    private Exposure() {
    }

    public static void expose(Exposable target, String name, PropertyKind kind, Map<String, Permission> settings) {
        if (target == null) {
            throw new IllegalArgumentException("exposure target is required");
        }
        target.exposeProperty(ExposedProperty.of(name, kind, settings));
    }

    /**
     * The authorization primitive: fixed settings answer directly, an operation that does not
     * apply to the property kind is denied, and everything else is left to the owner.
     */
    public static Decision operationIsAllowed(ExposedProperty property, Operation operation) {
        if (property == null || !property.supports(operation)) {
            return Decision.DENY;
        }
        Permission setting = property.settingFor(operation);
        if (setting == null) {
            return Decision.DELEGATE;
        }
        return setting.decide();
    }

    public static boolean isExposed(Exposable target) {
        return target != null && target.isExposed();
    }

    public static boolean isExposed(Exposable target, String name) {
        return target != null && target.getExposedProperty(name).isPresent();
    }
}
