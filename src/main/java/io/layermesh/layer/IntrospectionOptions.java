package io.layermesh.layer;

import java.util.List;
import java.util.Map;

/**
 * @param exposedItemsOnly list only items that are exposed themselves or whose instances are
 */
public record IntrospectionOptions(boolean exposedItemsOnly) {
    public static final String EXPOSED_FILTER = "$isExposed";
    public static final IntrospectionOptions ALL = new IntrospectionOptions(false);
    public static final IntrospectionOptions EXPOSED = new IntrospectionOptions(true);

    /**
     * Reads {@code [{items: {filter: "$isExposed"}, ...}]}, the argument list of a remote
     * introspection call. Properties are always limited to exposed ones.
     */
    public static IntrospectionOptions fromArguments(List<Object> args) {
        if (args == null || args.isEmpty() || !(args.get(0) instanceof Map)) {
            return ALL;
        }
        Object items = ((Map<?, ?>) args.get(0)).get("items");
        if (items instanceof Map && EXPOSED_FILTER.equals(((Map<?, ?>) items).get("filter"))) {
            return EXPOSED;
        }
        return ALL;
    }
}
