package io.layermesh.model;

import io.layermesh.error.LookupException;
import io.layermesh.error.ProtocolException;
import io.layermesh.exposure.Exposable;
import io.layermesh.exposure.ExposedProperty;
import io.layermesh.exposure.Exposure;
import io.layermesh.exposure.Operation;
import io.layermesh.exposure.ExposureTable;
import io.layermesh.exposure.Permission;
import io.layermesh.exposure.PermissionResolver;
import io.layermesh.exposure.PropertyKind;
import io.layermesh.layer.Layer;
import io.layermesh.query.QueryReceiver;
import io.layermesh.util.Stages;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * An item that a {@link Layer} can own: a holder of methods, field values and an exposure table.
 *
 * <p>Every item keeps its own entries and, when it was forked, a reference to the item it was
 * forked from. Reads walk that base chain until a value is found; writes always land in the
 * item's own entries, so a fork never alters its base. The owning layer is the exception: it is
 * never inherited.
 */
public abstract class Registerable implements Exposable, QueryReceiver {
    static final String RESULT_KEY = "result";

    private final Registerable base;
    private final Map<String, MethodBody> ownMethods = new LinkedHashMap<>();
    private final Map<String, Object> ownFields = new LinkedHashMap<>();
    private final ExposureTable exposure;
    private Boolean exposed;
    private Boolean detached;
    private String registeredName;
    private PermissionResolver permissionResolver;
    private Layer layer;

    protected Registerable(Registerable base) {
        this.base = base;
        this.exposure = base == null ? new ExposureTable() : base.exposure.derive();
    }

    public Optional<Registerable> getBase() {
        return Optional.ofNullable(base);
    }

    /**
     * A new item sharing everything with this one until it is written to.
     */
    public abstract Registerable fork();

    // === Registration ===

    public String getRegisteredName() {
        for (Registerable current = this; current != null; current = current.base) {
            if (current.registeredName != null) {
                return current.registeredName;
            }
        }
        return null;
    }

    public void setRegisteredName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("registered name cannot be empty");
        }
        if (registeredName != null) {
            throw new ProtocolException("Item already has a registered name (name: '" + registeredName + "')");
        }
        registeredName = name;
    }

    public boolean isRegistered() {
        return getRegisteredName() != null;
    }

    public Optional<Layer> findOwnLayer() {
        return Optional.ofNullable(layer);
    }

    /**
     * The layer that owns this item. Instance-like items fall back to their type's layer.
     */
    public Optional<Layer> findLayer() {
        return findOwnLayer();
    }

    public Layer getLayer() {
        return findLayer().orElseThrow(() -> new LookupException("Layer not found"));
    }

    public boolean hasLayer() {
        return findLayer().isPresent();
    }

    public void setLayer(Layer owner) {
        if (owner == null) {
            throw new IllegalArgumentException("layer is required");
        }
        layer = owner;
    }

    public Optional<Layer> findParentLayer() {
        return findLayer().flatMap(Layer::findParent);
    }

    public boolean hasParentLayer() {
        return findParentLayer().isPresent();
    }

    // === Lifecycle ===

    public CompletionStage<Void> open() {
        return Stages.done();
    }

    public CompletionStage<Void> close() {
        return Stages.done();
    }

    public void detach() {
        detached = Boolean.TRUE;
    }

    public boolean isDetached() {
        for (Registerable current = this; current != null; current = current.base) {
            if (current.detached != null) {
                return current.detached;
            }
        }
        return false;
    }

    // === Members ===

    public Registerable defineMethod(String name, MethodBody body) {
        checkMemberName(name);
        if (body == null) {
            throw new IllegalArgumentException("method body is required: " + name);
        }
        ownMethods.put(name, body);
        return this;
    }

    public Optional<MethodBody> findLocalMethod(String name) {
        for (Registerable current = this; current != null; current = current.base) {
            MethodBody body = current.ownMethods.get(name);
            if (body != null) {
                return Optional.of(body);
            }
        }
        return Optional.empty();
    }

    public Registerable setField(String name, Object value) {
        checkMemberName(name);
        if (value == null) {
            throw new IllegalArgumentException("field value cannot be null: " + name);
        }
        ownFields.put(name, value);
        return this;
    }

    public Optional<Object> getField(String name) {
        for (Registerable current = this; current != null; current = current.base) {
            Object value = current.ownFields.get(name);
            if (value != null) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    Set<String> ownFieldNames() {
        return Collections.unmodifiableSet(ownFields.keySet());
    }

    public boolean hasField(String name) {
        return getField(name).isPresent();
    }

    /**
     * Field names visible on this item, oldest definitions first.
     */
    public Set<String> fieldNames() {
        Set<String> names = base == null ? new LinkedHashSet<>() : base.fieldNames();
        names.addAll(ownFields.keySet());
        return names;
    }

    private static void checkMemberName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("member name cannot be empty");
        }
        if (name.startsWith("_")) {
            throw new IllegalArgumentException("member names starting with '_' are reserved: " + name);
        }
    }

    // === Exposure ===

    public Registerable markExposed() {
        exposed = Boolean.TRUE;
        return this;
    }

    public Registerable setExposed(boolean value) {
        exposed = value;
        return this;
    }

    @Override
    public boolean isExposed() {
        for (Registerable current = this; current != null; current = current.base) {
            if (current.exposed != null) {
                return current.exposed;
            }
        }
        return false;
    }

    @Override
    public void exposeProperty(ExposedProperty property) {
        if (property == null) {
            throw new IllegalArgumentException("exposed property is required");
        }
        exposure.put(property);
    }

    public Registerable exposeField(String name, Permission read, Permission write) {
        exposeProperty(ExposedProperty.field(name, read, write));
        return this;
    }

    public Registerable exposeMethod(String name, Permission call) {
        exposeProperty(ExposedProperty.method(name, call));
        return this;
    }

    @Override
    public Optional<ExposedProperty> getExposedProperty(String name) {
        return exposure.find(name);
    }

    @Override
    public Map<String, ExposedProperty> getExposedProperties() {
        return exposure.asMap();
    }

    public PermissionResolver getPermissionResolver() {
        for (Registerable current = this; current != null; current = current.base) {
            if (current.permissionResolver != null) {
                return current.permissionResolver;
            }
        }
        return PermissionResolver.DENY_ALL;
    }

    public Registerable setPermissionResolver(PermissionResolver resolver) {
        permissionResolver = resolver;
        return this;
    }

    @Override
    public CompletionStage<Boolean> operationIsAllowed(ExposedProperty property, Operation operation) {
        return switch (Exposure.operationIsAllowed(property, operation)) {
            case ALLOW -> CompletableFuture.completedFuture(true);
            case DENY -> CompletableFuture.completedFuture(false);
            case DELEGATE -> getPermissionResolver().resolve(this, property, operation, property.settingFor(operation))
                    .thenApply(Boolean.TRUE::equals);
        };
    }

    // === Dispatch ===

    /**
     * Calls a method: a local definition wins, otherwise the call is forwarded to the parent
     * layer's counterpart when that counterpart exposes it.
     */
    public CompletionStage<Object> call(String name, Object... args) {
        return call(name, Arrays.asList(args));
    }

    public CompletionStage<Object> call(String name, List<Object> args) {
        MethodBody body = findLocalMethod(name)
                .or(() -> findRemoteProxy(name))
                .orElseThrow(() -> new LookupException("Method not found (name: '" + name + "')"));
        List<Object> safeArgs = args == null ? List.of() : args;
        try {
            return Stages.of(body.invoke(this, safeArgs));
        } catch (Exception e) {
            return Stages.failed(e);
        }
    }

    /**
     * A method that forwards to the parent layer, when the same-named item there exposes
     * {@code name} as a method.
     *
     * @throws IllegalStateException when the counterpart exposes {@code name} as a field
     */
    public Optional<MethodBody> findRemoteProxy(String name) {
        if (name == null || name.startsWith("_")) {
            return Optional.empty();
        }
        Optional<ExposedProperty> remote = findParentCounterpart()
                .flatMap(counterpart -> counterpart.getExposedProperty(name));
        if (remote.isEmpty()) {
            return Optional.empty();
        }
        if (remote.get().kind() != PropertyKind.METHOD) {
            throw new IllegalStateException(
                    "Only exposed methods can be called through a parent layer (name: '" + name + "')");
        }
        return Optional.of((self, args) -> self.callParentLayer(name, args));
    }

    /**
     * The exposed item standing for this one in the parent layer.
     */
    protected Optional<Exposable> findParentCounterpart() {
        String name = getRegisteredName();
        if (name == null) {
            return Optional.empty();
        }
        return findOwnLayer()
                .flatMap(Layer::findParent)
                .flatMap(parent -> parent.find(name))
                .filter(Exposure::isExposed)
                .map(counterpart -> (Exposable) counterpart);
    }

    public CompletionStage<Object> callParentLayer(String methodName, List<Object> args) {
        Layer owner = getLayer();
        Object query = buildQuery(methodName, args == null ? List.of() : args);
        return owner.sendQuery(query).thenApply(response -> {
            if (!(response instanceof Map)) {
                throw new ProtocolException("Expected a keyed result from the parent layer");
            }
            Map<?, ?> keyed = (Map<?, ?>) response;
            applyParentChanges(keyed);
            return keyed.get(RESULT_KEY);
        });
    }

    /**
     * Hook for state the parent layer sent back next to the result.
     */
    protected void applyParentChanges(Map<?, ?> response) {
    }

    protected Object buildQuery(String methodName, List<Object> args) {
        Map<String, Object> query = new LinkedHashMap<>();
        query.put(getRegisteredName() + "=>", callSubquery(methodName, args));
        return query;
    }

    static Map<String, Object> callSubquery(String methodName, List<Object> args) {
        Map<String, Object> invocation = new LinkedHashMap<>();
        invocation.put("()", new ArrayList<>(args));
        Map<String, Object> subquery = new LinkedHashMap<>();
        subquery.put(methodName + "=>" + RESULT_KEY, invocation);
        return subquery;
    }

    // === Query receiver ===

    @Override
    public Optional<Object> getQueryProperty(String name) {
        return getField(name);
    }

    @Override
    public CompletionStage<Object> callQueryMethod(String name, List<Object> args) {
        return call(name, args);
    }

    // === Introspection ===

    protected abstract String introspectionType();

    public Map<String, Object> introspect() {
        Map<String, Object> introspection = new LinkedHashMap<>();
        introspection.put("_type", introspectionType());
        for (ExposedProperty property : getExposedProperties().values()) {
            introspection.put(property.name(), Map.of("_type", property.kind().wireName()));
        }
        return introspection;
    }

    @Override
    public String toString() {
        String name = getRegisteredName();
        return getClass().getSimpleName() + "(" + (name == null ? "unregistered" : name) + ")";
    }
}
