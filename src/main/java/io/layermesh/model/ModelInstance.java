package io.layermesh.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.layermesh.error.SerializationException;
import io.layermesh.exposure.Exposable;
import io.layermesh.exposure.Exposure;
import io.layermesh.exposure.Permission;
import io.layermesh.layer.Layer;
import io.layermesh.serialization.SerializationOptions;
import io.layermesh.serialization.ValueSerializer;
import io.layermesh.serialization.WireSerializable;
import io.layermesh.util.Jsons;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * Instance-like item. Reads fall through to its type's prototype, so instance methods, default
 * field values and the instance exposure table are shared until an instance writes its own.
 */
public class ModelInstance extends Registerable implements WireSerializable {
    static final String CHANGES_KEY = "changes";

    private final ModelClass type;
    private boolean isNew = true;

    ModelInstance(ModelClass type, Registerable base) {
        super(base);
        this.type = type;
    }

    public ModelClass getType() {
        return type;
    }

    @Override
    public ModelInstance fork() {
        ModelInstance forked = new ModelInstance(type, this);
        forked.isNew = isNew;
        return forked;
    }

    @Override
    public Optional<Layer> findLayer() {
        Optional<Layer> own = findOwnLayer();
        if (own.isPresent()) {
            return own;
        }
        return type.findLayer();
    }

    public boolean isNew() {
        return isNew;
    }

    public void markAsNew() {
        isNew = true;
    }

    public void markAsNotNew() {
        isNew = false;
    }

    // === Fluent definitions ===

    @Override
    public ModelInstance defineMethod(String name, MethodBody body) {
        super.defineMethod(name, body);
        return this;
    }

    @Override
    public ModelInstance setField(String name, Object value) {
        super.setField(name, value);
        return this;
    }

    @Override
    public ModelInstance exposeField(String name, Permission read, Permission write) {
        super.exposeField(name, read, write);
        return this;
    }

    @Override
    public ModelInstance exposeMethod(String name, Permission call) {
        super.exposeMethod(name, call);
        return this;
    }

    // === Remote calls ===

    /**
     * A registered instance looks for its own counterpart; otherwise the type's counterpart is
     * used and the exposure checked is the one its instances share.
     */
    @Override
    protected Optional<Exposable> findParentCounterpart() {
        if (getRegisteredName() != null) {
            return super.findParentCounterpart();
        }
        String typeName = type.getRegisteredName();
        if (typeName == null) {
            return Optional.empty();
        }
        return type.findParentLayer()
                .flatMap(parent -> parent.find(typeName))
                .filter(Exposure::isExposed)
                .filter(counterpart -> counterpart instanceof ModelClass)
                .map(counterpart -> (Exposable) ((ModelClass) counterpart).prototype());
    }

    @Override
    protected Object buildQuery(String methodName, List<Object> args) {
        if (getRegisteredName() != null) {
            return super.buildQuery(methodName, args);
        }
        Map<String, Object> query = new LinkedHashMap<>();
        query.put("<=", this);
        query.putAll(callSubquery(methodName, args));
        query.put("=>" + CHANGES_KEY, Boolean.TRUE);
        return query;
    }

    /**
     * Copies the fields of the returned copy of this instance, when the parent sent one back.
     */
    @Override
    protected void applyParentChanges(Map<?, ?> response) {
        Object changes = response.get(CHANGES_KEY);
        if (!(changes instanceof ModelInstance) || changes == this) {
            return;
        }
        ModelInstance updated = (ModelInstance) changes;
        for (String name : updated.ownFieldNames()) {
            updated.getField(name).ifPresent(value -> setField(name, value));
        }
    }

    // === Serialization ===

    @Override
    public CompletionStage<ObjectNode> serialize(ValueSerializer serializer, SerializationOptions options) {
        String name = getRegisteredName() != null ? getRegisteredName() : type.getRegisteredName();
        if (name == null) {
            throw new SerializationException("Cannot serialize an instance whose type is not registered");
        }
        ObjectNode node = Jsons.nodes().objectNode();
        node.put(ValueSerializer.TYPE_FIELD, name);
        if (isNew) {
            node.put(ValueSerializer.NEW_FIELD, true);
        }
        return ModelFields.write(this, node, serializer, options);
    }

    /**
     * A typed object naming a registered instance updates that instance.
     */
    @Override
    public CompletionStage<Object> deserialize(ObjectNode object, ValueSerializer serializer, SerializationOptions options) {
        return applyState(object, serializer, options).thenApply(ignored -> this);
    }

    @Override
    public CompletionStage<Void> applyState(ObjectNode object, ValueSerializer serializer, SerializationOptions options) {
        JsonNode newFlag = object.get(ValueSerializer.NEW_FIELD);
        isNew = newFlag != null && newFlag.asBoolean(false);
        return ModelFields.read(this, object, serializer, options).thenAccept(ignored -> type.setInstance(this));
    }

    @Override
    protected String introspectionType() {
        return "instance";
    }
}
