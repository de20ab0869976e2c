package io.layermesh.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.layermesh.error.SerializationException;
import io.layermesh.exposure.Permission;
import io.layermesh.exposure.PermissionResolver;
import io.layermesh.serialization.SerializationOptions;
import io.layermesh.serialization.ValueSerializer;
import io.layermesh.serialization.WireSerializable;
import io.layermesh.util.Jsons;

import java.util.Map;
import java.util.concurrent.CompletionStage;

/**
 * Class-like item: static methods and fields of its own, plus a {@link #prototype()} carrying
 * what its instances share (instance methods, default field values, instance exposure).
 *
 * <p>{@link #extend()} derives a subtype whose tables read through to this class until the subtype
 * writes its own entries. Forking a class is the same operation.
 */
public class ModelClass extends Registerable implements WireSerializable {
    private final ModelInstance prototype;
    private IdentityMap identityMap;

    public ModelClass() {
        super(null);
        this.prototype = new ModelInstance(this, null);
    }

    protected ModelClass(ModelClass base) {
        super(base);
        this.prototype = new ModelInstance(this, base.prototype);
    }

    public ModelInstance prototype() {
        return prototype;
    }

    public ModelClass extend() {
        return new ModelClass(this);
    }

    @Override
    public ModelClass fork() {
        return extend();
    }

    public ModelInstance newInstance() {
        return new ModelInstance(this, prototype);
    }

    // === Fluent definitions ===

    @Override
    public ModelClass defineMethod(String name, MethodBody body) {
        super.defineMethod(name, body);
        return this;
    }

    @Override
    public ModelClass setField(String name, Object value) {
        super.setField(name, value);
        return this;
    }

    @Override
    public ModelClass markExposed() {
        super.markExposed();
        return this;
    }

    @Override
    public ModelClass exposeField(String name, Permission read, Permission write) {
        super.exposeField(name, read, write);
        return this;
    }

    @Override
    public ModelClass exposeMethod(String name, Permission call) {
        super.exposeMethod(name, call);
        return this;
    }

    @Override
    public ModelClass setPermissionResolver(PermissionResolver resolver) {
        super.setPermissionResolver(resolver);
        return this;
    }

    // === Identity map ===

    public ModelClass setIdentityMap(IdentityMap map) {
        identityMap = map;
        return this;
    }

    public IdentityMap getIdentityMap() {
        if (identityMap != null) {
            return identityMap;
        }
        return getBase().map(base -> ((ModelClass) base).getIdentityMap()).orElse(IdentityMap.NONE);
    }

    protected ModelInstance getInstance(ObjectNode object, ModelInstance previousInstance) {
        return getIdentityMap().getInstance(this, object, previousInstance);
    }

    protected void setInstance(ModelInstance instance) {
        getIdentityMap().setInstance(this, instance);
    }

    // === Serialization ===

    @Override
    public CompletionStage<ObjectNode> serialize(ValueSerializer serializer, SerializationOptions options) {
        String name = getRegisteredName();
        if (name == null) {
            throw new SerializationException("Cannot serialize a class that is not registered");
        }
        ObjectNode node = Jsons.nodes().objectNode();
        node.put(ValueSerializer.TYPE_FIELD, name);
        return ModelFields.write(this, node, serializer, options);
    }

    /**
     * Builds (or finds, through the identity map) an instance of this class from a typed object.
     */
    @Override
    public CompletionStage<Object> deserialize(ObjectNode object, ValueSerializer serializer, SerializationOptions options) {
        ModelInstance previous = options.previousInstance() instanceof ModelInstance
                ? (ModelInstance) options.previousInstance()
                : null;
        ModelInstance found = getInstance(object, previous);
        ModelInstance instance = found != null ? found : newInstance();
        return instance.applyState(object, serializer, options).thenApply(ignored -> instance);
    }

    @Override
    public CompletionStage<Void> applyState(ObjectNode object, ValueSerializer serializer, SerializationOptions options) {
        return ModelFields.read(this, object, serializer, options);
    }

    // === Introspection ===

    @Override
    protected String introspectionType() {
        return "class";
    }

    @Override
    public Map<String, Object> introspect() {
        Map<String, Object> introspection = super.introspect();
        introspection.put("prototype", prototype.introspect());
        return introspection;
    }
}
