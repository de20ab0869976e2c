package io.layermesh.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.layermesh.exposure.ExposedProperty;
import io.layermesh.exposure.PropertyKind;
import io.layermesh.serialization.SerializationOptions;
import io.layermesh.serialization.ValueSerializer;
import io.layermesh.util.Stages;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * Field state of an item on the wire. Keys starting with {@code _} are envelope metadata and
 * never fields. With a property filter, only fields exposed as such and accepted by the filter
 * are written or read; the others are left out.
 */
final class ModelFields {

    private ModelFields() {
    }

    static CompletionStage<ObjectNode> write(
            Registerable owner,
            ObjectNode target,
            ValueSerializer serializer,
            SerializationOptions options
    ) {
        List<String> names = new ArrayList<>(owner.fieldNames());
        return Stages.mapAll(names, name -> passes(owner, name, options).thenCompose(include -> {
            if (!include) {
                return Stages.<JsonNode>of(null);
            }
            return serializer.serialize(owner.getField(name).orElseThrow(), options);
        })).thenApply(values -> {
            for (int i = 0; i < names.size(); i++) {
                if (values.get(i) != null) {
                    target.set(names.get(i), values.get(i));
                }
            }
            return target;
        });
    }

    static CompletionStage<Void> read(
            Registerable owner,
            ObjectNode source,
            ValueSerializer serializer,
            SerializationOptions options
    ) {
        List<Map.Entry<String, JsonNode>> entries = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = source.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getKey().startsWith("_")) {
                entries.add(field);
            }
        }
        return Stages.forEachSequential(entries, entry -> {
            String name = entry.getKey();
            return passes(owner, name, options).thenCompose(accept -> {
                if (!accept) {
                    return Stages.done();
                }
                Object previous = owner.getField(name).orElse(null);
                return serializer.deserialize(entry.getValue(), options.withPreviousInstance(previous))
                        .thenAccept(value -> owner.setField(name, value));
            });
        });
    }

    private static CompletionStage<Boolean> passes(Registerable owner, String name, SerializationOptions options) {
        if (!options.hasFilter()) {
            return Stages.of(Boolean.TRUE);
        }
        Optional<ExposedProperty> property = owner.getExposedProperty(name);
        if (property.isEmpty() || property.get().kind() != PropertyKind.FIELD) {
            return Stages.of(Boolean.FALSE);
        }
        return options.filter().test(owner, property.get());
    }
}
