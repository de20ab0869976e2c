package io.layermesh.serialization;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.layermesh.error.SerializationException;
import io.layermesh.util.Jsons;
import io.layermesh.util.Stages;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * Converts live values to wire values ({@link JsonNode} trees) and back.
 *
 * <p>Sequences keep their order, plain maps are walked recursively, and anything that knows how
 * to write its own envelope ({@link WireSerializable}, built-in scalars) does so. A wire object
 * carrying {@code _type} is a typed object: built-in scalars are decoded directly, any other type
 * name is resolved to an item through the {@link TypeResolver} and rebuilt by that item.
 * {@code null} is never a valid value in either direction.
 */
public final class ValueSerializer {
    public static final String TYPE_FIELD = "_type";
    public static final String NEW_FIELD = "_new";

    private final TypeResolver resolver;
    private final ScalarCodecs codecs;

    public ValueSerializer(TypeResolver resolver) {
        this(resolver, ScalarCodecs.defaults());
    }

    public ValueSerializer(TypeResolver resolver, ScalarCodecs codecs) {
        this.resolver = resolver == null ? TypeResolver.NONE : resolver;
        this.codecs = codecs == null ? ScalarCodecs.defaults() : codecs;
    }

    // === Serialization ===

    public CompletionStage<JsonNode> serialize(Object value, SerializationOptions options) {
        SerializationOptions safe = options == null ? SerializationOptions.none() : options;
        if (value == null || (value instanceof JsonNode && ((JsonNode) value).isNull())) {
            throw new SerializationException("The 'null' value is not allowed");
        }
        if (value instanceof JsonNode) {
            return Stages.of(value);
        }
        if (value instanceof Collection) {
            return serializeSequence(new ArrayList<>((Collection<?>) value), safe);
        }
        if (value.getClass().isArray()) {
            return serializeSequence(arrayToList(value), safe);
        }
        if (value instanceof WireSerializable) {
            return ((WireSerializable) value).serialize(this, safe).thenApply(node -> (JsonNode) node);
        }
        Optional<ScalarCodec<?>> codec = codecs.forValue(value);
        if (codec.isPresent()) {
            return Stages.of(ScalarCodecs.encode(codec.get(), value));
        }
        if (value instanceof Map) {
            return serializeMap((Map<?, ?>) value, safe);
        }
        if (value instanceof String || value instanceof Number || value instanceof Boolean) {
            return Stages.of(Jsons.mapper().valueToTree(value));
        }
        if (value instanceof Character || value instanceof Enum) {
            return Stages.of(Jsons.nodes().textNode(value.toString()));
        }
        return serializePlainObject(value, safe);
    }

    private CompletionStage<JsonNode> serializeSequence(List<?> items, SerializationOptions options) {
        return Stages.mapAll(items, item -> serialize(item, options)).thenApply(elements -> {
            ArrayNode array = Jsons.nodes().arrayNode(elements.size());
            array.addAll(elements);
            return array;
        });
    }

    private CompletionStage<JsonNode> serializeMap(Map<?, ?> map, SerializationOptions options) {
        List<String> keys = new ArrayList<>(map.size());
        List<Object> values = new ArrayList<>(map.size());
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (entry.getKey() == null) {
                throw new SerializationException("Map keys cannot be null");
            }
            keys.add(entry.getKey().toString());
            values.add(entry.getValue());
        }
        return Stages.mapAll(values, item -> serialize(item, options)).thenApply(serialized -> {
            ObjectNode object = Jsons.nodes().objectNode();
            for (int i = 0; i < keys.size(); i++) {
                object.set(keys.get(i), serialized.get(i));
            }
            return object;
        });
    }

    @SuppressWarnings("unchecked")
    private CompletionStage<JsonNode> serializePlainObject(Object value, SerializationOptions options) {
        Map<String, Object> fields;
        try {
            fields = Jsons.mapper().convertValue(value, LinkedHashMap.class);
        } catch (IllegalArgumentException e) {
            throw new SerializationException("Cannot serialize a value of type " + value.getClass().getName(), e);
        }
        fields.values().removeIf(field -> field == null);
        return serializeMap(fields, options);
    }

    private static List<Object> arrayToList(Object array) {
        int length = Array.getLength(array);
        List<Object> out = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            out.add(Array.get(array, i));
        }
        return out;
    }

    // === Deserialization ===

    public CompletionStage<Object> deserialize(JsonNode value, SerializationOptions options) {
        SerializationOptions safe = options == null ? SerializationOptions.none() : options;
        if (value == null || value.isNull() || value.isMissingNode()) {
            throw new SerializationException("The 'null' value is not allowed");
        }
        if (value.isArray()) {
            List<JsonNode> elements = new ArrayList<>(value.size());
            value.forEach(elements::add);
            return Stages.mapAll(elements, element -> deserialize(element, safe))
                    .thenApply(list -> (Object) list);
        }
        if (value.isObject()) {
            ObjectNode object = (ObjectNode) value;
            if (isTypedObject(object)) {
                return deserializeTypedObject(object, safe);
            }
            return deserializePlainObject(object, safe);
        }
        if (value.isTextual()) {
            return Stages.of(value.textValue());
        }
        if (value.isBoolean()) {
            return Stages.of(value.booleanValue());
        }
        if (value.isNumber()) {
            return Stages.of(value.numberValue());
        }
        return Stages.of(Jsons.mapper().convertValue(value, Object.class));
    }

    public static boolean isTypedObject(ObjectNode object) {
        return object.has(TYPE_FIELD);
    }

    private CompletionStage<Object> deserializeTypedObject(ObjectNode object, SerializationOptions options) {
        JsonNode typeNode = object.get(TYPE_FIELD);
        if (typeNode == null || !typeNode.isTextual() || typeNode.textValue().isBlank()) {
            throw new SerializationException("A typed object must carry a non-empty '_type' string");
        }
        String type = typeNode.textValue();
        Optional<ScalarCodec<?>> codec = codecs.forName(type);
        if (codec.isPresent()) {
            return Stages.of(codec.get().decode(object));
        }
        Object item = resolver.resolve(type)
                .orElseThrow(() -> new SerializationException("Cannot deserialize a value of unknown type (type: '" + type + "')"));
        if (!(item instanceof WireSerializable)) {
            throw new SerializationException("Cannot deserialize a value of a type that is not serializable (type: '" + type + "')");
        }
        return ((WireSerializable) item).deserialize(object, this, options);
    }

    private CompletionStage<Object> deserializePlainObject(ObjectNode object, SerializationOptions options) {
        List<String> keys = new ArrayList<>(object.size());
        List<JsonNode> values = new ArrayList<>(object.size());
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            keys.add(field.getKey());
            values.add(field.getValue());
        }
        return Stages.mapAll(values, element -> deserialize(element, options)).thenApply(deserialized -> {
            Map<String, Object> map = new LinkedHashMap<>();
            for (int i = 0; i < keys.size(); i++) {
                map.put(keys.get(i), deserialized.get(i));
            }
            return map;
        });
    }
}
