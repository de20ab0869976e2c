package io.layermesh.serialization;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.layermesh.error.SerializationException;
import io.layermesh.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;

final class ValueSerializerTest {
    private static final Instant NOON = Instant.parse("2021-06-01T12:00:00Z");

    private final ValueSerializer serializer = new ValueSerializer(TypeResolver.NONE);

    @Test
    void nullIsNeverAValue() {
        SerializationException error = Assertions.assertThrows(SerializationException.class,
                () -> serializer.serialize(null, SerializationOptions.none()));
        Assertions.assertEquals("The 'null' value is not allowed", error.getMessage());
        Assertions.assertThrows(SerializationException.class,
                () -> serializer.serialize(NullNode.getInstance(), SerializationOptions.none()));
        Assertions.assertThrows(SerializationException.class,
                () -> serializer.deserialize(NullNode.getInstance(), SerializationOptions.none()));
        Assertions.assertThrows(SerializationException.class,
                () -> serializer.serialize(Arrays.asList("a", null), SerializationOptions.none()));
    }

    @Test
    void instantUsesTheDateEnvelope() {
        JsonNode node = await(serializer.serialize(NOON, SerializationOptions.none()));
        Assertions.assertEquals(Jsons.readTree("{\"_type\":\"Date\",\"_value\":\"2021-06-01T12:00:00Z\"}"), node);
        Assertions.assertEquals(NOON, await(serializer.deserialize(node, SerializationOptions.none())));
    }

    @Test
    void plainValuesRoundTripKeepingOrder() {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("name", "clock");
        value.put("count", 3);
        value.put("enabled", true);
        value.put("ticks", List.of(1, 2, 3));
        value.put("nested", Map.of("at", NOON, "tags", List.of("a", "b")));

        JsonNode wire = await(serializer.serialize(value, SerializationOptions.none()));
        Assertions.assertEquals(List.of("name", "count", "enabled", "ticks", "nested"), fieldNames(wire));
        Object restored = await(serializer.deserialize(wire, SerializationOptions.none()));

        Assertions.assertEquals(value, restored);
    }

    @Test
    void arraysAndPlainObjectsAreSerializedStructurally() {
        JsonNode array = await(serializer.serialize(new int[]{3, 1, 2}, SerializationOptions.none()));
        Assertions.assertEquals(Jsons.readTree("[3,1,2]"), array);

        JsonNode point = await(serializer.serialize(new Point(4, 5), SerializationOptions.none()));
        Assertions.assertEquals(Jsons.readTree("{\"x\":4,\"y\":5}"), point);
    }

    @Test
    void unknownTypeIsAnError() {
        JsonNode typed = Jsons.readTree("{\"_type\":\"Movie\",\"title\":\"Inception\"}");
        SerializationException error = Assertions.assertThrows(SerializationException.class,
                () -> await(serializer.deserialize(typed, SerializationOptions.none())));
        Assertions.assertEquals("Cannot deserialize a value of unknown type (type: 'Movie')", error.getMessage());

        JsonNode nested = Jsons.readTree("{\"movies\":[{\"_type\":\"Movie\"}]}");
        Assertions.assertThrows(SerializationException.class,
                () -> await(serializer.deserialize(nested, SerializationOptions.none())));
    }

    @Test
    void resolvedTypeMustBeSerializable() {
        ValueSerializer resolving = new ValueSerializer(name -> Optional.of("not an item"));
        JsonNode typed = Jsons.readTree("{\"_type\":\"Movie\"}");
        Assertions.assertThrows(SerializationException.class,
                () -> await(resolving.deserialize(typed, SerializationOptions.none())));
    }

    @Test
    void malformedDateIsRejected() {
        JsonNode typed = Jsons.readTree("{\"_type\":\"Date\",\"_value\":\"yesterday\"}");
        Assertions.assertThrows(SerializationException.class,
                () -> await(serializer.deserialize(typed, SerializationOptions.none())));
    }

    private static List<String> fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }

    private static <T> T await(CompletionStage<T> stage) {
        try {
            return stage.toCompletableFuture().join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    record Point(int x, int y) {
    }
}
