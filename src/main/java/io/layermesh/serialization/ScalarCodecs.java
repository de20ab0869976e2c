package io.layermesh.serialization;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.layermesh.error.SerializationException;
import io.layermesh.util.Jsons;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class ScalarCodecs {
    public static final ScalarCodec<Instant> DATE = new DateCodec();

    private final Map<String, ScalarCodec<?>> byName = new LinkedHashMap<>();
    private final List<ScalarCodec<?>> ordered = new ArrayList<>();

    public static ScalarCodecs defaults() {
        ScalarCodecs codecs = new ScalarCodecs();
        codecs.register(DATE);
        return codecs;
    }

    public ScalarCodecs register(ScalarCodec<?> codec) {
        if (byName.containsKey(codec.typeName())) {
            throw new IllegalArgumentException("Scalar codec already registered: " + codec.typeName());
        }
        byName.put(codec.typeName(), codec);
        ordered.add(codec);
        return this;
    }

    public Optional<ScalarCodec<?>> forName(String typeName) {
        return Optional.ofNullable(byName.get(typeName));
    }

    public Optional<ScalarCodec<?>> forValue(Object value) {
        for (ScalarCodec<?> codec : ordered) {
            if (codec.javaType().isInstance(value)) {
                return Optional.of(codec);
            }
        }
        return Optional.empty();
    }

    @SuppressWarnings("unchecked")
    static <T> ObjectNode encode(ScalarCodec<T> codec, Object value) {
        return codec.encode((T) value);
    }

    private static final class DateCodec implements ScalarCodec<Instant> {
        @Override
        public String typeName() {
            return "Date";
        }

        @Override
        public Class<Instant> javaType() {
            return Instant.class;
        }

        @Override
        public ObjectNode encode(Instant value) {
            ObjectNode node = Jsons.nodes().objectNode();
            node.put("_type", typeName());
            node.put("_value", value.toString());
            return node;
        }

        @Override
        public Instant decode(ObjectNode object) {
            JsonNode raw = object.get("_value");
            if (raw == null || !raw.isTextual()) {
                throw new SerializationException("A Date value must carry an ISO-8601 '_value' string");
            }
            try {
                return Instant.parse(raw.textValue());
            } catch (DateTimeParseException e) {
                throw new SerializationException("Invalid Date value: " + raw.textValue(), e);
            }
        }
    }
}
