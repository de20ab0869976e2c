package io.layermesh.example;

import io.layermesh.config.HostConfig;
import io.layermesh.exposure.Permission;
import io.layermesh.layer.Layer;
import io.layermesh.model.ModelClass;

import java.time.Clock;
import java.util.Objects;

/**
 * Example backend hosted by {@code layermesh serve}.
 *
 * <pre>
 * curl -X POST -H "Content-Type: application/json" \
 *   -d '{"query": {"Clock=>": {"getTime=>result": {"()": []}}}, "source": "frontend"}' \
 *   http://localhost:6789
 * </pre>
 */
public final class ClockLayer {
    public static final String CLOCK = "Clock";
    public static final String UNEXPOSED_MODEL = "UnexposedModel";
    static final String SECRET_ENV = "SECRET";

    private ClockLayer() {
    }

    public static Layer create() {
        return create(HostConfig.DEFAULT_LAYER_NAME);
    }

    public static Layer create(String name) {
        return create(name, Clock.systemUTC(), System.getenv(SECRET_ENV));
    }

    public static Layer create(String name, Clock clock, String secret) {
        return Layer.builder()
                .name(name)
                .register(CLOCK, clockModel(clock, secret))
                .register(UNEXPOSED_MODEL, unexposedModel())
                .build();
    }

    /**
     * {@code getTime} is callable remotely; {@code getSecret} is defined but never exposed.
     */
    public static ModelClass clockModel(Clock clock, String secret) {
        Objects.requireNonNull(clock, "clock");
        String safeSecret = secret == null ? "" : secret;
        return new ModelClass()
                .defineMethod("getTime", (self, args) -> clock.instant())
                .defineMethod("getSecret", (self, args) -> safeSecret)
                .markExposed()
                .exposeMethod("getTime", Permission.allow());
    }

    public static ModelClass unexposedModel() {
        return new ModelClass()
                .defineMethod("unexposedMethod", (self, args) -> "Hi");
    }
}
