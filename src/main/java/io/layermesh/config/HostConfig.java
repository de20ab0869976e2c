package io.layermesh.config;

import io.layermesh.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Settings of a hosted layer. Values come from an optional {@code layermesh-settings.json}
 * and fall back to the defaults below; out-of-range values are clamped.
 */
public final class HostConfig {
    public static final String SETTINGS_FILE = "layermesh-settings.json";
    public static final String DEFAULT_BIND = "127.0.0.1";
    public static final int DEFAULT_PORT = 6789;
    public static final int DEFAULT_MAX_BODY_BYTES = 1024 * 1024;
    public static final String DEFAULT_LAYER_NAME = "backend";
    static final int MIN_MAX_BODY_BYTES = 1024;

    private final String bind;
    private final int port;
    private final int maxBodyBytes;
    private final String layerName;

    public HostConfig(String bind, int port, int maxBodyBytes, String layerName) {
        this.bind = bind;
        this.port = port;
        this.maxBodyBytes = maxBodyBytes;
        this.layerName = layerName;
    }

    public static HostConfig defaults() {
        return new HostConfig(DEFAULT_BIND, DEFAULT_PORT, DEFAULT_MAX_BODY_BYTES, DEFAULT_LAYER_NAME);
    }

    /**
     * Reads {@code layermesh-settings.json} from {@code directory}; a missing file yields the
     * defaults.
     */
    public static HostConfig load(Path directory) {
        HostConfig defaults = defaults();
        if (directory == null) {
            return defaults;
        }
        Path cfg = directory.resolve(SETTINGS_FILE);
        if (!Files.exists(cfg)) {
            return defaults;
        }
        try {
            HostSettingsFile file = Jsons.mapper().readValue(cfg.toFile(), HostSettingsFile.class);
            return fromFile(file, defaults);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to load host settings: " + cfg, e);
        }
    }

    static HostConfig fromFile(HostSettingsFile file, HostConfig defaults) {
        if (file == null) {
            return defaults;
        }
        return new HostConfig(
                sanitizeText(file.bind(), defaults.bind()),
                sanitizePort(file.port(), defaults.port()),
                sanitizeInt(file.maxBodyBytes(), defaults.maxBodyBytes(), MIN_MAX_BODY_BYTES),
                sanitizeText(file.layerName(), defaults.layerName())
        );
    }

    public HostConfig withBind(String value) {
        return new HostConfig(sanitizeText(value, bind), port, maxBodyBytes, layerName);
    }

    public HostConfig withPort(Integer value) {
        return new HostConfig(bind, sanitizePort(value, port), maxBodyBytes, layerName);
    }

    public HostConfig withLayerName(String value) {
        return new HostConfig(bind, port, maxBodyBytes, sanitizeText(value, layerName));
    }

    public String bind() {
        return bind;
    }

    public int port() {
        return port;
    }

    public int maxBodyBytes() {
        return maxBodyBytes;
    }

    public String layerName() {
        return layerName;
    }

    private static int sanitizePort(Integer raw, int fallback) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(0, Math.min(65_535, raw));
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static String sanitizeText(String raw, String fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return raw.trim();
    }

    record HostSettingsFile(String bind, Integer port, Integer maxBodyBytes, String layerName) {
    }
}
