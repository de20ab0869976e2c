package io.layermesh.exposure;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Copy-on-write table of exposed properties.
 *
 * <p>A derived table reads through to its base until its first write, at which point it copies
 * the base's current entries and stops following it. Writes never reach the base, so two tables
 * derived from the same base never see each other's additions.
 */
public final class ExposureTable {
    private final ExposureTable base;
    private Map<String, ExposedProperty> own;

    public ExposureTable() {
        this(null);
    }

    private ExposureTable(ExposureTable base) {
        this.base = base;
    }

    public ExposureTable derive() {
        return new ExposureTable(this);
    }

    public void put(ExposedProperty property) {
        if (own == null) {
            own = new LinkedHashMap<>(base == null ? Map.of() : base.asMap());
        }
        own.put(property.name(), property);
    }

    public Optional<ExposedProperty> find(String name) {
        return Optional.ofNullable(asMap().get(name));
    }

    public Map<String, ExposedProperty> asMap() {
        if (own != null) {
            return Collections.unmodifiableMap(own);
        }
        return base == null ? Map.of() : base.asMap();
    }

    public boolean hasOwnEntries() {
        return own != null;
    }
}
