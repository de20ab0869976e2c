package io.layermesh.serialization;

/**
 * @param target name of the layer the value is being written for, if any
 * @param source name of the layer the value came from, if any
 * @param filter property filter, {@code null} to write or accept every property
 * @param previousInstance instance already holding the value being read, handed to identity maps
 */
public record SerializationOptions(String target, String source, PropertyFilter filter, Object previousInstance) {
    private static final SerializationOptions NONE = new SerializationOptions(null, null, null, null);

    public static SerializationOptions none() {
        return NONE;
    }

    public static SerializationOptions toTarget(String target) {
        return new SerializationOptions(target, null, null, null);
    }

    public static SerializationOptions fromSource(String source) {
        return new SerializationOptions(null, source, null, null);
    }

    public SerializationOptions withFilter(PropertyFilter newFilter) {
        return new SerializationOptions(target, source, newFilter, previousInstance);
    }

    public SerializationOptions withPreviousInstance(Object instance) {
        return new SerializationOptions(target, source, filter, instance);
    }

    public boolean hasFilter() {
        return filter != null;
    }
}
