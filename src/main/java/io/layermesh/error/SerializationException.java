package io.layermesh.error;

/**
 * Raised for values that cannot cross a layer boundary: {@code null}, an unknown {@code
 * _type}, or an item that is not serializable.
 */
public class SerializationException extends LayerMeshException {

    public SerializationException(String message) {
        super(message);
    }

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
