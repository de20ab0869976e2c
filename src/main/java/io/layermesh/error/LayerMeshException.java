package io.layermesh.error;

/**
 * Base class for failures raised by layers, registerable items and the serializer.
 *
 * <p>Failures are raised where they are detected and are never retried by the core.
 * Subclasses name the category; callers that only care about "something went wrong
 * while routing a query" can catch this type.
 */
public abstract class LayerMeshException extends RuntimeException {

    protected LayerMeshException(String message) {
        super(message);
    }

    protected LayerMeshException(String message, Throwable cause) {
        super(message, cause);
    }
}
