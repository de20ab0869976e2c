package io.layermesh.error;

/**
 * Raised when a layer is opened twice, closed without being open, or closed from a fork.
 */
public class LifecycleException extends LayerMeshException {

    public LifecycleException(String message) {
        super(message);
    }

    public LifecycleException(String message, Throwable cause) {
        super(message, cause);
    }
}
