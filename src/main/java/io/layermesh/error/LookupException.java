package io.layermesh.error;

/**
 * Raised when an item, a parent layer or an owning layer is requested but absent.
 */
public class LookupException extends LayerMeshException {

    public LookupException(String message) {
        super(message);
    }

    public LookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
