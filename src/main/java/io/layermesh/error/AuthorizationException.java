package io.layermesh.error;

/**
 * Raised when an operation is not permitted. The message never tells a forbidden property
 * apart from a missing one.
 */
public class AuthorizationException extends LayerMeshException {

    public AuthorizationException(String message) {
        super(message);
    }

    public AuthorizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
