package io.layermesh.error;

/**
 * Raised for malformed registrations and envelopes: a duplicate name, registering into an
 * open layer, registering an item that another layer already owns, or a combined batch
 * result that does not line up with its queries.
 */
public class ProtocolException extends LayerMeshException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
