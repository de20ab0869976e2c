package io.layermesh.serialization;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.concurrent.CompletionStage;

/**
 * A value that writes its own typed envelope ({@code {"_type": ..., ...}}) and knows how to be
 * rebuilt from one.
 */
public interface WireSerializable {

    CompletionStage<ObjectNode> serialize(ValueSerializer serializer, SerializationOptions options);

    /**
     * Resolves a typed object whose {@code _type} names this item into a live value.
     */
    CompletionStage<Object> deserialize(ObjectNode object, ValueSerializer serializer, SerializationOptions options);

    /**
     * Applies serialized state to this item in place (item synchronization between layers).
     */
    CompletionStage<Void> applyState(ObjectNode object, ValueSerializer serializer, SerializationOptions options);
}
