package io.layermesh.serialization;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Built-in typed scalar, written as {@code {"_type": <typeName>, "_value": ...}}.
 */
public interface ScalarCodec<T> {

    String typeName();

    Class<T> javaType();

    ObjectNode encode(T value);

    T decode(ObjectNode object);
}
