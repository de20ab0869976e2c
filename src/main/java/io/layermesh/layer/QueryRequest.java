package io.layermesh.layer;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Request envelope: a serialized query, the state of the items both sides register, and the
 * name of the sending layer.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueryRequest(JsonNode query, ObjectNode items, String source) {
}
