package io.layermesh.layer;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Response envelope. {@code result} is absent when the query produced nothing.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueryResponse(JsonNode result, ObjectNode items) {
}
