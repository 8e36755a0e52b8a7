package io.macroq.task;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskEnvelope(
        String schema,
        String type,
        long index,
        String status,
        double priority,
        JsonNode parameters,
        JsonNode input,
        JsonNode result
) {
}
