package com.trading.flow.io;

import com.trading.flow.engine.WorkflowResult;
import com.trading.flow.state.StateSnapshot;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Renders workflow state as JSON.
 *
 * Fields are written in name order; {@code java.time} values as ISO-8601
 * strings. A value Jackson cannot serialize is reported as
 * {@link IllegalStateException}.
 */
public final class JsonStateSerializer {
    private final ObjectMapper mapper;
    private final boolean pretty;

    public JsonStateSerializer() {
        this(true);
    }

    public JsonStateSerializer(boolean pretty) {
        this.pretty = pretty;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    public String toJson(StateSnapshot snapshot) {
        return write(snapshot.asMap());
    }

    /** Run id, graph name, node statuses and final state in one document. */
    public String toJson(WorkflowResult result) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("runId", result.runId());
        doc.put("graph", result.graphName());
        doc.put("elapsedMillis", result.elapsedMillis());
        doc.put("nodes", result.nodeStatuses());
        doc.put("state", result.finalState().asMap());
        return write(doc);
    }

    private String write(Object value) {
        try {
            return pretty ? mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value)
                    : mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("State is not serializable: " + e.getOriginalMessage(), e);
        }
    }
}
