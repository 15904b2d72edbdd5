package com.trading.flow.io;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a workflow definition.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class WorkflowDefinition {
    private WorkflowInfo workflow;

    /** Meta-information and body of the workflow. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class WorkflowInfo {
        private String name, version, entry;
        private Options options;
        private List<NodeDef> nodes;
        private List<EdgeDef> edges;
    }

    /** Engine settings carried with the workflow. Absent values keep engine defaults. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Options {
        private Integer maxConcurrency;
        private Long timeoutMillis;
        private boolean enforceFieldOwnership;
    }

    /** Definition of a single node in the workflow. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class NodeDef {
        private String name, type, description;
        private List<String> dependsOn;
        private List<String> produces;
        private Map<String, Object> properties;
    }

    /** A dependency edge; {@code to} may name the terminal marker. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class EdgeDef {
        private String from, to;
    }
}
