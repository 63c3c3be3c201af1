package com.toyc.playground.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ControlFlowNode(
        int id,
        NodeType type,
        String condition,
        List<FlowCondition> conditions,
        List<ControlFlowNode> next
) {

    public record FlowCondition(
            @JsonProperty("type") Role role,
            String expression) {
    }

    public enum Role {
        LOOP,
        BRANCH
    }

    public ControlFlowNode {
        conditions = List.copyOf(conditions);
        next = List.copyOf(next);
    }
}
