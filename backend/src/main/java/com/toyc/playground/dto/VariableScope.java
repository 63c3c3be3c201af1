package com.toyc.playground.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record VariableScope(
        int id,
        String name,
        int start,
        int end,
        Map<String, Variable> variables,
        @JsonIgnore Integer parentId,
        List<VariableScope> children
) {

    public VariableScope {
        variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        children = List.copyOf(children);
    }
}
