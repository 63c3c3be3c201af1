package com.toyc.playground.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ParseTreeNode(
        int id,
        NodeType type,
        String value,
        Integer line,
        Integer column,
        @JsonIgnore Integer parentId,
        List<ParseTreeNode> children
) {

    @JsonIgnore
    public boolean isLeaf() {
        return value != null;
    }

    public ParseTreeNode withChildren(List<ParseTreeNode> sealedChildren) {
        return new ParseTreeNode(id, type, value, line, column, parentId, List.copyOf(sealedChildren));
    }
}
