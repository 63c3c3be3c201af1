package com.toyc.playground.analysis;

import com.toyc.playground.dto.ControlFlowNode;
import com.toyc.playground.dto.ControlFlowNode.FlowCondition;
import com.toyc.playground.dto.ControlFlowNode.Role;
import com.toyc.playground.dto.NodeType;
import com.toyc.playground.dto.ParseTreeNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Component
public class ControlFlowBuilder {

    public ControlFlowNode build(ParseTree tree) {
        return buildNode(tree.root());
    }

    private ControlFlowNode buildNode(ParseTreeNode node) {
        List<FlowCondition> conditions = new ArrayList<>();
        NodeType conditionType = node.type().conditionType();
        if (conditionType != null) {
            Role role = node.type().isLoop() ? Role.LOOP : Role.BRANCH;
            node.children().stream()
                    .filter(child -> child.type() == conditionType)
                    .findFirst()
                    .ifPresent(condition -> conditions.add(new FlowCondition(role, expressionOf(condition))));
        }

        List<ControlFlowNode> next = new ArrayList<>();
        for (ParseTreeNode child : node.children()) {
            next.add(buildNode(child));
        }

        String condition = conditions.isEmpty() ? null : conditions.get(0).expression();
        return new ControlFlowNode(node.id(), node.type(), condition, conditions, next);
    }

    private String expressionOf(ParseTreeNode condition) {
        return condition.children().stream()
                .map(ParseTreeNode::value)
                .collect(Collectors.joining(" "));
    }
}
