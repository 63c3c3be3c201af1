package com.toyc.playground.analysis;

import com.toyc.playground.dto.Diagnostic;
import com.toyc.playground.dto.NodeType;
import com.toyc.playground.dto.ParseTreeNode;
import com.toyc.playground.dto.Variable;
import com.toyc.playground.dto.VariableScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
public class ScopeAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(ScopeAnalyzer.class);

    private static final Set<String> DECLARABLE_TYPES = Set.of("int", "char", "float", "double");

    public record ScopeAnalysis(VariableScope global, List<Diagnostic> errors) {

        public ScopeAnalysis {
            errors = List.copyOf(errors);
        }
    }

    private static final class ScopeFrame {
        private final int id;
        private final String name;
        private final int startLine;
        private int endLine;
        private final ScopeFrame parent;
        private final Map<String, Variable> variables = new LinkedHashMap<>();
        private final List<ScopeFrame> children = new ArrayList<>();

        ScopeFrame(int id, String name, int startLine, ScopeFrame parent) {
            this.id = id;
            this.name = name;
            this.startLine = startLine;
            this.endLine = startLine;
            this.parent = parent;
        }

        void markUsed(String variableName) {
            for (ScopeFrame frame = this; frame != null; frame = frame.parent) {
                Variable variable = frame.variables.get(variableName);
                if (variable != null) {
                    frame.variables.put(variableName, variable.markUsed());
                    return;
                }
            }
        }

        void extendTo(int line) {
            for (ScopeFrame frame = this; frame != null; frame = frame.parent) {
                frame.endLine = Math.max(frame.endLine, line);
            }
        }

        VariableScope toScope() {
            List<VariableScope> childScopes = children.stream().map(ScopeFrame::toScope).toList();
            return new VariableScope(id, name, startLine, endLine, variables,
                    parent == null ? null : parent.id, childScopes);
        }
    }

    public ScopeAnalysis analyze(ParseTree tree) {
        List<ScopeFrame> frames = new ArrayList<>();
        ScopeFrame global = new ScopeFrame(0, "global", 1, null);
        frames.add(global);

        walk(tree.root(), global, frames);

        logger.debug("Built {} scopes", frames.size());
        return new ScopeAnalysis(global.toScope(), List.of());
    }

    private void walk(ParseTreeNode node, ScopeFrame scope, List<ScopeFrame> frames) {
        if (node.line() != null) {
            scope.extendTo(node.line());
        }

        boolean declaration = (node.type() == NodeType.STATEMENT || node.type() == NodeType.FOR_INIT)
                && recordDeclaration(node, scope);

        if (node.type() == NodeType.IDENTIFIER) {
            scope.markUsed(node.value());
            return;
        }

        ScopeFrame active = scope;
        if (node.type().isLoop() || node.type().isBranch()) {
            active = new ScopeFrame(frames.size(), scopeName(node), node.line(), scope);
            scope.children.add(active);
            frames.add(active);
        }

        List<ParseTreeNode> children = node.children();
        for (int i = 0; i < children.size(); i++) {
            // the declared name is a definition, not a use
            if (declaration && i == 1) {
                continue;
            }
            walk(children.get(i), active, frames);
        }
    }

    private boolean recordDeclaration(ParseTreeNode statement, ScopeFrame scope) {
        List<ParseTreeNode> children = statement.children();
        if (children.size() < 2) {
            return false;
        }
        ParseTreeNode typeNode = children.get(0);
        ParseTreeNode nameNode = children.get(1);
        if (typeNode.type() != NodeType.KEYWORD || !DECLARABLE_TYPES.contains(typeNode.value())
                || nameNode.type() != NodeType.IDENTIFIER) {
            return false;
        }

        // more than "<type> <name> =" means an initializer follows
        boolean initialized = children.size() > 3;
        scope.variables.put(nameNode.value(),
                new Variable(nameNode.value(), typeNode.value(), nameNode.line(), initialized, false));
        scope.extendTo(nameNode.line());
        return true;
    }

    private String scopeName(ParseTreeNode node) {
        String construct = switch (node.type()) {
            case FOR_STATEMENT -> "for";
            case WHILE_STATEMENT -> "while";
            default -> "if";
        };
        return construct + "@" + node.line();
    }
}
