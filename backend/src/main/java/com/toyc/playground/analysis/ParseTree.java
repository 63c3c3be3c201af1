package com.toyc.playground.analysis;

import com.toyc.playground.dto.Diagnostic;
import com.toyc.playground.dto.NodeType;
import com.toyc.playground.dto.ParseTreeNode;
import com.toyc.playground.dto.Token;
import com.toyc.playground.exception.AnalysisException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

public final class ParseTree {

    private static final int ROOT_ID = 1;

    private final List<ParseTreeNode> nodes = new ArrayList<>();
    private final List<List<ParseTreeNode>> pendingChildren = new ArrayList<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private boolean sealed;

    ParseTree() {
        createNode(NodeType.PROGRAM, null, 1, 1, null);
    }

    ParseTreeNode addStructural(ParseTreeNode parent, NodeType type, Token origin) {
        return createNode(type, null, origin.line(), origin.column(), parent);
    }

    ParseTreeNode addLeaf(ParseTreeNode parent, Token token) {
        return createNode(NodeType.of(token.type()), token.value(), token.line(), token.column(), parent);
    }

    void report(Diagnostic diagnostic) {
        if (sealed) {
            throw new IllegalStateException("Parse tree is sealed");
        }
        diagnostics.add(diagnostic);
    }

    private ParseTreeNode createNode(NodeType type, String value, int line, int column, ParseTreeNode parent) {
        if (sealed) {
            throw new IllegalStateException("Parse tree is sealed");
        }
        int id = nodes.size() + ROOT_ID;
        List<ParseTreeNode> children = new ArrayList<>();
        ParseTreeNode node = new ParseTreeNode(
                id, type, value, line, column, parent == null ? null : parent.id(), children);
        nodes.add(node);
        pendingChildren.add(children);
        if (parent != null) {
            pendingChildren.get(slot(parent.id())).add(node);
        }
        return node;
    }

    private static int slot(int id) {
        return id - ROOT_ID;
    }

    /**
     * Freezes every children list bottom-up and checks the arena invariants: ids match arena
     * slots, every non-root node is listed by exactly its recorded parent, and the root is the
     * only parentless node.
     */
    void seal() throws AnalysisException {
        if (sealed) {
            return;
        }
        int[] listedBy = new int[nodes.size()];
        Arrays.fill(listedBy, -1);

        for (int index = nodes.size() - 1; index >= 0; index--) {
            ParseTreeNode node = nodes.get(index);
            if (slot(node.id()) != index) {
                throw new AnalysisException("Parse tree node " + node.id() + " stored in slot " + index);
            }
            List<ParseTreeNode> sealedChildren = new ArrayList<>();
            for (ParseTreeNode child : pendingChildren.get(index)) {
                if (listedBy[slot(child.id())] != -1) {
                    throw new AnalysisException("Parse tree node " + child.id() + " has more than one parent");
                }
                listedBy[slot(child.id())] = node.id();
                sealedChildren.add(nodes.get(slot(child.id())));
            }
            nodes.set(index, node.withChildren(sealedChildren));
        }

        for (ParseTreeNode node : nodes) {
            int expectedParent = node.parentId() == null ? -1 : node.parentId();
            if (listedBy[slot(node.id())] != expectedParent) {
                throw new AnalysisException("Parse tree node " + node.id() + " is detached from its parent");
            }
        }
        pendingChildren.clear();
        sealed = true;
    }

    public ParseTreeNode root() {
        return nodes.get(0);
    }

    public ParseTreeNode node(int id) {
        return nodes.get(slot(id));
    }

    public int size() {
        return nodes.size();
    }

    public List<ParseTreeNode> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    public List<Diagnostic> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public Optional<ParseTreeNode> parentOf(ParseTreeNode node) {
        return node.parentId() == null ? Optional.empty() : Optional.of(node(node.parentId()));
    }

    public int loopDepth(ParseTreeNode node) {
        int depth = 0;
        Optional<ParseTreeNode> current = Optional.of(node);
        while (current.isPresent()) {
            if (current.get().type().isLoop()) {
                depth++;
            }
            current = parentOf(current.get());
        }
        return depth;
    }
}
