package com.toyc.playground.analysis;

import com.toyc.playground.config.AnalyzerProperties;
import com.toyc.playground.dto.Diagnostic;
import com.toyc.playground.dto.NodeType;
import com.toyc.playground.dto.ParseTreeNode;
import com.toyc.playground.dto.Token;
import com.toyc.playground.dto.Token.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Component
public class DiagnosticsCollector {

    private static final Logger logger = LoggerFactory.getLogger(DiagnosticsCollector.class);

    private static final Map<String, String> CLOSER_TO_OPENER = Map.of(
            "}", "{",
            ")", "(",
            "]", "[");

    private static final List<String> INVALID_TOKEN_SUGGESTIONS = List.of(
            "Remove or replace the invalid character",
            "Check for typos around this position");

    private static final List<String> BRACKET_SUGGESTIONS = List.of(
            "Check that every opening bracket has a matching closing bracket");

    private final AnalyzerProperties properties;

    public DiagnosticsCollector(AnalyzerProperties properties) {
        this.properties = properties;
    }

    public List<Diagnostic> collect(List<Token> tokens, ParseTree tree, List<Diagnostic> scopeErrors) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        collectLexicalErrors(tokens, diagnostics);
        collectBracketErrors(tree, diagnostics);
        diagnostics.addAll(tree.diagnostics());
        diagnostics.addAll(scopeErrors);

        logger.debug("Collected {} diagnostics", diagnostics.size());
        return diagnostics;
    }

    private void collectLexicalErrors(List<Token> tokens, List<Diagnostic> diagnostics) {
        int radius = properties.contextRadius();
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.type() != TokenType.ERROR) {
                continue;
            }

            String context = tokens.subList(Math.max(0, i - radius), Math.min(tokens.size(), i + radius + 1))
                    .stream()
                    .map(Token::value)
                    .collect(Collectors.joining(" "));

            diagnostics.add(Diagnostic.error(
                    "Invalid token: " + token.value(),
                    token.line(),
                    token.column(),
                    context,
                    INVALID_TOKEN_SUGGESTIONS));
        }
    }

    private void collectBracketErrors(ParseTree tree, List<Diagnostic> diagnostics) {
        Deque<ParseTreeNode> openers = new ArrayDeque<>();
        scanBrackets(tree.root(), openers, diagnostics);

        // whatever is left was never closed, reported in opening order
        for (ParseTreeNode opener : openers) {
            diagnostics.add(Diagnostic.error(
                    "Unclosed bracket: " + opener.value(),
                    opener.line(),
                    opener.column(),
                    null,
                    BRACKET_SUGGESTIONS));
        }
    }

    private void scanBrackets(ParseTreeNode node, Deque<ParseTreeNode> openers, List<Diagnostic> diagnostics) {
        if (node.type() == NodeType.PUNCTUATION) {
            String symbol = node.value();
            if (CLOSER_TO_OPENER.containsValue(symbol)) {
                openers.addLast(node);
            } else if (CLOSER_TO_OPENER.containsKey(symbol)) {
                ParseTreeNode opener = openers.pollLast();
                if (opener == null || !opener.value().equals(CLOSER_TO_OPENER.get(symbol))) {
                    diagnostics.add(Diagnostic.error(
                            "Mismatched brackets",
                            node.line(),
                            node.column(),
                            null,
                            BRACKET_SUGGESTIONS));
                }
            }
        }

        for (ParseTreeNode child : node.children()) {
            scanBrackets(child, openers, diagnostics);
        }
    }
}
