package com.toyc.playground.analysis;

import com.toyc.playground.config.AnalyzerProperties;
import com.toyc.playground.dto.Diagnostic;
import com.toyc.playground.dto.NodeType;
import com.toyc.playground.dto.ParseTreeNode;
import com.toyc.playground.dto.Token;
import com.toyc.playground.dto.Token.TokenType;
import com.toyc.playground.exception.AnalysisException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class Parser {

    private static final Logger logger = LoggerFactory.getLogger(Parser.class);

    private static final List<String> NESTING_SUGGESTIONS = List.of(
            "Extract deeply nested logic into separate functions",
            "Flatten nested conditions with early returns");

    private final AnalyzerProperties properties;

    public Parser(AnalyzerProperties properties) {
        this.properties = properties;
    }

    public ParseTree parse(List<Token> tokens) throws AnalysisException {
        ParseSession session = new ParseSession(tokens, properties.maxNestingDepth());
        ParseTreeNode root = session.tree.root();

        int i = 0;
        while (i < tokens.size()) {
            if (tokens.get(i).type() != TokenType.KEYWORD) {
                i++;
                continue;
            }

            if (session.opensConstruct(i)) {
                i = session.parseConstruct(i, root);
            } else {
                i = session.parseStatement(i, root);
            }
        }

        session.tree.seal();
        logger.debug("Parsed {} tokens into {} nodes", tokens.size(), session.tree.size());
        return session.tree;
    }

    private static final class ParseSession {

        private final List<Token> tokens;
        private final int maxNestingDepth;
        private final ParseTree tree = new ParseTree();
        private int nesting;
        private boolean nestingLimitReported;

        ParseSession(List<Token> tokens, int maxNestingDepth) {
            this.tokens = tokens;
            this.maxNestingDepth = maxNestingDepth;
        }

        int parseStatement(int start, ParseTreeNode parent) {
            ParseTreeNode statement = tree.addStructural(parent, NodeType.STATEMENT, tokens.get(start));

            int i = start;
            while (i < tokens.size() && !tokens.get(i).isPunctuation(";") && !tokens.get(i).isPunctuation("{")) {
                tree.addLeaf(statement, tokens.get(i));
                i++;
            }

            if (i >= tokens.size()) {
                return i;
            }
            if (tokens.get(i).isPunctuation(";")) {
                return i + 1;
            }
            return parseBlock(i + 1, statement);
        }

        // starts just past '{', returns the index past the matching '}' or the end of input
        int parseBlock(int start, ParseTreeNode parent) {
            int depth = 1;
            int i = start;

            while (i < tokens.size()) {
                if (opensConstruct(i)) {
                    i = parseConstruct(i, parent);
                    continue;
                }

                Token token = tokens.get(i);
                if (token.isPunctuation("{")) {
                    depth++;
                } else if (token.isPunctuation("}")) {
                    depth--;
                    if (depth == 0) {
                        return i + 1;
                    }
                }
                i++;
            }
            return i;
        }

        boolean opensConstruct(int index) {
            if (headerEnd(index) < 0) {
                return false;
            }
            if (nesting < maxNestingDepth) {
                return true;
            }

            if (!nestingLimitReported) {
                Token keyword = tokens.get(index);
                logger.debug("Nesting limit {} reached at {}:{}", maxNestingDepth, keyword.line(), keyword.column());
                tree.report(Diagnostic.warning(
                        "Nesting depth exceeds maximum of " + maxNestingDepth + "; deeper constructs are not analyzed",
                        keyword.line(),
                        keyword.column(),
                        NESTING_SUGGESTIONS));
                nestingLimitReported = true;
            }
            return false;
        }

        int parseConstruct(int start, ParseTreeNode parent) {
            nesting++;
            int next = tokens.get(start).isKeyword("for")
                    ? parseFor(start, parent)
                    : parseConditional(start, parent);
            nesting--;
            return next;
        }

        private int parseFor(int start, ParseTreeNode parent) {
            int end = headerEnd(start);
            ParseTreeNode forNode = tree.addStructural(parent, NodeType.FOR_STATEMENT, tokens.get(start));

            int i = start + 2;
            ParseTreeNode init = tree.addStructural(forNode, NodeType.FOR_INIT, tokens.get(i));
            i = collectClause(i, end, init, true);

            ParseTreeNode condition = tree.addStructural(forNode, NodeType.FOR_CONDITION, tokens.get(i));
            i = collectClause(i, end, condition, true);

            ParseTreeNode increment = tree.addStructural(forNode, NodeType.FOR_INCREMENT, tokens.get(i));
            collectClause(i, end, increment, false);

            i = end + 1;
            if (i < tokens.size() && tokens.get(i).isPunctuation("{")) {
                ParseTreeNode body = tree.addStructural(forNode, NodeType.FOR_BODY, tokens.get(i));
                i = parseBlock(i + 1, body);
            }
            return i;
        }

        private int parseConditional(int start, ParseTreeNode parent) {
            boolean isLoop = tokens.get(start).isKeyword("while");
            int end = headerEnd(start);
            ParseTreeNode statement = tree.addStructural(
                    parent, isLoop ? NodeType.WHILE_STATEMENT : NodeType.IF_STATEMENT, tokens.get(start));

            ParseTreeNode condition = tree.addStructural(
                    statement, isLoop ? NodeType.WHILE_CONDITION : NodeType.IF_CONDITION, tokens.get(start + 1));
            collectClause(start + 2, end, condition, false);

            int i = end + 1;
            if (i < tokens.size() && tokens.get(i).isPunctuation("{")) {
                ParseTreeNode body = tree.addStructural(
                        statement, isLoop ? NodeType.WHILE_BODY : NodeType.IF_BODY, tokens.get(i));
                i = parseBlock(i + 1, body);
            }

            if (!isLoop && i + 1 < tokens.size() && tokens.get(i).isKeyword("else")) {
                Token next = tokens.get(i + 1);
                if (next.isPunctuation("{")) {
                    ParseTreeNode elseBody = tree.addStructural(statement, NodeType.ELSE_BODY, tokens.get(i));
                    i = parseBlock(i + 2, elseBody);
                } else if (next.isKeyword("if") && opensConstruct(i + 1)) {
                    ParseTreeNode elseBody = tree.addStructural(statement, NodeType.ELSE_BODY, tokens.get(i));
                    i = parseConstruct(i + 1, elseBody);
                }
            }
            return i;
        }

        // index of the ')' closing the header of for/if/while at index, or -1 when malformed
        private int headerEnd(int index) {
            Token keyword = tokens.get(index);
            boolean isFor = keyword.isKeyword("for");
            if (!isFor && !keyword.isKeyword("if") && !keyword.isKeyword("while")) {
                return -1;
            }
            if (index + 1 >= tokens.size() || !tokens.get(index + 1).isPunctuation("(")) {
                return -1;
            }

            int depth = 1;
            for (int i = index + 2; i < tokens.size(); i++) {
                Token token = tokens.get(i);
                if (token.isPunctuation("{") || token.isPunctuation("}")
                        || (!isFor && token.isPunctuation(";"))) {
                    return -1;
                }
                if (token.isPunctuation("(")) {
                    depth++;
                } else if (token.isPunctuation(")")) {
                    depth--;
                    if (depth == 0) {
                        return i;
                    }
                }
            }
            return -1;
        }

        private int collectClause(int start, int end, ParseTreeNode group, boolean stopAtSemicolon) {
            int i = start;
            while (i < end) {
                Token token = tokens.get(i);
                if (stopAtSemicolon && token.isPunctuation(";")) {
                    return i + 1;
                }
                tree.addLeaf(group, token);
                i++;
            }
            return i;
        }
    }
}
