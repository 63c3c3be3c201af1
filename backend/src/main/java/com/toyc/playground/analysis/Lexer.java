package com.toyc.playground.analysis;

import com.toyc.playground.dto.Token;
import com.toyc.playground.dto.Token.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class Lexer {

    private static final Logger logger = LoggerFactory.getLogger(Lexer.class);

    private record LexicalRule(Pattern pattern, TokenType emits) {

        boolean skipped() {
            return emits == null;
        }
    }

    private static final List<LexicalRule> RULES = List.of(
            new LexicalRule(Pattern.compile("//[^\\n]*|/\\*[\\s\\S]*?\\*/"), null),
            new LexicalRule(Pattern.compile("\\b(?:int|char|float|double|void|if|else|while|for|return|printf)\\b"),
                    TokenType.KEYWORD),
            new LexicalRule(Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*"), TokenType.IDENTIFIER),
            new LexicalRule(Pattern.compile("\"[^\"]*\""), TokenType.STRING),
            new LexicalRule(Pattern.compile("\\b\\d+(?:\\.\\d+)?(?:e[+-]?\\d+)?\\b"), TokenType.NUMBER),
            new LexicalRule(Pattern.compile("&&|\\|\\||\\+\\+|--|[+\\-*/%=<>!&|^]=?"), TokenType.OPERATOR),
            new LexicalRule(Pattern.compile("[;,(){}\\[\\].]"), TokenType.PUNCTUATION),
            new LexicalRule(Pattern.compile("\\s+"), null));

    public List<Token> tokenize(String source) {
        List<Token> tokens = new ArrayList<>();
        int position = 0;
        int line = 1;
        int column = 1;

        while (position < source.length()) {
            LexicalRule bestRule = null;
            int bestEnd = position;

            for (LexicalRule rule : RULES) {
                Matcher matcher = rule.pattern().matcher(source);
                matcher.region(position, source.length());
                if (matcher.lookingAt() && matcher.end() > bestEnd) {
                    bestRule = rule;
                    bestEnd = matcher.end();
                }
            }

            if (bestRule == null) {
                String character = source.substring(position, position + 1);
                logger.debug("Unexpected character '{}' at {}:{}", character, line, column);
                tokens.add(new Token(TokenType.ERROR, character, line, column));
                column++;
                position++;
                continue;
            }

            String text = source.substring(position, bestEnd);
            if (!bestRule.skipped()) {
                tokens.add(new Token(bestRule.emits(), text, line, column));
            }

            for (int i = 0; i < text.length(); i++) {
                if (text.charAt(i) == '\n') {
                    line++;
                    column = 1;
                } else {
                    column++;
                }
            }
            position = bestEnd;
        }

        logger.debug("Tokenized {} characters into {} tokens", source.length(), tokens.size());
        return tokens;
    }
}
