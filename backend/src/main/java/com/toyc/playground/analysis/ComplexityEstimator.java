package com.toyc.playground.analysis;

import com.toyc.playground.dto.ComplexityClass;
import com.toyc.playground.dto.ComplexityInfo;
import com.toyc.playground.dto.ComplexityInfo.SpaceComplexity;
import com.toyc.playground.dto.ComplexityInfo.Suggestion;
import com.toyc.playground.dto.ComplexityInfo.TimeComplexity;
import com.toyc.playground.dto.ParseTreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class ComplexityEstimator {

    private static final Logger logger = LoggerFactory.getLogger(ComplexityEstimator.class);

    static final int NESTED_LOOP_THRESHOLD = 2;
    static final int BRANCH_THRESHOLD = 5;

    public ComplexityInfo estimate(ParseTree tree) {
        int maxNestingDepth = 0;
        int loopCount = 0;
        int branchCount = 0;

        for (ParseTreeNode node : tree.nodes()) {
            if (node.type().isLoop()) {
                loopCount++;
                maxNestingDepth = Math.max(maxNestingDepth, tree.loopDepth(node));
            } else if (node.type().isBranch()) {
                branchCount++;
            }
        }

        List<String> factors = new ArrayList<>();
        if (loopCount > 0) {
            factors.add("Contains " + loopCount + " loop(s)");
        }
        if (maxNestingDepth > 1) {
            factors.add("Maximum nesting depth: " + maxNestingDepth);
        }
        if (branchCount > 0) {
            factors.add("Contains " + branchCount + " conditional branch(es)");
        }

        List<String> details = new ArrayList<>();
        details.add("Stack depth: " + (maxNestingDepth + 1));
        if (loopCount > 0) {
            details.add("Loop variable(s): " + loopCount);
        }

        List<Suggestion> suggestions = new ArrayList<>();
        if (maxNestingDepth > NESTED_LOOP_THRESHOLD) {
            suggestions.add(new Suggestion(
                    "Reduce nested loops",
                    "Loops are nested " + maxNestingDepth + " levels deep. Consider a lookup structure "
                            + "such as a hash map, or precomputing values outside the inner loops."));
        }
        if (branchCount > BRANCH_THRESHOLD) {
            suggestions.add(new Suggestion(
                    "Simplify conditional logic",
                    "The code has " + branchCount + " conditional branches. Consider a lookup table "
                            + "or early returns to flatten them."));
        }

        logger.debug("Complexity: depth={}, loops={}, branches={}", maxNestingDepth, loopCount, branchCount);
        return new ComplexityInfo(
                TimeComplexity.of(timeClass(maxNestingDepth), factors),
                SpaceComplexity.of(spaceClass(maxNestingDepth), details),
                suggestions);
    }

    static ComplexityClass timeClass(int nestingDepth) {
        return switch (Math.min(nestingDepth, 3)) {
            case 0 -> ComplexityClass.CONSTANT;
            case 1 -> ComplexityClass.LINEAR;
            case 2 -> ComplexityClass.QUADRATIC;
            default -> ComplexityClass.CUBIC;
        };
    }

    static ComplexityClass spaceClass(int nestingDepth) {
        return switch (Math.min(nestingDepth, 2)) {
            case 0 -> ComplexityClass.CONSTANT;
            case 1 -> ComplexityClass.LOGARITHMIC;
            default -> ComplexityClass.LINEAR;
        };
    }
}
