package com.toyc.playground.analysis;

import com.toyc.playground.config.AnalyzerProperties;
import com.toyc.playground.dto.ComplexityClass;
import com.toyc.playground.dto.ComplexityInfo;
import com.toyc.playground.dto.ComplexityInfo.Suggestion;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ComplexityEstimatorTest {

    private final Lexer lexer = new Lexer();
    private final Parser parser = new Parser(AnalyzerProperties.defaults());
    private final ComplexityEstimator estimator = new ComplexityEstimator();

    private ComplexityInfo estimate(String source) throws Exception {
        return estimator.estimate(parser.parse(lexer.tokenize(source)));
    }

    private static String nestedLoops(int depth) {
        return "for(i=0;i<n;i++){ ".repeat(depth) + "sum++; " + "} ".repeat(depth);
    }

    @Test
    void testStraightLineCodeIsConstant() throws Exception {
        ComplexityInfo info = estimate("int x = 1; printf(\"%d\", x);");

        assertEquals(ComplexityClass.CONSTANT.ordinal(), info.time().bigO());
        assertEquals("O(1)", info.time().notation());
        assertTrue(info.time().factors().isEmpty());
        assertEquals("O(1)", info.space().notation());
        assertEquals(List.of("Stack depth: 1"), info.space().details());
        assertTrue(info.suggestions().isEmpty());
    }

    @Test
    void testSingleLoopIsLinear() throws Exception {
        ComplexityInfo info = estimate(nestedLoops(1));

        assertEquals("O(n)", info.time().notation());
        assertEquals(List.of("Contains 1 loop(s)"), info.time().factors());
        assertEquals("O(log n)", info.space().notation());
        assertEquals(List.of("Stack depth: 2", "Loop variable(s): 1"), info.space().details());
    }

    @Test
    void testDoublyNestedLoopsAreQuadratic() throws Exception {
        ComplexityInfo info = estimate(nestedLoops(2));

        assertEquals("O(n²)", info.time().notation());
        assertEquals(List.of("Contains 2 loop(s)", "Maximum nesting depth: 2"), info.time().factors());
        assertEquals("O(n)", info.space().notation());
        assertTrue(info.suggestions().isEmpty());
    }

    @Test
    void testDeepNestingIsCappedAtCubic() throws Exception {
        ComplexityInfo info = estimate(nestedLoops(4));

        assertEquals(ComplexityClass.CUBIC.ordinal(), info.time().bigO());
        assertEquals("O(n³)", info.time().notation());
        assertTrue(info.time().factors().contains("Maximum nesting depth: 4"));
        assertEquals("Stack depth: 5", info.space().details().get(0));
        assertEquals(List.of("Reduce nested loops"),
                info.suggestions().stream().map(Suggestion::title).toList());
    }

    @Test
    void testSequentialLoopsDoNotNest() throws Exception {
        ComplexityInfo info = estimate("for(;;){ } while (x) { } for(;;){ }");

        assertEquals("O(n)", info.time().notation());
        assertEquals(List.of("Contains 3 loop(s)"), info.time().factors());
    }

    @Test
    void testBranchesDoNotAddDepth() throws Exception {
        ComplexityInfo info = estimate("for(;;){ if (a) { for(;;){ } } }");

        assertEquals("O(n²)", info.time().notation());
        assertEquals(List.of("Contains 2 loop(s)", "Maximum nesting depth: 2", "Contains 1 conditional branch(es)"),
                info.time().factors());
    }

    @Test
    void testManyBranchesSuggestSimplification() throws Exception {
        ComplexityInfo fiveBranches = estimate("if (a) { } ".repeat(5));
        ComplexityInfo sixBranches = estimate("if (a) { } ".repeat(6));

        assertTrue(fiveBranches.suggestions().isEmpty());
        assertEquals(List.of("Contains 6 conditional branch(es)"), sixBranches.time().factors());
        assertEquals(List.of("Simplify conditional logic"),
                sixBranches.suggestions().stream().map(Suggestion::title).toList());
    }

    @Test
    void testOneMoreNestingLevelNeverLowersTimeClass() throws Exception {
        for (int depth = 0; depth < 5; depth++) {
            ComplexityInfo shallow = estimate(nestedLoops(depth));
            ComplexityInfo deeper = estimate(nestedLoops(depth + 1));

            assertTrue(deeper.time().bigO() >= shallow.time().bigO(), "depth " + depth);
            if (depth + 1 > 1) {
                assertTrue(deeper.time().factors().contains("Maximum nesting depth: " + (depth + 1)));
            }
        }
    }

    @Test
    void testClassMappingTables() {
        assertEquals(ComplexityClass.CONSTANT, ComplexityEstimator.timeClass(0));
        assertEquals(ComplexityClass.LINEAR, ComplexityEstimator.timeClass(1));
        assertEquals(ComplexityClass.QUADRATIC, ComplexityEstimator.timeClass(2));
        assertEquals(ComplexityClass.CUBIC, ComplexityEstimator.timeClass(7));
        assertEquals(ComplexityClass.CONSTANT, ComplexityEstimator.spaceClass(0));
        assertEquals(ComplexityClass.LOGARITHMIC, ComplexityEstimator.spaceClass(1));
        assertEquals(ComplexityClass.LINEAR, ComplexityEstimator.spaceClass(5));
    }
}
