package com.toyc.playground.analysis;

import com.toyc.playground.config.AnalyzerProperties;
import com.toyc.playground.dto.ControlFlowNode;
import com.toyc.playground.dto.ControlFlowNode.FlowCondition;
import com.toyc.playground.dto.ControlFlowNode.Role;
import com.toyc.playground.dto.NodeType;
import com.toyc.playground.dto.ParseTreeNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ControlFlowBuilderTest {

    private final Lexer lexer = new Lexer();
    private final Parser parser = new Parser(AnalyzerProperties.defaults());
    private final ControlFlowBuilder builder = new ControlFlowBuilder();

    private ParseTree parse(String source) throws Exception {
        return parser.parse(lexer.tokenize(source));
    }

    private static void assertMirrors(ParseTreeNode node, ControlFlowNode flow) {
        assertEquals(node.id(), flow.id());
        assertEquals(node.type(), flow.type());
        assertEquals(node.children().size(), flow.next().size());
        for (int i = 0; i < node.children().size(); i++) {
            assertMirrors(node.children().get(i), flow.next().get(i));
        }
    }

    @Test
    void testFlowMirrorsParseTree() throws Exception {
        ParseTree tree = parse("int x; for(int i=0;i<10;i++){ if (x > i) { while (x) { } } }");

        assertMirrors(tree.root(), builder.build(tree));
    }

    @Test
    void testForLoopCarriesLoopCondition() throws Exception {
        ControlFlowNode root = builder.build(parse("for(int i=0;i<10;i++){ }"));
        ControlFlowNode forNode = root.next().get(0);

        assertEquals(NodeType.FOR_STATEMENT, forNode.type());
        assertEquals(List.of(new FlowCondition(Role.LOOP, "i < 10")), forNode.conditions());
        assertEquals("i < 10", forNode.condition());
    }

    @Test
    void testBranchAndWhileConditions() throws Exception {
        ControlFlowNode root = builder.build(parse("if (a >= b && c) { } while (n != 0) { }"));

        assertEquals(List.of(new FlowCondition(Role.BRANCH, "a >= b && c")), root.next().get(0).conditions());
        assertEquals(List.of(new FlowCondition(Role.LOOP, "n != 0")), root.next().get(1).conditions());
    }

    @Test
    void testEmptyForConditionStillRecorded() throws Exception {
        ControlFlowNode forNode = builder.build(parse("for(;;){ }")).next().get(0);

        assertEquals(List.of(new FlowCondition(Role.LOOP, "")), forNode.conditions());
    }

    @Test
    void testOtherNodesHaveNoConditions() throws Exception {
        ControlFlowNode root = builder.build(parse("int x = 1; for(;;){ }"));

        assertTrue(root.conditions().isEmpty());
        assertNull(root.condition());
        ControlFlowNode statement = root.next().get(0);
        assertTrue(statement.conditions().isEmpty());
        assertTrue(statement.next().stream().allMatch(leaf -> leaf.conditions().isEmpty()));
    }
}
