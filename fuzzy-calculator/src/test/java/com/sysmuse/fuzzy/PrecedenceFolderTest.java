package com.sysmuse.fuzzy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PrecedenceFolderTest {

    private OperationRegistry registry;
    private Lexer lexer;
    private MultiplicationExpander expander;
    private TreeBuilder builder;
    private MinusNormalizer normalizer;
    private PrecedenceFolder folder;

    @BeforeEach
    public void setup() {
        registry = OperationRegistry.standard();
        Diagnostics diagnostics = new Diagnostics(AmbiguityMode.ACCEPT);
        lexer = new Lexer(registry, diagnostics);
        expander = new MultiplicationExpander(registry, diagnostics);
        builder = new TreeBuilder(registry);
        normalizer = new MinusNormalizer(registry, diagnostics);
        folder = new PrecedenceFolder();
    }

    private Binary fold(String input) {
        Binary binary = builder.build(expander.expand(lexer.tokenize(input)));
        normalizer.normalize(binary);
        folder.fold(binary);
        return binary;
    }

    private static void assertSinglePriority(Binary binary) {
        int[] range = PrecedenceFolder.priorityRange(binary.getNodes());
        assertEquals(range[0], range[1], binary.toExpression());
        for (Node node : binary.getNodes()) {
            if (node instanceof MacroNode) {
                for (Binary argument : ((MacroNode) node).getArguments()) {
                    assertSinglePriority(argument);
                }
            }
        }
    }

    @Test
    public void testGroupsByPriority() {
        assertEquals("(a*b)+(c/(d^e))+f", fold("a*b+c/d^e+f").toExpression());
    }

    @Test
    public void testRunsAreGroupedAsAWhole() {
        Binary binary = fold("1+a*b*c-d");
        assertEquals("1+(a*b*c)-d", binary.toExpression());
        MacroNode group = (MacroNode) binary.get(2);
        assertEquals(5, group.getArguments().get(0).size());
    }

    @Test
    public void testSinglePriorityIsUnchanged() {
        assertEquals("a+b-c", fold("a+b-c").toExpression());
        assertEquals("x", fold("x").toExpression());
    }

    @Test
    public void testFoldsInsideMacros() {
        assertEquals("cos((pi*t)-(1//R2))", fold("cos(pi*t-1//R2)").toExpression());
        assertEquals("0-(2*x*cos((pi*t)-(1//R2)))", fold("-2x*cos(pi*t-1//R2)").toExpression());
    }

    @Test
    public void testConvergesToOnePriority() {
        String[] inputs = {
                "a*b+c/d^e+f",
                "1+2*3^4-5//6^7*8",
                "-2x*cos(3.1415t-1.)",
                "Q(a+b*c^d, 2)^2+1",
                "2^-x*3+4"
        };
        for (String input : inputs) {
            Binary binary = fold(input);
            assertTrue(binary.isAlternatingDeep(), input);
            assertSinglePriority(binary);
        }
    }

    @Test
    public void testPriorityRange() {
        assertArrayEquals(new int[]{0, 0}, PrecedenceFolder.priorityRange(List.of(Leaf.number("1", 0))));
        List<Node> nodes = List.of(Leaf.number("1", 0), new Operator("+", 1, 1), Leaf.number("2", 2),
                new Operator("^", 3, 3), Leaf.number("3", 4));
        assertArrayEquals(new int[]{1, 3}, PrecedenceFolder.priorityRange(nodes));
    }

    @Test
    public void testGroupTopPriority() {
        List<Node> nodes = List.of(Leaf.variable("a", 0), new Operator("+", 1, 1), Leaf.variable("b", 2),
                new Operator("*", 2, 3), Leaf.variable("c", 4));
        List<Node> grouped = PrecedenceFolder.groupTopPriority(nodes, 2);
        assertEquals(3, grouped.size());
        assertEquals("a+(b*c)", new Binary(grouped).toExpression());
    }

    @Test
    public void testEvenLengthIsADefect() {
        Binary binary = new Binary(List.of(Leaf.number("1", 0), new Operator("+", 1, 1)));
        assertThrows(MalformedTreeException.class, () -> folder.fold(binary));
    }

    @Test
    public void testNonAlternatingIsADefect() {
        Binary binary = new Binary(List.of(Leaf.number("1", 0), Leaf.number("2", 1), Leaf.number("3", 2)));
        assertThrows(MalformedTreeException.class, () -> folder.fold(binary));
    }
}
