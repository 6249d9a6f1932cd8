package com.sysmuse.fuzzy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    private OperationRegistry registry;
    private Diagnostics diagnostics;
    private Lexer lexer;

    @BeforeEach
    public void setup() {
        registry = OperationRegistry.standard();
        diagnostics = new Diagnostics(AmbiguityMode.ACCEPT);
        lexer = new Lexer(registry, diagnostics);
    }

    @Test
    public void testSimpleExpression() {
        List<Token> tokens = lexer.tokenize("2x*cos(3.1415t-1.)");
        assertEquals(List.of(
                Token.number("2", 0),
                Token.variable("x", 1),
                Token.infix("*", 2, 2),
                Token.function("cos", 3),
                Token.open(6),
                Token.number("3.1415", 7),
                Token.variable("t", 13),
                Token.infix("-", 1, 14),
                Token.number("1.", 15),
                Token.close(17)), tokens);
        assertFalse(diagnostics.hasWarnings());
    }

    @Test
    public void testPositions() {
        List<Token> tokens = lexer.tokenize("a +  sin(b)");
        assertEquals(0, tokens.get(0).getPosition());
        assertEquals(2, tokens.get(1).getPosition());
        assertEquals(5, tokens.get(2).getPosition());
        assertEquals(8, tokens.get(3).getPosition());
        assertEquals(9, tokens.get(4).getPosition());
    }

    @Test
    public void testConstantExtendedByLetterIsVariable() {
        for (String name : registry.getConstantNames()) {
            List<Token> tokens = lexer.tokenize(name + "xel");
            assertEquals(List.of(Token.variable(name + "xel", 0)), tokens, name);
        }
        assertEquals(List.of(Token.variable("pixel", 0)), lexer.tokenize("pixel"));
        assertEquals(List.of(Token.variable("pipi", 0)), lexer.tokenize("pipi"));
        assertEquals(List.of(Token.variable("ipi", 0)), lexer.tokenize("ipi"));
    }

    @Test
    public void testFunctionExtendedByLetterIsVariable() {
        for (String name : registry.getFunctionNames()) {
            List<Token> tokens = lexer.tokenize(name + "xel");
            assertEquals(1, tokens.size(), name);
            assertEquals(TokenType.VARIABLE, tokens.get(0).getType(), name);
        }
    }

    @Test
    public void testUnderscoreRejectsConstant() {
        assertEquals(List.of(Token.variable("pi_5", 0)), lexer.tokenize("pi_5"));
    }

    @Test
    public void testConstantFollowedByDigit() {
        assertEquals(List.of(Token.constant("pi", 0), Token.number("4", 2)), lexer.tokenize("pi4"));
    }

    @Test
    public void testLongestConstant() {
        assertEquals(List.of(Token.constant("inf", 0)), lexer.tokenize("inf"));
        assertEquals(List.of(Token.constant("i", 0)), lexer.tokenize("i"));
    }

    @Test
    public void testVariableNames() {
        assertEquals(List.of(Token.variable("x2", 0)), lexer.tokenize("x2"));
        assertEquals(List.of(Token.variable("x_2", 0)), lexer.tokenize("x_2"));
        assertEquals(List.of(Token.variable("_tmp1", 0)), lexer.tokenize("_tmp1"));
        assertEquals(List.of(Token.variable("R2", 0)), lexer.tokenize("R2"));
    }

    @Test
    public void testVariableFollowedByFractionIsAmbiguous() {
        List<Token> tokens = lexer.tokenize("x2.0");
        assertEquals(List.of(Token.variable("x", 0), Token.number("2.0", 1)), tokens);
        assertEquals(1, diagnostics.getWarnings().size());
    }

    @Test
    public void testNumberStartingWithDot() {
        assertEquals(List.of(Token.number(".5", 0)), lexer.tokenize(".5"));
    }

    @Test
    public void testLongestInfix() {
        List<Token> tokens = lexer.tokenize("7//2");
        assertEquals(List.of(Token.number("7", 0), Token.infix("//", 2, 1), Token.number("2", 3)), tokens);
    }

    @Test
    public void testDetachedFunctionNameIsVariable() {
        List<Token> tokens = lexer.tokenize("tan (x-pi)");
        assertEquals(Token.variable("tan", 0), tokens.get(0));
        assertEquals(Token.open(4), tokens.get(1));
        assertTrue(diagnostics.hasWarnings());
    }

    @Test
    public void testDetachedFunctionNameStrictMode() {
        Lexer strict = new Lexer(registry, new Diagnostics(AmbiguityMode.EXCEPTION));
        assertThrows(AmbiguityException.class, () -> strict.tokenize("tan (x)"));
    }

    @Test
    public void testUnexpectedCharacter() {
        LexerException e = assertThrows(LexerException.class, () -> lexer.tokenize("2 + $x"));
        assertEquals(4, e.getPosition());
    }

    @Test
    public void testCaseSensitive() {
        assertEquals(List.of(Token.variable("PI", 0)), lexer.tokenize("PI"));
        assertEquals(TokenType.VARIABLE, lexer.tokenize("Cos(x)").get(0).getType());
    }

    @Test
    public void testRoundTripTokenText() {
        String[] inputs = {
                "2x*cos(3.1415t-1.)",
                "-2x*cos(pi*t-1//R2)",
                "Q( x , 0.5 ) + logN(8,2)",
                "(a+b)(a-b) ^ -c",
                "x_2 3.0 pi4 tan (y)"
        };
        for (String input : inputs) {
            StringBuilder sb = new StringBuilder();
            for (Token token : lexer.tokenize(input)) {
                if (!token.isInserted()) {
                    sb.append(token.getText());
                }
            }
            assertEquals(input.replaceAll("\\s", ""), sb.toString(), input);
        }
    }

    @Test
    public void testConsumeFunction() {
        assertEquals(new Lexer.Match("cos", "x)", false), lexer.consumeFunction("cos(x)"));
        assertEquals(new Lexer.Match("logN", "8,2)", false), lexer.consumeFunction("logN(8,2)"));

        Lexer.Match detached = lexer.consumeFunction("tan (x-pi)");
        assertTrue(detached.isEmpty());
        assertEquals("tan (x-pi)", detached.getTail());
    }

    @Test
    public void testConsumeConstant() {
        assertEquals(new Lexer.Match("pi", "*2", false), lexer.consumeConstant("pi*2"));
        assertTrue(lexer.consumeConstant("pixel").isEmpty());
        assertTrue(lexer.consumeConstant("pi_1").isEmpty());
    }

    @Test
    public void testConsumeNumber() {
        assertEquals(new Lexer.Match("4.2", ".", false), lexer.consumeNumber("4.2."));
        assertEquals(new Lexer.Match("12", "x", false), lexer.consumeNumber("12x"));
        assertTrue(lexer.consumeNumber("-1").isEmpty());
    }

    @Test
    public void testConsumeVariable() {
        assertEquals(new Lexer.Match("abc", "+1", false), lexer.consumeVariable("abc+1"));
        Lexer.Match ambiguous = lexer.consumeVariable("x2.5");
        assertEquals(new Lexer.Match("x", "2.5", true), ambiguous);
        assertTrue(ambiguous.isAmbiguous());
        assertTrue(lexer.consumeVariable("cos").isEmpty());
        assertTrue(lexer.consumeVariable("2x").isEmpty());
    }

    @Test
    public void testConsumeSpaceAndInfix() {
        assertEquals(new Lexer.Match("  ", "x", false), lexer.consumeSpace("  x"));
        assertEquals(new Lexer.Match("//", "3", false), lexer.consumeInfix("//3"));
        assertTrue(lexer.consumeInfix("x").isEmpty());
    }

    @Test
    public void testIsNumber() {
        assertFalse(Lexer.isNumber("4.2."));
        assertTrue(Lexer.isNumber(".0"));
        assertFalse(Lexer.isNumber("-1"));
        assertTrue(Lexer.isNumber("12."));
        assertTrue(Lexer.isNumber("007"));
        assertFalse(Lexer.isNumber(""));
        assertFalse(Lexer.isNumber("."));
        assertFalse(Lexer.isNumber("1e3"));
    }

    @Test
    public void testIsIdentifier() {
        assertTrue(lexer.isIdentifier("x"));
        assertTrue(lexer.isIdentifier("_r2"));
        assertTrue(lexer.isIdentifier("pixel"));
        assertFalse(lexer.isIdentifier("pi"));
        assertFalse(lexer.isIdentifier("cos"));
        assertFalse(lexer.isIdentifier("2x"));
        assertFalse(lexer.isIdentifier("a-b"));
        assertFalse(lexer.isIdentifier(""));
    }
}
