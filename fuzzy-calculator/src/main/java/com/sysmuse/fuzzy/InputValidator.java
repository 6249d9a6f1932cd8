package com.sysmuse.fuzzy;

import java.util.HashSet;
import java.util.Set;

import static com.sysmuse.fuzzy.OperationRegistry.isAsciiDigit;
import static com.sysmuse.fuzzy.OperationRegistry.isAsciiLetter;

/**
 * Surface checks run on the raw text before tokenization. They catch typos early
 * and point at the offending character.
 */
public class InputValidator {

    private final OperationRegistry registry;

    public InputValidator(OperationRegistry registry) {
        this.registry = registry;
    }

    public void validate(String input) {
        checkCharacters(input);
        checkBrackets(input);
        checkAdjacentPairs(input);
    }

    /**
     * Letters, digits, space, '.', ',', '_', brackets and the characters of the
     * registered infix operators.
     */
    public void checkCharacters(String input) {
        Set<Character> infixChars = new HashSet<>();
        for (String symbol : registry.getInfixSymbols()) {
            for (char c : symbol.toCharArray()) {
                infixChars.add(c);
            }
        }

        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            boolean allowed = isAsciiLetter(c) || isAsciiDigit(c) || infixChars.contains(c)
                    || c == ' ' || c == '\t' || c == '.' || c == ',' || c == '_' || c == '(' || c == ')';
            if (!allowed) {
                throw new LexerException("character '" + c + "' is not supported", i);
            }
        }
    }

    /**
     * Closing brackets may be left out at the end of the expression, but a ')' with
     * no '(' to match is an error.
     */
    public void checkBrackets(String input) {
        int level = 0;
        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            if (c == '(') {
                level++;
            } else if (c == ')') {
                level--;
                if (level < 0) {
                    throw new SyntaxException("closing bracket in excess", i);
                }
            }
        }
    }

    public void checkAdjacentPairs(String input) {
        for (int i = 0; i + 1 < input.length(); i++) {
            char a = input.charAt(i);
            char b = input.charAt(i + 1);
            if (a == '.' && b == '.') {
                throw new SyntaxException("two consecutive dots", i + 1);
            }
            if (a == ',' && b == ',') {
                throw new SyntaxException("two consecutive commas", i + 1);
            }
            if (a == ',' && b == ')') {
                throw new SyntaxException("missing argument after ','", i + 1);
            }
            if (a == '(' && b == ',') {
                throw new SyntaxException("missing argument before ','", i + 1);
            }
            if (a == '(' && b == ')') {
                throw new SyntaxException("empty brackets", i + 1);
            }
        }
    }
}
