package com.sysmuse.fuzzy;

import com.sysmuse.fuzzy.util.LoggingUtil;

import java.util.ArrayList;
import java.util.List;

import static com.sysmuse.fuzzy.TokenType.*;

/**
 * Makes implicit products explicit by inserting a multiplication token between
 * juxtaposed tokens: {@code 2x}, {@code 2pi}, {@code 2(x+1)}, {@code 2cos(t)},
 * {@code R1(R2+R3)}, {@code pi(x+1)}, {@code (a+b)(a-b)}, {@code (a+b)c}, {@code x_2 3.0}.
 * Stateless; looks at one adjacent pair at a time.
 */
public class MultiplicationExpander {

    private final OperationRegistry registry;
    private final Diagnostics diagnostics;

    public MultiplicationExpander(OperationRegistry registry, Diagnostics diagnostics) {
        this.registry = registry;
        this.diagnostics = diagnostics;
    }

    public MultiplicationExpander(OperationRegistry registry) {
        this(registry, new Diagnostics());
    }

    public List<Token> expand(List<Token> tokens) {
        if (tokens.size() < 2) {
            return new ArrayList<>(tokens);
        }

        int priority = registry.getPriority(NumericOperations.TIMES);
        List<Token> output = new ArrayList<>(tokens.size() * 2);
        for (int i = 0; i < tokens.size(); i++) {
            Token current = tokens.get(i);
            output.add(current);
            if (i + 1 < tokens.size()) {
                Token next = tokens.get(i + 1);
                if (isImplicitProduct(current.getType(), next.getType())) {
                    if (current.is(CONSTANT) && next.is(NUMBER)) {
                        diagnostics.ambiguity("constant '" + current.getText() + "' followed by number '"
                                + next.getText() + "' is read as a product", next.getPosition());
                    }
                    output.add(Token.insertedInfix(NumericOperations.TIMES, priority, next.getPosition()));
                }
            }
        }

        if (LoggingUtil.isDebugEnabled()) {
            LoggingUtil.debug("Expanded tokens: " + output);
        }
        return output;
    }

    static boolean isImplicitProduct(TokenType left, TokenType right) {
        switch (left) {
            case CONSTANT:
                return right == BRACKET_OPEN || right == NUMBER;
            case VARIABLE:
                return right == BRACKET_OPEN || right == NUMBER;
            case NUMBER:
                return right == BRACKET_OPEN || right == CONSTANT || right == VARIABLE || right == FUNCTION;
            case BRACKET_CLOSE:
                return right == BRACKET_OPEN || right == CONSTANT || right == VARIABLE
                        || right == NUMBER || right == FUNCTION;
            default:
                return false;
        }
    }
}
