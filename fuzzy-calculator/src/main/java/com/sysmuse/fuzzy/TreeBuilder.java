package com.sysmuse.fuzzy;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns an expanded token list into a {@link Binary} chain.
 * <p>
 * Leaves and operators are appended as they come. A function name or an opening bracket
 * starts a {@link MacroNode}: each argument is built by a nested call that stops at a
 * comma or at the closing bracket and hands back the unconsumed tokens (the remainder).
 * Reaching the end of input closes every open scope, so trailing brackets may be omitted.
 */
public class TreeBuilder {

    private final OperationRegistry registry;

    public TreeBuilder(OperationRegistry registry) {
        this.registry = registry;
    }

    /**
     * One built scope and what is left of the input after it.
     */
    public static final class BuildResult {
        private final Binary binary;
        private final List<Token> tokens;
        private final int next;
        private final Token stop;

        BuildResult(Binary binary, List<Token> tokens, int next, Token stop) {
            this.binary = binary;
            this.tokens = tokens;
            this.next = next;
            this.stop = stop;
        }

        public Binary getBinary() {
            return binary;
        }

        /**
         * Tokens following the comma or bracket that ended the scope.
         */
        public List<Token> getRemainder() {
            return tokens.subList(next, tokens.size());
        }

        /**
         * The comma or closing bracket that ended the scope, null at end of input.
         */
        public Token getStop() {
            return stop;
        }

        boolean stoppedAt(TokenType type) {
            return stop != null && stop.is(type);
        }
    }

    /**
     * Builds the top-level chain. Commas and closing brackets are only legal inside a macro.
     */
    public Binary build(List<Token> tokens) {
        BuildResult result = buildScope(tokens, 0);
        if (result.stoppedAt(TokenType.COMMA)) {
            throw new SyntaxException("',' is only allowed between function arguments", result.getStop().getPosition());
        }
        if (result.stoppedAt(TokenType.BRACKET_CLOSE)) {
            throw new SyntaxException("unmatched ')'", result.getStop().getPosition());
        }
        return result.getBinary();
    }

    /**
     * Builds one scope starting at {@code from}, stopping at the first comma or closing
     * bracket that belongs to it, or at the end of input.
     */
    public BuildResult buildScope(List<Token> tokens, int from) {
        List<Node> nodes = new ArrayList<>();
        int i = from;

        while (i < tokens.size()) {
            Token token = tokens.get(i);
            switch (token.getType()) {
                case NUMBER:
                case CONSTANT:
                case VARIABLE:
                    requireOperatorBefore(nodes, token);
                    nodes.add(toLeaf(token));
                    i++;
                    break;

                case INFIX:
                    checkOperatorRun(nodes, token);
                    nodes.add(new Operator(token.getText(), token.getPriority(), token.getPosition()));
                    i++;
                    break;

                case FUNCTION: {
                    requireOperatorBefore(nodes, token);
                    if (i + 1 >= tokens.size() || !tokens.get(i + 1).is(TokenType.BRACKET_OPEN)) {
                        throw new SyntaxException("function '" + token.getText() + "' must be followed by '('", token.getPosition());
                    }
                    BuildResult macro = buildMacro(token.getText(), token, tokens, i + 2);
                    nodes.add(macro.getBinary().get(0));
                    i = macro.next;
                    break;
                }

                case BRACKET_OPEN: {
                    requireOperatorBefore(nodes, token);
                    BuildResult macro = buildMacro(NumericOperations.IDENTITY, token, tokens, i + 1);
                    nodes.add(macro.getBinary().get(0));
                    i = macro.next;
                    break;
                }

                case COMMA:
                    if (i == tokens.size() - 1) {
                        throw new SyntaxException("expression cannot end with a comma", token.getPosition());
                    }
                    requireOperandLast(nodes, token);
                    return new BuildResult(new Binary(nodes), tokens, i + 1, token);

                case BRACKET_CLOSE:
                    requireOperandLast(nodes, token);
                    return new BuildResult(new Binary(nodes), tokens, i + 1, token);
            }
        }

        requireOperandLast(nodes, null);
        return new BuildResult(new Binary(nodes), tokens, tokens.size(), null);
    }

    /**
     * Collects the arguments of a call whose opening bracket was already consumed.
     * The returned result holds a one-node chain with the macro.
     */
    private BuildResult buildMacro(String function, Token opener, List<Token> tokens, int from) {
        BaseOperation op = registry.getFunction(function);
        if (op == null) {
            throw new UnknownFunctionException("function", function, opener.getPosition());
        }

        List<Binary> arguments = new ArrayList<>();
        int i = from;
        Token stop;
        do {
            BuildResult argument = buildScope(tokens, i);
            if (argument.getBinary().isEmpty()) {
                int position = argument.getStop() != null ? argument.getStop().getPosition() : opener.getPosition();
                throw new SyntaxException("empty argument in call to '" + function + "'", position);
            }
            arguments.add(argument.getBinary());
            i = argument.next;
            stop = argument.getStop();
        } while (stop != null && stop.is(TokenType.COMMA));

        MacroNode macro = new MacroNode(function, op.getArity(), arguments, opener.getPosition());
        return new BuildResult(Binary.of(macro), tokens, i, stop);
    }

    private Leaf toLeaf(Token token) {
        switch (token.getType()) {
            case NUMBER:
                return Leaf.number(token.getText(), token.getPosition());
            case CONSTANT:
                return Leaf.constant(token.getText(), registry.getConstantValue(token.getText()), token.getPosition());
            default:
                return Leaf.variable(token.getText(), token.getPosition());
        }
    }

    private static void requireOperatorBefore(List<Node> nodes, Token token) {
        if (!nodes.isEmpty() && nodes.get(nodes.size() - 1).isOperand()) {
            throw new SyntaxException("missing operator before '" + token.getText() + "'", token.getPosition());
        }
    }

    /**
     * Only '-' may directly follow another operator, and never more than one of them.
     */
    private static void checkOperatorRun(List<Node> nodes, Token token) {
        if (nodes.isEmpty() || nodes.get(nodes.size() - 1).isOperand()) {
            return;
        }
        Operator previous = (Operator) nodes.get(nodes.size() - 1);
        if (!token.isInfix(NumericOperations.MINUS)) {
            throw new SyntaxException("operator '" + token.getText() + "' cannot follow operator '"
                    + previous.getSymbol() + "'", token.getPosition());
        }
        if (nodes.size() >= 2 && nodes.get(nodes.size() - 2).isOperator()) {
            throw new SyntaxException("too many consecutive operators before '" + token.getText() + "'", token.getPosition());
        }
    }

    private static void requireOperandLast(List<Node> nodes, Token stop) {
        if (!nodes.isEmpty() && nodes.get(nodes.size() - 1).isOperator()) {
            Operator dangling = (Operator) nodes.get(nodes.size() - 1);
            String where = stop == null ? "at end of expression" : "before '" + stop.getText() + "'";
            throw new SyntaxException("operator '" + dangling.getSymbol() + "' is missing its right operand " + where,
                    dangling.getPosition());
        }
    }
}
