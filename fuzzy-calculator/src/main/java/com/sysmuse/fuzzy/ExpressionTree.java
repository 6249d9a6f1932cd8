package com.sysmuse.fuzzy;

import com.sysmuse.fuzzy.binding.VariableBindings;

import java.util.*;

/**
 * A parsed, normalized and folded expression, ready to be evaluated any number of times.
 * <p>
 * The tree is not modified by evaluation, so one instance may be evaluated concurrently
 * against independent bindings.
 */
public class ExpressionTree {

    private final String source;
    private final List<Token> tokens;
    private final Binary root;
    private final List<String> warnings;
    private final Evaluator evaluator;
    private final Set<String> variables;

    ExpressionTree(String source, List<Token> tokens, Binary root, List<String> warnings, Evaluator evaluator) {
        this.source = source;
        this.tokens = List.copyOf(tokens);
        this.root = root;
        this.warnings = List.copyOf(warnings);
        this.evaluator = evaluator;
        this.variables = collectVariables(root, new LinkedHashSet<>());
    }

    public double evaluate(VariableBindings bindings) {
        return evaluator.evaluate(root, bindings);
    }

    public String getSource() {
        return source;
    }

    /**
     * Tokens after implicit multiplications were made explicit.
     */
    public List<Token> getTokens() {
        return tokens;
    }

    public Binary getRoot() {
        return root;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    /**
     * Variable names in order of first appearance in the folded tree.
     */
    public Set<String> getVariables() {
        return Collections.unmodifiableSet(variables);
    }

    private static Set<String> collectVariables(Binary binary, Set<String> found) {
        for (Node node : binary.getNodes()) {
            if (node instanceof Leaf && ((Leaf) node).isVariable()) {
                found.add(((Leaf) node).getText());
            } else if (node instanceof MacroNode) {
                for (Binary argument : ((MacroNode) node).getArguments()) {
                    collectVariables(argument, found);
                }
            }
        }
        return found;
    }

    @Override
    public String toString() {
        return root.toExpression();
    }
}
