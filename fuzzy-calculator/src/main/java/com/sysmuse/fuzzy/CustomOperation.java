package com.sysmuse.fuzzy;

import com.sysmuse.fuzzy.binding.VariableBindings;

import java.util.*;

/**
 * An operation defined by an expression over its named arguments, e.g.
 * {@code par(a, b) = a*b/(a+b)}. It can be registered as a function or, with a
 * priority, as an infix operator.
 * <p>
 * The body is parsed once, against the registry as it is when the operation is created.
 * An operation can therefore use every operation registered before it, but not itself.
 */
public class CustomOperation implements NumericOperation {

    private final String name;
    private final Integer priority;
    private final List<String> argNames;
    private final String expression;
    private final ExpressionTree body;

    private CustomOperation(String name, Integer priority, List<String> argNames, String expression,
                            ExpressionManager manager) {
        this.name = name;
        this.priority = priority;
        this.argNames = List.copyOf(argNames);
        this.expression = expression;

        checkArgNames(manager.getRegistry());
        this.body = manager.parse(expression);

        Set<String> free = new LinkedHashSet<>(body.getVariables());
        free.removeAll(this.argNames);
        if (!free.isEmpty()) {
            throw new SyntaxException("body of '" + name + "' uses undeclared variables " + free
                    + "; declared arguments are " + this.argNames);
        }
    }

    public static CustomOperation function(String name, List<String> argNames, String expression,
                                           ExpressionManager manager) {
        return new CustomOperation(name, null, argNames, expression, manager);
    }

    public static CustomOperation infix(String symbol, int priority, List<String> argNames, String expression,
                                        ExpressionManager manager) {
        if (argNames.size() != 2) {
            throw new IllegalArgumentException("Infix operator '" + symbol + "' must take exactly 2 arguments, got " + argNames);
        }
        return new CustomOperation(symbol, priority, argNames, expression, manager);
    }

    private void checkArgNames(OperationRegistry registry) {
        Lexer lexer = new Lexer(registry);
        Set<String> seen = new HashSet<>();
        for (String arg : argNames) {
            if (!lexer.isIdentifier(arg)) {
                throw new IllegalArgumentException("Invalid argument name '" + arg + "' for '" + name + "'");
            }
            if (!seen.add(arg)) {
                throw new IllegalArgumentException("Duplicate argument name '" + arg + "' for '" + name + "'");
            }
        }
    }

    @Override
    public double apply(double... args) {
        if (args.length != argNames.size()) {
            throw new ArityMismatchException(name, argNames.size(), args.length, ExpressionException.UNKNOWN_POSITION);
        }
        Map<String, Double> scope = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            scope.put(argNames.get(i), args[i]);
        }
        VariableBindings bindings = variable -> {
            Double value = scope.get(variable);
            if (value == null) {
                throw new UndeclaredVariableException(variable);
            }
            return value;
        };
        return body.evaluate(bindings);
    }

    /**
     * Adds this operation to the registry, as an infix operator when it has a priority.
     */
    public void register(OperationRegistry registry) {
        if (isInfix()) {
            registry.registerInfix(new InfixOperation(name, priority, argNames, this));
        } else {
            registry.registerFunction(new BaseOperation(name, argNames, this));
        }
    }

    public String getName() {
        return name;
    }

    public boolean isInfix() {
        return priority != null;
    }

    public int getPriority() {
        return priority == null ? 0 : priority;
    }

    public List<String> getArgNames() {
        return argNames;
    }

    public String getExpression() {
        return expression;
    }

    public ExpressionTree getBody() {
        return body;
    }

    @Override
    public String toString() {
        if (isInfix()) {
            return argNames.get(0) + " " + name + " " + argNames.get(1) + " = " + expression;
        }
        return name + "(" + String.join(", ", argNames) + ") = " + expression;
    }
}
