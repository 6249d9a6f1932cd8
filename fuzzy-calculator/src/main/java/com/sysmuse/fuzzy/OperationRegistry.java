package com.sysmuse.fuzzy;

import java.util.*;

/**
 * Tables of constants, functions and infix operators shared by every stage of the pipeline.
 * <p>
 * The lexer and the builder consult it to recognise names and arities, the normalizer and
 * the folder to read operator priorities, the evaluator to apply operations. Populate it at
 * start-up and treat it as read-only afterwards: it is not synchronized.
 */
public class OperationRegistry {

    private final Map<String, Double> constants = new LinkedHashMap<>();
    private final Map<String, BaseOperation> functions = new LinkedHashMap<>();
    private final Map<String, InfixOperation> infixOps = new LinkedHashMap<>();

    /**
     * Registry pre-loaded with {@link NumericOperations}.
     */
    public static OperationRegistry standard() {
        OperationRegistry registry = new OperationRegistry();
        NumericOperations.register(registry);
        return registry;
    }

    public void registerConstant(String name, double value) {
        addConstant(name, value);
    }

    /**
     * Reserves a constant name that has no real value. It tokenizes as a constant,
     * but evaluating it fails.
     */
    public void reserveConstant(String name) {
        addConstant(name, null);
    }

    private void addConstant(String name, Double value) {
        if (!isValidConstantName(name)) {
            throw new IllegalArgumentException("Invalid constant name: '" + name + "' (letters and digits only, starting with a letter)");
        }
        ensureUnreserved(name);
        constants.put(name, value);
    }

    public void registerFunction(String name, NumericOperation op, List<String> argNames) {
        registerFunction(new BaseOperation(name, argNames, op));
    }

    public void registerFunction(BaseOperation op) {
        String name = op.getName();
        if (!isValidFunctionName(name)) {
            throw new IllegalArgumentException("Invalid function name: '" + name + "'");
        }
        if (op.getArity() < 1) {
            throw new IllegalArgumentException("Function '" + name + "' must take at least one argument");
        }
        ensureUnreserved(name);
        functions.put(name, op);
    }

    public void registerInfix(String symbol, int priority, NumericOperation op) {
        registerInfix(new InfixOperation(symbol, priority, op));
    }

    public void registerInfix(InfixOperation op) {
        String symbol = op.getSymbol();
        if (!isValidInfixSymbol(symbol)) {
            throw new IllegalArgumentException("Invalid infix symbol: '" + symbol
                    + "' (letters, digits, '.', ',', '_', brackets and spaces are not allowed)");
        }
        if (infixOps.containsKey(symbol)) {
            throw new IllegalArgumentException("Infix operator already registered: '" + symbol + "'");
        }
        infixOps.put(symbol, op);
    }

    public boolean isConstant(String name) {
        return constants.containsKey(name);
    }

    /**
     * Value of a constant, or null when the name is reserved without a value.
     */
    public Double getConstantValue(String name) {
        return constants.get(name);
    }

    public boolean isFunction(String name) {
        return functions.containsKey(name);
    }

    public BaseOperation getFunction(String name) {
        return functions.get(name);
    }

    public boolean isInfix(String symbol) {
        return infixOps.containsKey(symbol);
    }

    public InfixOperation getInfix(String symbol) {
        return infixOps.get(symbol);
    }

    public int getPriority(String symbol) {
        InfixOperation op = infixOps.get(symbol);
        if (op == null) {
            throw new UnknownFunctionException("infix operator", symbol, ExpressionException.UNKNOWN_POSITION);
        }
        return op.getPriority();
    }

    /**
     * Constant and function names: these can never be read as variables.
     */
    public boolean isReserved(String name) {
        return constants.containsKey(name) || functions.containsKey(name);
    }

    public Set<String> getConstantNames() {
        return Collections.unmodifiableSet(constants.keySet());
    }

    public Set<String> getFunctionNames() {
        return Collections.unmodifiableSet(functions.keySet());
    }

    public Set<String> getInfixSymbols() {
        return Collections.unmodifiableSet(infixOps.keySet());
    }

    private void ensureUnreserved(String name) {
        if (isReserved(name)) {
            throw new IllegalArgumentException("Name already registered: '" + name + "'");
        }
    }

    static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }

    static boolean isValidConstantName(String name) {
        if (name == null || name.isEmpty() || !isAsciiLetter(name.charAt(0))) {
            return false;
        }
        for (char c : name.toCharArray()) {
            if (!isAsciiLetter(c) && !isAsciiDigit(c)) return false;
        }
        return true;
    }

    static boolean isValidFunctionName(String name) {
        if (name == null || name.isEmpty() || !isAsciiLetter(name.charAt(0))) {
            return false;
        }
        for (char c : name.toCharArray()) {
            if (!isAsciiLetter(c) && !isAsciiDigit(c) && c != '_') return false;
        }
        return true;
    }

    static boolean isValidInfixSymbol(String symbol) {
        if (symbol == null || symbol.isEmpty()) {
            return false;
        }
        for (char c : symbol.toCharArray()) {
            if (isAsciiLetter(c) || isAsciiDigit(c) || Character.isLetterOrDigit(c) || Character.isWhitespace(c)) {
                return false;
            }
            if (c == '.' || c == ',' || c == '_' || c == '(' || c == ')') {
                return false;
            }
        }
        return true;
    }
}
