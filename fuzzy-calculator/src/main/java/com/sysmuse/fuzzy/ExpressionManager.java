package com.sysmuse.fuzzy;

import com.sysmuse.fuzzy.binding.BindingTable;
import com.sysmuse.fuzzy.binding.VariableBindings;
import com.sysmuse.fuzzy.util.LoggingUtil;

import java.util.*;

/**
 * Entry point of the calculator: runs the whole pipeline on a piece of text and
 * evaluates the resulting trees.
 * <pre>
 * validator -> lexer -> expander -> builder -> minus normalizer -> precedence folder
 * </pre>
 * The registry is shared by every stage. Register custom operations before parsing
 * the expressions that use them.
 */
public class ExpressionManager {

    private final OperationRegistry registry;
    private final Evaluator evaluator;
    private AmbiguityMode ambiguityMode = AmbiguityMode.WARNING;
    private boolean inputValidation = true;

    public ExpressionManager() {
        this(OperationRegistry.standard());
    }

    public ExpressionManager(OperationRegistry registry) {
        this.registry = registry;
        this.evaluator = new Evaluator(registry);
    }

    /**
     * Manager with the standard operations, set up from a configuration: logging,
     * ambiguity handling, input validation and the inline custom operations.
     */
    public static ExpressionManager fromConfig(ParserConfig config) {
        LoggingUtil.initialize(config);

        ExpressionManager manager = new ExpressionManager();
        manager.setAmbiguityMode(config.getAmbiguityMode());
        manager.setInputValidation(config.isInputValidation());

        List<CustomOperation> ops = CustomOperationLoader.loadAndRegister(config.getCustomOperations(), manager);
        LoggingUtil.debug("Expression manager ready: ambiguityMode=" + manager.getAmbiguityMode()
                + ", inputValidation=" + manager.isInputValidation()
                + ", customOperations=" + ops.size());
        return manager;
    }

    public OperationRegistry getRegistry() {
        return registry;
    }

    public AmbiguityMode getAmbiguityMode() {
        return ambiguityMode;
    }

    public void setAmbiguityMode(AmbiguityMode ambiguityMode) {
        this.ambiguityMode = ambiguityMode;
    }

    public boolean isInputValidation() {
        return inputValidation;
    }

    public void setInputValidation(boolean inputValidation) {
        this.inputValidation = inputValidation;
    }

    public void register(CustomOperation op) {
        op.register(registry);
        LoggingUtil.debug("Registered custom operation " + op);
    }

    public ExpressionTree parse(String text) {
        if (text == null || text.trim().isEmpty()) {
            throw new SyntaxException("empty expression");
        }
        if (inputValidation) {
            new InputValidator(registry).validate(text);
        }

        Diagnostics diagnostics = new Diagnostics(ambiguityMode);
        List<Token> tokens = new Lexer(registry, diagnostics).tokenize(text);
        List<Token> expanded = new MultiplicationExpander(registry, diagnostics).expand(tokens);

        Binary root = new TreeBuilder(registry).build(expanded);
        if (root.isEmpty()) {
            throw new SyntaxException("empty expression");
        }
        if (LoggingUtil.isDebugEnabled()) {
            LoggingUtil.debug("Built tree: " + root.toExpression());
        }

        new MinusNormalizer(registry, diagnostics).normalize(root);
        new PrecedenceFolder().fold(root);

        return new ExpressionTree(text, expanded, root, diagnostics.getWarnings(), evaluator);
    }

    public double evaluate(String text, VariableBindings bindings) {
        return parse(text).evaluate(bindings);
    }

    /**
     * Evaluates named expressions. An expression may use the result of another one
     * by its name; names not produced by an expression are resolved from the table.
     *
     * @return the results, in the order they were computed
     */
    public Map<String, Double> evaluateAll(Map<String, String> expressions, BindingTable table) {
        Map<String, ExpressionTree> trees = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : expressions.entrySet()) {
            trees.put(entry.getKey(), parse(entry.getValue()));
        }

        Map<String, Double> results = new LinkedHashMap<>();
        VariableBindings scope = name -> {
            Double computed = results.get(name);
            return computed != null ? computed : table.resolve(name);
        };

        for (String name : resolveExecutionOrder(trees)) {
            double value = trees.get(name).evaluate(scope);
            results.put(name, value);
            LoggingUtil.debug(String.format("%-15s : %s", name, value));
        }
        return results;
    }

    /**
     * Orders the expressions so that each comes after the ones it references.
     */
    public List<String> resolveExecutionOrder(Map<String, ExpressionTree> trees) {
        Map<String, Set<String>> deps = new HashMap<>();
        for (Map.Entry<String, ExpressionTree> entry : trees.entrySet()) {
            Set<String> refs = new LinkedHashSet<>();
            for (String variable : entry.getValue().getVariables()) {
                if (trees.containsKey(variable)) {
                    refs.add(variable);
                }
            }
            deps.put(entry.getKey(), refs);
        }

        List<String> sorted = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Set<String> visiting = new HashSet<>();
        for (String name : trees.keySet()) {
            visit(name, deps, visited, visiting, sorted);
        }
        return sorted;
    }

    private void visit(String node,
                       Map<String, Set<String>> deps,
                       Set<String> visited,
                       Set<String> visiting,
                       List<String> sorted) {
        if (visited.contains(node)) return;
        if (visiting.contains(node)) throw new SyntaxException("cyclic dependency detected at '" + node + "'");

        visiting.add(node);
        for (String dep : deps.getOrDefault(node, Set.of())) {
            visit(dep, deps, visited, visiting, sorted);
        }
        visiting.remove(node);
        visited.add(node);
        sorted.add(node);
    }
}
