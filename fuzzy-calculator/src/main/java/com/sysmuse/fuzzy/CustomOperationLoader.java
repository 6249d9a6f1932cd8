package com.sysmuse.fuzzy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads custom operations from JSON. A document holds one operation object or an array of them:
 * <pre>
 * { "name": "par", "args": ["a", "b"], "expression": "a*b/(a+b)" }
 * { "symbol": "@", "priority": 2, "args": ["left", "right"], "expression": "left*right/(left+right)" }
 * </pre>
 * Operations are created in document order, so a later one may call an earlier one once
 * the earlier one is registered. Use {@link #loadAndRegister} for that.
 */
public class CustomOperationLoader {

    public static CustomOperation fromJsonObject(JsonNode root, ExpressionManager manager) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Custom operation must be a JSON object, got: " + root);
        }

        List<String> args = new ArrayList<>();
        JsonNode argsNode = root.path("args");
        if (!argsNode.isArray() || argsNode.isEmpty()) {
            throw new IllegalArgumentException("Custom operation needs a non-empty 'args' array: " + root);
        }
        for (JsonNode arg : argsNode) {
            args.add(arg.asText());
        }

        String expression = requiredText(root, "expression");

        if (root.has("symbol")) {
            String symbol = root.get("symbol").asText();
            int priority = root.path("priority").asInt(1);
            return CustomOperation.infix(symbol, priority, args, expression, manager);
        }
        return CustomOperation.function(requiredText(root, "name"), args, expression, manager);
    }

    /**
     * Creates the operations without registering them. Null or missing input gives an empty list.
     */
    public static List<CustomOperation> fromJson(JsonNode root, ExpressionManager manager) {
        return read(root, manager, false);
    }

    /**
     * Creates and registers the operations one by one, in document order.
     */
    public static List<CustomOperation> loadAndRegister(JsonNode root, ExpressionManager manager) {
        return read(root, manager, true);
    }

    public static List<CustomOperation> loadFromFile(File file, ExpressionManager manager) throws IOException {
        JsonNode root = new ObjectMapper().readTree(file);
        return loadAndRegister(root, manager);
    }

    public static List<CustomOperation> load(InputStream in, ExpressionManager manager) throws IOException {
        JsonNode root = new ObjectMapper().readTree(in);
        return loadAndRegister(root, manager);
    }

    private static List<CustomOperation> read(JsonNode root, ExpressionManager manager, boolean register) {
        List<CustomOperation> ops = new ArrayList<>();
        if (root == null || root.isNull() || root.isMissingNode()) {
            return ops;
        }
        if (root.isArray()) {
            for (JsonNode node : root) {
                ops.add(create(node, manager, register));
            }
        } else {
            ops.add(create(root, manager, register));
        }
        return ops;
    }

    private static CustomOperation create(JsonNode node, ExpressionManager manager, boolean register) {
        CustomOperation op = fromJsonObject(node, manager);
        if (register) {
            manager.register(op);
        }
        return op;
    }

    private static String requiredText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isEmpty()) {
            throw new IllegalArgumentException("Custom operation is missing '" + field + "': " + node);
        }
        return value.asText();
    }
}
