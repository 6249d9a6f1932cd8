package com.sysmuse.fuzzy.binding;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.Iterator;
import java.util.Map;

/**
 * Reads variable bindings from a JSON object:
 * <pre>
 * {
 *   "x": 1,
 *   "R2": { "value": 10, "prefix": "k", "tolerance": 0.05 },
 *   "C1": { "value": 100, "prefix": "n", "tolerance": 0.1, "distribution": "gaussian" }
 * }
 * </pre>
 * A tolerance without a distribution is uniform.
 */
public class BindingLoader {

    public static final String UNIFORM = "uniform";
    public static final String GAUSSIAN = "gaussian";

    public static BindingTable load(File file, BindingTable table) throws IOException {
        return fromJson(new ObjectMapper().readTree(file), table);
    }

    public static BindingTable load(InputStream in, BindingTable table) throws IOException {
        return fromJson(new ObjectMapper().readTree(in), table);
    }

    public static BindingTable fromJson(JsonNode root, BindingTable table) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Bindings must be a JSON object, got: " + root);
        }
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            table.put(entry.getKey(), toSource(entry.getKey(), entry.getValue()));
        }
        return table;
    }

    static VariableSource toSource(String name, JsonNode node) {
        if (node.isNumber()) {
            return new FixedValue(node.asDouble());
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("Binding '" + name + "' must be a number or an object, got: " + node);
        }

        JsonNode valueNode = node.get("value");
        if (valueNode == null || !valueNode.isNumber()) {
            throw new IllegalArgumentException("Binding '" + name + "' is missing a numeric 'value'");
        }
        double value = SiPrefix.fromSymbol(node.path("prefix").asText("")).apply(valueNode.asDouble());

        JsonNode toleranceNode = node.get("tolerance");
        if (toleranceNode == null || toleranceNode.asDouble() == 0) {
            return new FixedValue(value);
        }
        double tolerance = toleranceNode.asDouble();

        String distribution = node.path("distribution").asText(UNIFORM);
        switch (distribution) {
            case UNIFORM:
                return new UniformTolerance(value, tolerance);
            case GAUSSIAN:
                return new GaussianTolerance(value, tolerance);
            default:
                throw new IllegalArgumentException("Binding '" + name + "' has unknown distribution '" + distribution + "'");
        }
    }
}
