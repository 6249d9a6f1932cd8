package com.sysmuse.fuzzy.binding;

import com.sysmuse.fuzzy.UndeclaredVariableException;

import java.util.*;

/**
 * Ordered table of variable sources.
 * <p>
 * {@link #resolve} draws a new value on every call, so a variable used twice in an
 * expression gets two independent samples. Use {@link #snapshot()} to fix one value
 * per variable for a whole evaluation. Not thread-safe.
 */
public class BindingTable implements VariableBindings {

    private final Map<String, VariableSource> sources = new LinkedHashMap<>();
    private final Random random;

    public BindingTable() {
        this(new Random());
    }

    public BindingTable(long seed) {
        this(new Random(seed));
    }

    private BindingTable(Random random) {
        this.random = random;
    }

    public BindingTable put(String name, VariableSource source) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(source, "source");
        sources.put(name, source);
        return this;
    }

    public BindingTable put(String name, double value) {
        return put(name, new FixedValue(value));
    }

    /**
     * Value with an SI prefix, e.g. {@code put("R2", 10, "k")}.
     */
    public BindingTable put(String name, double value, String prefix) {
        return put(name, SiPrefix.fromSymbol(prefix).apply(value));
    }

    @Override
    public double resolve(String name) {
        VariableSource source = sources.get(name);
        if (source == null) {
            throw new UndeclaredVariableException(name);
        }
        return source.sample(random);
    }

    public boolean contains(String name) {
        return sources.containsKey(name);
    }

    public VariableSource getSource(String name) {
        return sources.get(name);
    }

    public Set<String> getNames() {
        return Collections.unmodifiableSet(sources.keySet());
    }

    public int size() {
        return sources.size();
    }

    public void reseed(long seed) {
        random.setSeed(seed);
    }

    /**
     * Draws every source once, in insertion order, and returns a table of fixed values.
     */
    public BindingTable snapshot() {
        BindingTable fixed = new BindingTable(new Random(0));
        for (Map.Entry<String, VariableSource> entry : sources.entrySet()) {
            fixed.put(entry.getKey(), entry.getValue().sample(random));
        }
        return fixed;
    }

    /**
     * Table of the nominal values, without any spread.
     */
    public BindingTable nominal() {
        BindingTable fixed = new BindingTable(new Random(0));
        for (Map.Entry<String, VariableSource> entry : sources.entrySet()) {
            fixed.put(entry.getKey(), entry.getValue().getNominal());
        }
        return fixed;
    }

    /**
     * Same sources, with a generator seeded from this one. Entries added to the copy
     * do not show up here.
     */
    public BindingTable copy() {
        BindingTable copy = new BindingTable(new Random(random.nextLong()));
        copy.sources.putAll(sources);
        return copy;
    }

    @Override
    public String toString() {
        return sources.toString();
    }
}
