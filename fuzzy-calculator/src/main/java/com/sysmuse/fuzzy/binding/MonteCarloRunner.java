package com.sysmuse.fuzzy.binding;

import com.sysmuse.fuzzy.ExpressionTree;
import com.sysmuse.fuzzy.ParserConfig;
import com.sysmuse.fuzzy.util.LoggingUtil;

/**
 * Evaluates an expression many times, each time against a fresh snapshot of the
 * binding table, and summarises the results.
 */
public class MonteCarloRunner {

    private final int trials;
    private final Long seed;

    public MonteCarloRunner(int trials) {
        this(trials, null);
    }

    /**
     * @param seed reseeds the table before each run when not null
     */
    public MonteCarloRunner(int trials, Long seed) {
        if (trials < 1) {
            throw new IllegalArgumentException("At least one trial is needed, got " + trials);
        }
        this.trials = trials;
        this.seed = seed;
    }

    public static MonteCarloRunner fromConfig(ParserConfig config) {
        return new MonteCarloRunner(config.getMonteCarloTrials(), config.getRandomSeed());
    }

    public static Statistics run(ExpressionTree tree, BindingTable table, int trials) {
        return new MonteCarloRunner(trials).run(tree, table);
    }

    public Statistics run(ExpressionTree tree, BindingTable table) {
        if (seed != null) {
            table.reseed(seed);
        }
        double[] results = new double[trials];
        for (int t = 0; t < trials; t++) {
            results[t] = tree.evaluate(table.snapshot());
        }

        Statistics stats = new Statistics(results);
        LoggingUtil.info("Monte-Carlo '" + tree.getSource() + "': " + stats);
        return stats;
    }

    public int getTrials() {
        return trials;
    }
}
