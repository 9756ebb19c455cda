package com.swarmverify.common.consensus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One-dimensional geometric median via Weiszfeld iteration.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Start at the arithmetic mean of the points.</li>
 *   <li>Re-estimate as {@code Σ(wᵢ·xᵢ) / Σwᵢ} with {@code wᵢ = 1 / (|xᵢ − y| + ε)}.</li>
 *   <li>Stop after {@value #MAX_ITERATIONS} iterations or when the step is below {@value #TOLERANCE}.</li>
 * </ol>
 *
 * <p>{@code ε} keeps the weight finite when the estimate lands exactly on a point.
 * Compared with the mean, a single outlying confidence pulls the estimate far less.
 */
public final class GeometricMedian {

    public static final int    MAX_ITERATIONS = 100;
    public static final double TOLERANCE      = 1e-6;
    static final double        EPSILON        = 1e-10;

    /** Neutral value returned for an empty point set. */
    public static final double EMPTY_VALUE = 50.0;

    private GeometricMedian() {}

    /**
     * Result of one estimation run.
     *
     * @param value      the estimate
     * @param iterations number of Weiszfeld updates computed
     * @param steps      absolute change produced by each update, in order
     */
    public record Estimate(double value, int iterations, List<Double> steps) {}

    public static double compute(List<? extends Number> points) {
        return estimate(points).value();
    }

    public static Estimate estimate(List<? extends Number> points) {
        if (points == null || points.isEmpty()) {
            return new Estimate(EMPTY_VALUE, 0, List.of());
        }
        if (points.size() == 1) {
            return new Estimate(points.get(0).doubleValue(), 0, List.of());
        }

        double y = points.stream().mapToDouble(Number::doubleValue).average().orElse(EMPTY_VALUE);
        List<Double> steps = new ArrayList<>();

        for (int iter = 0; iter < MAX_ITERATIONS; iter++) {
            double weightedSum = 0.0;
            double weightTotal = 0.0;
            for (Number p : points) {
                double x = p.doubleValue();
                double w = 1.0 / (Math.abs(x - y) + EPSILON);
                weightedSum += w * x;
                weightTotal += w;
            }
            double next = weightedSum / weightTotal;
            double step = Math.abs(next - y);
            steps.add(step);
            y = next;
            if (step < TOLERANCE) break;
        }
        return new Estimate(y, steps.size(), Collections.unmodifiableList(steps));
    }
}
