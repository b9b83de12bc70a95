package com.github.asymptotic.recursion;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntUnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.asymptotic.cost.CostExpression;

/**
 * Estimates recurrences the closed forms do not cover by evaluating them at a handful of sizes and
 * picking the growth rate whose shape fits best.
 */
public class HeuristicSolver {

    private static final Logger logger = LoggerFactory.getLogger(HeuristicSolver.class);

    public static final List<Integer> DEFAULT_SIZES = List.of(64, 128, 256, 512, 1024);

    private static final double[] DEGREES = { 0, 0.5, 1, 1.5, 2, 2.5, 3, 4, 5 };
    private static final int MAX_LOG_POWER = 2;
    /** Per-step log growth above which the curve is treated as exponential. */
    private static final double EXPONENTIAL_SLOPE = 0.05;
    /** Late over early log growth above which no single base fits, as for {@code n * T(n-1)}. */
    private static final double SUPER_EXPONENTIAL_RATIO = 1.1;

    private final List<Integer> sizes;

    public HeuristicSolver() {
        this(DEFAULT_SIZES);
    }

    public HeuristicSolver(List<Integer> sizes) {
        if (sizes.size() < 2) {
            throw new IllegalArgumentException("need at least two sample sizes, got " + sizes);
        }
        var sorted = new ArrayList<>(sizes);
        sorted.sort(null);
        if (sorted.get(0) < 4) {
            throw new IllegalArgumentException("sample sizes must be at least 4, got " + sizes);
        }
        this.sizes = List.copyOf(sorted);
    }

    public record Estimate(CostExpression cost, String detail) {}

    /**
     * Evaluates {@code T(n) = loopFactor(n) * sum(T(call(n))) + work(n)} with {@code T(0) = T(1) = 1}.
     *
     * @param calls the size each recursive call at one level receives
     */
    public Estimate solve(List<IntUnaryOperator> calls, CostExpression loopFactor, CostExpression work) {
        if (work.indeterminate() || loopFactor.indeterminate()) {
            return new Estimate(CostExpression.unknown(), "work per call is unknown");
        }
        int max = sizes.get(sizes.size() - 1);
        var t = new double[max + 1];
        t[0] = 1;
        t[1] = 1;
        int overflowAt = -1;
        for (int n = 2; n <= max; n++) {
            double recursive = 0;
            for (var call : calls) {
                int smaller = Math.max(0, Math.min(n - 1, call.applyAsInt(n)));
                recursive += t[smaller];
            }
            t[n] = loopFactor.evaluate(n) * recursive + work.evaluate(n);
            if (Double.isInfinite(t[n])) {
                overflowAt = n;
                break;
            }
        }

        int last = overflowAt < 0 ? max : overflowAt - 1;
        int half = last / 2;
        double slope = (Math.log(t[last]) - Math.log(t[half])) / (last - half);
        if (overflowAt >= 0 || slope > EXPONENTIAL_SLOPE) {
            int quarter = Math.max(1, half / 2);
            double early = (Math.log(t[half]) - Math.log(t[quarter])) / Math.max(1, half - quarter);
            if (slope > early * SUPER_EXPONENTIAL_RATIO) {
                logger.debug("recurrence outgrows every c^n, log growth {} then {}", early, slope);
                var where = overflowAt >= 0 ? "overflowed at n = " + overflowAt + ", " : "";
                return new Estimate(CostExpression.unknown(), where + "grows faster than any c^n (factorial-like), per-step growth "
                        + String.format(java.util.Locale.ROOT, "%.2f", Math.exp(early)) + " at n = " + quarter + ".." + half
                        + " rising to " + String.format(java.util.Locale.ROOT, "%.2f", Math.exp(slope)) + " at n = " + half + ".." + last);
            }
            double base = Math.round(Math.exp(slope) * 100) / 100.0;
            logger.debug("recurrence grows exponentially, T({}) = {}, base ~ {}", last, t[last], base);
            var detail = overflowAt >= 0
                    ? "overflowed at n = " + overflowAt + ", base estimated " + CostExpression.formatNumber(base)
                    : "base estimated " + CostExpression.formatNumber(base) + " from n = " + half + ".." + last;
            return new Estimate(CostExpression.exponential(Math.max(base, 1)), detail);
        }

        CostExpression best = null;
        double bestSpread = Double.MAX_VALUE;
        for (double degree : DEGREES) {
            for (int logPower = 0; logPower <= MAX_LOG_POWER; logPower++) {
                var candidate = CostExpression.polynomial(degree, logPower);
                double spread = spread(t, candidate);
                if (spread < bestSpread - 1e-9) {
                    bestSpread = spread;
                    best = candidate;
                }
            }
        }
        logger.debug("recurrence fitted to {} (spread {})", best, bestSpread);
        return new Estimate(best, "fitted over n = " + sizes + ", spread " + String.format(java.util.Locale.ROOT, "%.3f", bestSpread));
    }

    /** Range of {@code ln(T(n) / g(n))} over the sample sizes; zero for a perfect fit. */
    private double spread(double[] t, CostExpression candidate) {
        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        for (int size : sizes) {
            double ratio = Math.log(t[size]) - Math.log(candidate.evaluate(size));
            min = Math.min(min, ratio);
            max = Math.max(max, ratio);
        }
        return max - min;
    }

    public List<Integer> sizes() {
        return sizes;
    }

}
