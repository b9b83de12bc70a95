package com.github.asymptotic.recursion;

import com.github.asymptotic.cost.CostExpression;

/**
 * Closed-form solution of {@code T(n) = a T(n/b) + f(n)} for {@code f(n) = n^d log^k n}.
 */
public final class MasterTheorem {

    private static final double EPSILON = 1e-9;

    private MasterTheorem() {}

    public record Solution(CostExpression cost, int masterCase, String explanation) {}

    public static Solution solve(double a, double b, CostExpression f) {
        if (b <= 1) {
            throw new IllegalArgumentException("the master theorem needs b > 1, got " + b);
        }
        if (a < 1) {
            // fewer than one call per level: the top level dominates
            return new Solution(f, 3, "a < 1, f(n) dominates");
        }
        double critical = Math.log(a) / Math.log(b);
        var watershed = CostExpression.polynomial(critical);
        var explanation = "n^log_" + CostExpression.formatNumber(b) + "(" + CostExpression.formatNumber(a) + ") = "
                + watershed.describe();
        if (f.indeterminate() || f.exponentialBase() > 1) {
            return new Solution(f, 3, explanation + ", f(n) = " + f.describe() + " dominates");
        }
        if (f.degree() < critical - EPSILON) {
            return new Solution(watershed, 1, explanation + " dominates f(n) = " + f.describe());
        }
        if (Math.abs(f.degree() - critical) < EPSILON) {
            var cost = CostExpression.polynomial(critical, f.logPower() + 1);
            return new Solution(cost, 2, explanation + " matches f(n) = " + f.describe());
        }
        return new Solution(f, 3, explanation + " is dominated by f(n) = " + f.describe());
    }

}
