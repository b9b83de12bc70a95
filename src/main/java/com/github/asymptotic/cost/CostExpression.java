package com.github.asymptotic.cost;

/**
 * A symbolic growth rate in the canonical form {@code base^n * n^degree * log^logPower n}.
 * <p>
 * The unknown cost is the top element of the ordering: adding or multiplying anything with it
 * stays unknown, so an unclassifiable construct is never silently absorbed by a cheaper sibling.
 */
public record CostExpression(boolean indeterminate, double exponentialBase, double degree, int logPower)
        implements Comparable<CostExpression> {

    private static final double EPSILON = 1e-9;

    private static final CostExpression UNKNOWN = new CostExpression(true, 1, 0, 0);
    private static final CostExpression CONSTANT = new CostExpression(false, 1, 0, 0);

    public enum GrowthTag {
        CONSTANT,
        LOGARITHMIC,
        LINEAR,
        LINEARITHMIC,
        POLYNOMIAL,
        EXPONENTIAL,
        UNKNOWN
    }

    public CostExpression {
        if (indeterminate) {
            exponentialBase = 1;
            degree = 0;
            logPower = 0;
        }
        if (exponentialBase < 1 || Double.isNaN(exponentialBase) || degree < 0 || logPower < 0) {
            throw new IllegalArgumentException("not a growth rate: base=" + exponentialBase
                    + " degree=" + degree + " log=" + logPower);
        }
        exponentialBase = snap(exponentialBase);
        degree = snap(degree);
    }

    public static CostExpression constant() {
        return CONSTANT;
    }

    public static CostExpression logarithmic() {
        return new CostExpression(false, 1, 0, 1);
    }

    public static CostExpression linear() {
        return new CostExpression(false, 1, 1, 0);
    }

    public static CostExpression linearithmic() {
        return new CostExpression(false, 1, 1, 1);
    }

    public static CostExpression polynomial(double degree) {
        return new CostExpression(false, 1, degree, 0);
    }

    public static CostExpression polynomial(double degree, int logPower) {
        return new CostExpression(false, 1, degree, logPower);
    }

    public static CostExpression exponential(double base) {
        return new CostExpression(false, base, 0, 0);
    }

    public static CostExpression unknown() {
        return UNKNOWN;
    }

    public GrowthTag tag() {
        if (indeterminate) {
            return GrowthTag.UNKNOWN;
        }
        if (exponentialBase > 1) {
            return GrowthTag.EXPONENTIAL;
        }
        if (degree == 0) {
            return logPower == 0 ? GrowthTag.CONSTANT : GrowthTag.LOGARITHMIC;
        }
        if (degree == 1) {
            return logPower == 0 ? GrowthTag.LINEAR : GrowthTag.LINEARITHMIC;
        }
        return GrowthTag.POLYNOMIAL;
    }

    public boolean isConstant() {
        return tag() == GrowthTag.CONSTANT;
    }

    /** Asymptotic sum: the dominant term. */
    public CostExpression plus(CostExpression other) {
        return compareTo(other) >= 0 ? this : other;
    }

    /** Asymptotic product: exponents and bases combine. */
    public CostExpression times(CostExpression other) {
        if (indeterminate || other.indeterminate) {
            return UNKNOWN;
        }
        return new CostExpression(false,
                exponentialBase * other.exponentialBase,
                degree + other.degree,
                logPower + other.logPower);
    }

    public static CostExpression max(CostExpression left, CostExpression right) {
        return left.plus(right);
    }

    public static CostExpression min(CostExpression left, CostExpression right) {
        return left.compareTo(right) <= 0 ? left : right;
    }

    @Override
    public int compareTo(CostExpression other) {
        if (indeterminate || other.indeterminate) {
            return Boolean.compare(indeterminate, other.indeterminate);
        }
        int byBase = compareDoubles(exponentialBase, other.exponentialBase);
        if (byBase != 0) {
            return byBase;
        }
        int byDegree = compareDoubles(degree, other.degree);
        if (byDegree != 0) {
            return byDegree;
        }
        return Integer.compare(logPower, other.logPower);
    }

    /** Numeric value at size {@code n}, logarithms base 2 and never below 1. */
    public double evaluate(double n) {
        if (indeterminate) {
            return Double.NaN;
        }
        double log = Math.max(1, Math.log(Math.max(n, 2)) / Math.log(2));
        return Math.pow(exponentialBase, n) * Math.pow(Math.max(n, 1), degree) * Math.pow(log, logPower);
    }

    /** The growth term alone, e.g. {@code n log n}; use {@link #label(char)} for a bound. */
    public String describe() {
        if (indeterminate) {
            return "?";
        }
        StringBuilder sb = new StringBuilder();
        if (degree > 0) {
            sb.append(degree == 1 ? "n" : "n^" + formatNumber(degree));
        }
        if (logPower > 0) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(logPower == 1 ? "log n" : "log^" + logPower + " n");
        }
        if (exponentialBase > 1) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(formatNumber(exponentialBase)).append("^n");
        }
        return sb.length() == 0 ? "1" : sb.toString();
    }

    public String label(char bound) {
        return bound + "(" + describe() + ")";
    }

    @Override
    public String toString() {
        return describe();
    }

    public static String formatNumber(double value) {
        if (value == Math.rint(value)) {
            return String.valueOf((long) value);
        }
        var formatted = String.format(java.util.Locale.ROOT, "%.2f", value);
        return formatted.replaceAll("0+$", "");
    }

    private static int compareDoubles(double left, double right) {
        if (Math.abs(left - right) < EPSILON) {
            return 0;
        }
        return Double.compare(left, right);
    }

    private static double snap(double value) {
        double rounded = Math.rint(value);
        if (Math.abs(value - rounded) < EPSILON) {
            return rounded;
        }
        return Math.round(value * 1e6) / 1e6;
    }

}
