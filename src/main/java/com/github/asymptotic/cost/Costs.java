package com.github.asymptotic.cost;

/**
 * The worst, best and tight cost of one construct.
 */
public record Costs(CostExpression worst, CostExpression best, CostExpression tight) {

    public static final Costs CONSTANT = uniform(CostExpression.constant());

    public static Costs uniform(CostExpression cost) {
        return new Costs(cost, cost, cost);
    }

    public Costs plus(Costs other) {
        return new Costs(worst.plus(other.worst), best.plus(other.best), tight.plus(other.tight));
    }

    public Costs times(Costs other) {
        return new Costs(worst.times(other.worst), best.times(other.best), tight.times(other.tight));
    }

    public Costs times(CostExpression factor) {
        return new Costs(worst.times(factor), best.times(factor), tight.times(factor));
    }

    public boolean isUnknown() {
        return worst.indeterminate() || best.indeterminate() || tight.indeterminate();
    }

}
