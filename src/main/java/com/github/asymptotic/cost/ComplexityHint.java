package com.github.asymptotic.cost;

/**
 * An author-supplied bound such as {@code ► O(n^2)}.
 *
 * @param bound which bound the author stated
 * @param cost the stated growth rate
 * @param literal the literal as written, e.g. {@code O(n^2)}
 */
public record ComplexityHint(Bound bound, CostExpression cost, String literal) {

    public enum Bound {
        UPPER('O'),
        TIGHT('Θ'),
        LOWER('Ω');

        private final char symbol;

        Bound(char symbol) {
            this.symbol = symbol;
        }

        public char symbol() {
            return symbol;
        }

        static Bound of(char symbol) {
            for (var bound : values()) {
                if (bound.symbol == symbol) {
                    return bound;
                }
            }
            throw new IllegalArgumentException("no bound " + symbol);
        }
    }

    /**
     * Applies this hint to composed costs. Upper and tight bounds replace all three. A lower bound
     * replaces the best case and lifts worst and tight to at least that bound.
     */
    public Costs applyTo(Costs composed) {
        return switch (bound) {
            case UPPER, TIGHT -> Costs.uniform(cost);
            case LOWER -> new Costs(CostExpression.max(composed.worst(), cost), cost, CostExpression.max(composed.tight(), cost));
        };
    }

}
