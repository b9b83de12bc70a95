package com.github.asymptotic.cost;

import java.util.List;
import java.util.stream.Collectors;

/**
 * How a cost was composed from its parts, kept for the explanation trace. Collapsing a term
 * gives the same worst case the composer attached to the node.
 */
public sealed interface CostTerm {

    CostExpression collapse();

    String render();

    static CostTerm leaf(CostExpression cost, String origin) {
        return new Leaf(cost, origin);
    }

    record Leaf(CostExpression cost, String origin) implements CostTerm {
        @Override
        public CostExpression collapse() {
            return cost;
        }

        @Override
        public String render() {
            return origin.isEmpty() ? cost.describe() : cost.describe() + " [" + origin + "]";
        }
    }

    record Sum(List<CostTerm> terms) implements CostTerm {
        public Sum {
            terms = List.copyOf(terms);
        }

        @Override
        public CostExpression collapse() {
            var result = CostExpression.constant();
            for (var term : terms) {
                result = result.plus(term.collapse());
            }
            return result;
        }

        @Override
        public String render() {
            if (terms.isEmpty()) {
                return "1";
            }
            return terms.stream().map(CostTerm::render).collect(Collectors.joining(" + ", "(", ")"));
        }
    }

    record Product(CostTerm trips, CostTerm body) implements CostTerm {
        @Override
        public CostExpression collapse() {
            return trips.collapse().times(body.collapse());
        }

        @Override
        public String render() {
            return trips.render() + " * " + body.render();
        }
    }

    /** Alternative branches; the worst case takes the larger. */
    record Choice(CostTerm condition, CostTerm thenBranch, CostTerm elseBranch) implements CostTerm {
        @Override
        public CostExpression collapse() {
            return condition.collapse().plus(thenBranch.collapse().plus(elseBranch.collapse()));
        }

        @Override
        public String render() {
            return "max(" + thenBranch.render() + ", " + elseBranch.render() + ")";
        }
    }

    record Hinted(ComplexityHint hint, CostTerm replaced) implements CostTerm {
        @Override
        public CostExpression collapse() {
            return hint.bound() == ComplexityHint.Bound.LOWER ? replaced.collapse() : hint.cost();
        }

        @Override
        public String render() {
            return hint.literal() + " [hint, inferred " + replaced.collapse().describe() + "]";
        }
    }

}
