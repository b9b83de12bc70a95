package com.github.asymptotic.recursion;

import java.util.List;
import java.util.stream.Collectors;

import com.github.asymptotic.Tokenizer.Position;
import com.github.asymptotic.cost.CostExpression;

/**
 * {@code T(n) = a T(shrink(n)) + f(n)} as read off a recursive function.
 *
 * @param calls the most recursive calls made along one execution path ({@code a})
 * @param minimumCalls the fewest recursive calls along a path that recurses at all
 * @param shrinks one entry per recursive call site
 * @param work the non-recursive work {@code f(n)}
 * @param loopFactor trip count of loops that recursive calls sit in, constant when there are none
 */
public record Recurrence(int calls, int minimumCalls, List<Shrink> shrinks, CostExpression work,
        CostExpression loopFactor) {

    public enum Kind {
        DIVIDE,
        DECREMENT,
        IRREGULAR
    }

    public record Shrink(ShrinkKind kind, double amount, Position position) {
        public enum ShrinkKind {
            DIVIDE,
            DECREMENT,
            UNRESOLVED
        }

        static Shrink unresolved(Position position) {
            return new Shrink(ShrinkKind.UNRESOLVED, 0, position);
        }

        String render() {
            return switch (kind) {
                case DIVIDE -> "T(n/" + CostExpression.formatNumber(amount) + ")";
                case DECREMENT -> "T(n-" + CostExpression.formatNumber(amount) + ")";
                case UNRESOLVED -> "T(?)";
            };
        }
    }

    public Recurrence {
        shrinks = List.copyOf(shrinks);
    }

    public Kind kind() {
        if (loopFactor.isConstant() && !shrinks.isEmpty()) {
            var first = shrinks.get(0);
            boolean uniform = shrinks.stream()
                    .allMatch(s -> s.kind() == first.kind() && (s.kind() != Shrink.ShrinkKind.DIVIDE || s.amount() == first.amount()));
            if (uniform && first.kind() == Shrink.ShrinkKind.DIVIDE) {
                return Kind.DIVIDE;
            }
            if (shrinks.stream().allMatch(s -> s.kind() == Shrink.ShrinkKind.DECREMENT)) {
                return Kind.DECREMENT;
            }
        }
        return Kind.IRREGULAR;
    }

    /** The divisor {@code b}: the common factor for a dividing recurrence, 1 otherwise. */
    public double divisor() {
        return kind() == Kind.DIVIDE ? shrinks.get(0).amount() : 1;
    }

    @Override
    public String toString() {
        String recursive;
        boolean sameShrink = shrinks.stream().map(Shrink::render).distinct().count() == 1;
        if (kind() == Kind.IRREGULAR || !sameShrink) {
            recursive = shrinks.stream().map(Shrink::render).collect(Collectors.joining(" + "));
            if (!loopFactor.isConstant()) {
                recursive = loopFactor.describe() + "·(" + recursive + ")";
            }
        } else {
            recursive = (calls == 1 ? "" : String.valueOf(calls)) + shrinks.get(0).render();
        }
        return "T(n) = " + recursive + " + " + work.describe();
    }

}
