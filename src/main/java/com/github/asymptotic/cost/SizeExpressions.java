package com.github.asymptotic.cost;

import java.util.Locale;
import java.util.Optional;

import com.github.asymptotic.parser.Program.ArrayAccess;
import com.github.asymptotic.parser.Program.Binary;
import com.github.asymptotic.parser.Program.Call;
import com.github.asymptotic.parser.Program.Expression;
import com.github.asymptotic.parser.Program.FieldAccess;
import com.github.asymptotic.parser.Program.Length;
import com.github.asymptotic.parser.Program.NumberLiteral;
import com.github.asymptotic.parser.Program.Unary;
import com.github.asymptotic.parser.Program.Variable;

/**
 * Growth of a size expression such as a loop bound or an array extent, treating every symbolic
 * name as linear in the input size.
 */
public final class SizeExpressions {

    private SizeExpressions() {
    }

    /** Empty when the expression depends on data, e.g. an array read or an unknown call. */
    public static Optional<CostExpression> growthOf(Expression expression) {
        if (expression instanceof NumberLiteral) {
            return Optional.of(CostExpression.constant());
        }
        if (expression instanceof Variable || expression instanceof Length || expression instanceof FieldAccess) {
            return Optional.of(CostExpression.linear());
        }
        if (expression instanceof Unary unary) {
            return growthOf(unary.operand());
        }
        if (expression instanceof ArrayAccess) {
            return Optional.empty();
        }
        if (expression instanceof Call call) {
            return growthOfCall(call);
        }
        if (expression instanceof Binary binary) {
            return growthOfBinary(binary);
        }
        throw new IllegalStateException("unhandled expression " + expression);
    }

    private static Optional<CostExpression> growthOfBinary(Binary binary) {
        var left = growthOf(binary.left());
        var right = growthOf(binary.right());
        switch (binary.operator()) {
            case PLUS, MINUS:
                return both(left, right).map(p -> p[0].plus(p[1]));
            case STAR:
                return both(left, right).map(p -> p[0].times(p[1]));
            case SLASH, DIV:
                return right.filter(CostExpression::isConstant).flatMap(r -> left);
            case MOD:
                return right.isPresent() && left.isPresent()
                        ? Optional.of(CostExpression.min(left.get(), right.get()))
                        : right;
            case CARET:
                return power(binary, left);
            default:
                return Optional.empty();
        }
    }

    private static Optional<CostExpression> power(Binary binary, Optional<CostExpression> base) {
        if (binary.right() instanceof NumberLiteral exponent) {
            return base.map(b -> b.isConstant() ? b : raise(b, exponent.value()));
        }
        if (binary.left() instanceof NumberLiteral number && growthOf(binary.right()).isPresent()) {
            return Optional.of(number.value() > 1 ? CostExpression.exponential(number.value()) : CostExpression.constant());
        }
        return Optional.empty();
    }

    private static CostExpression raise(CostExpression base, double exponent) {
        if (base.indeterminate() || exponent <= 0) {
            return exponent <= 0 ? CostExpression.constant() : base;
        }
        return new CostExpression(false,
                Math.pow(base.exponentialBase(), exponent),
                base.degree() * exponent,
                (int) Math.round(base.logPower() * exponent));
    }

    private static Optional<CostExpression> growthOfCall(Call call) {
        var name = call.name().toLowerCase(Locale.ROOT);
        if (call.arguments().isEmpty()) {
            return Optional.empty();
        }
        var first = growthOf(call.arguments().get(0));
        switch (name) {
            case "log", "lg", "log2", "ln":
                return first.map(g -> g.isConstant() ? g : CostExpression.logarithmic());
            case "sqrt":
                return first.map(g -> g.isConstant() ? g : raise(g, 0.5));
            case "floor", "ceil", "ceiling", "abs", "round", "trunc":
                return first;
            case "min":
                return call.arguments().stream().map(SizeExpressions::growthOf)
                        .reduce((a, b) -> both(a, b).map(p -> CostExpression.min(p[0], p[1])))
                        .orElse(Optional.empty());
            case "max":
                return call.arguments().stream().map(SizeExpressions::growthOf)
                        .reduce((a, b) -> both(a, b).map(p -> p[0].plus(p[1])))
                        .orElse(Optional.empty());
            default:
                return Optional.empty();
        }
    }

    private static Optional<CostExpression[]> both(Optional<CostExpression> left, Optional<CostExpression> right) {
        if (left.isEmpty() || right.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new CostExpression[] { left.get(), right.get() });
    }

}
