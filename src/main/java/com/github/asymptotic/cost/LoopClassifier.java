package com.github.asymptotic.cost;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.asymptotic.Tokenizer.TokenType;
import com.github.asymptotic.parser.Program.ArrayAccess;
import com.github.asymptotic.parser.Program.Assignment;
import com.github.asymptotic.parser.Program.Binary;
import com.github.asymptotic.parser.Program.Block;
import com.github.asymptotic.parser.Program.Call;
import com.github.asymptotic.parser.Program.Expression;
import com.github.asymptotic.parser.Program.FieldAccess;
import com.github.asymptotic.parser.Program.ForLoop;
import com.github.asymptotic.parser.Program.If;
import com.github.asymptotic.parser.Program.Length;
import com.github.asymptotic.parser.Program.NumberLiteral;
import com.github.asymptotic.parser.Program.RepeatLoop;
import com.github.asymptotic.parser.Program.Statement;
import com.github.asymptotic.parser.Program.Unary;
import com.github.asymptotic.parser.Program.Variable;
import com.github.asymptotic.parser.Program.WhileLoop;

/**
 * Decides how many times a loop runs from the shape of its header and of the updates its body
 * makes to the guard variables.
 */
public class LoopClassifier {

    private static final Logger logger = LoggerFactory.getLogger(LoopClassifier.class);

    public record TripCount(CostExpression count, String reason) {
        public boolean isUnknown() {
            return count.indeterminate();
        }

        static TripCount unknown(String reason) {
            return new TripCount(CostExpression.unknown(), reason);
        }
    }

    enum Update {
        INCREMENT,
        DECREMENT,
        MULTIPLICATIVE,
        BISECTION,
        OTHER
    }

    public TripCount classify(ForLoop loop) {
        var start = SizeExpressions.growthOf(loop.start());
        var end = SizeExpressions.growthOf(loop.end());
        if (start.isEmpty() || end.isEmpty()) {
            return TripCount.unknown("bound of 'for " + loop.variable() + "' depends on data");
        }
        var range = start.get().plus(end.get());
        logger.debug("for {} at {} runs {} times", loop.variable(), loop.position(), range);
        return new TripCount(range, "for " + loop.variable() + " over a range of " + range.describe());
    }

    public TripCount classify(WhileLoop loop) {
        return classifyGuarded("while", loop.condition(), loop.body());
    }

    public TripCount classify(RepeatLoop loop) {
        return classifyGuarded("repeat", loop.condition(), loop.body());
    }

    private TripCount classifyGuarded(String keyword, Expression condition, Block body) {
        var guards = guardVariables(condition);
        if (guards.isEmpty()) {
            return TripCount.unknown(keyword + " guard has no variable");
        }

        var assignments = new ArrayList<Assignment>();
        collectAssignments(body, assignments);
        var midpoints = midpointVariables(assignments, guards);

        Map<String, Update> updates = new HashMap<>();
        for (var assignment : assignments) {
            if (assignment.target() instanceof Variable target && guards.contains(target.name())) {
                var update = classifyUpdate(target.name(), assignment.value(), midpoints);
                // the slowest update of a variable decides its progress
                updates.merge(target.name(), update, (a, b) -> slower(a, b));
            }
        }
        updates.values().removeIf(u -> u == Update.OTHER);
        if (updates.isEmpty()) {
            return TripCount.unknown(keyword + " guard " + guards + " is never updated in a recognizable way");
        }

        boolean conjunctive = condition instanceof Binary b && b.operator() == TokenType.AND;
        TripCount result = null;
        for (var entry : updates.entrySet()) {
            var trips = tripsFor(entry.getKey(), entry.getValue(), condition);
            if (result == null) {
                result = trips;
            } else if (conjunctive) {
                // the loop stops as soon as one conjunct fails
                result = trips.count().compareTo(result.count()) < 0 ? trips : result;
            } else {
                result = trips.count().compareTo(result.count()) > 0 ? trips : result;
            }
        }
        logger.debug("{} loop over {} classified as {}", keyword, updates, result.count());
        return result;
    }

    private TripCount tripsFor(String variable, Update update, Expression condition) {
        var bound = boundAgainst(variable, condition);
        switch (update) {
            case MULTIPLICATIVE:
                return new TripCount(CostExpression.logarithmic(), variable + " changes by a constant factor");
            case BISECTION:
                return new TripCount(CostExpression.logarithmic(), variable + " moves to a midpoint");
            case INCREMENT:
                if (bound.isPresent()) {
                    return new TripCount(bound.get(), variable + " counts up to a bound of " + bound.get().describe());
                }
                return new TripCount(CostExpression.linear(), variable + " changes additively");
            case DECREMENT:
                var trips = bound.map(b -> b.plus(CostExpression.linear())).orElse(CostExpression.linear());
                return new TripCount(trips, variable + " counts down additively");
            default:
                throw new IllegalStateException("unclassified update " + update);
        }
    }

    /** The growth of the side a guard variable is compared against. */
    private static Optional<CostExpression> boundAgainst(String variable, Expression condition) {
        if (condition instanceof Binary binary) {
            if (binary.operator().isComparison()) {
                if (mentions(binary.left(), variable) && !mentions(binary.right(), variable)) {
                    return SizeExpressions.growthOf(binary.right());
                }
                if (mentions(binary.right(), variable) && !mentions(binary.left(), variable)) {
                    return SizeExpressions.growthOf(binary.left());
                }
                return Optional.empty();
            }
            var left = boundAgainst(variable, binary.left());
            return left.isPresent() ? left : boundAgainst(variable, binary.right());
        }
        if (condition instanceof Unary unary) {
            return boundAgainst(variable, unary.operand());
        }
        return Optional.empty();
    }

    private static Update classifyUpdate(String variable, Expression value, Set<String> midpoints) {
        value = unwrapRounding(value);
        if (value instanceof Variable v && midpoints.contains(v.name())) {
            return Update.BISECTION;
        }
        if (!(value instanceof Binary binary)) {
            return Update.OTHER;
        }
        var left = unwrapRounding(binary.left());
        var right = unwrapRounding(binary.right());
        switch (binary.operator()) {
            case PLUS:
                if (isVariable(left, variable) && !mentions(right, variable)
                        || isVariable(right, variable) && !mentions(left, variable)) {
                    return Update.INCREMENT;
                }
                return midpointOffset(left, right, midpoints) ? Update.BISECTION : Update.OTHER;
            case MINUS:
                if (isVariable(left, variable) && !mentions(right, variable)) {
                    return Update.DECREMENT;
                }
                return midpointOffset(left, right, midpoints) ? Update.BISECTION : Update.OTHER;
            case STAR:
                if (isVariable(left, variable) && isFactor(right) || isVariable(right, variable) && isFactor(left)) {
                    return Update.MULTIPLICATIVE;
                }
                return Update.OTHER;
            case SLASH:
            case DIV:
                return isVariable(left, variable) && isFactor(right) ? Update.MULTIPLICATIVE : Update.OTHER;
            default:
                return Update.OTHER;
        }
    }

    private static boolean midpointOffset(Expression left, Expression right, Set<String> midpoints) {
        return left instanceof Variable v && midpoints.contains(v.name()) && right instanceof NumberLiteral;
    }

    /** Variables assigned {@code (x + y) / 2} where x or y is a guard variable. */
    private static Set<String> midpointVariables(List<Assignment> assignments, Set<String> guards) {
        Set<String> midpoints = new LinkedHashSet<>();
        for (var assignment : assignments) {
            if (assignment.target() instanceof Variable target && isMidpoint(assignment.value(), guards)) {
                midpoints.add(target.name());
            }
        }
        return midpoints;
    }

    public static boolean isMidpoint(Expression value, Set<String> operands) {
        value = unwrapRounding(value);
        if (value instanceof Binary half
                && (half.operator() == TokenType.SLASH || half.operator() == TokenType.DIV)
                && half.right() instanceof NumberLiteral two && two.value() == 2
                && unwrapRounding(half.left()) instanceof Binary sum && sum.operator() == TokenType.PLUS) {
            return variables(sum).stream().anyMatch(operands::contains);
        }
        return false;
    }

    private static boolean isFactor(Expression expression) {
        return expression instanceof NumberLiteral number && number.value() > 1;
    }

    private static boolean isVariable(Expression expression, String name) {
        return expression instanceof Variable v && v.name().equals(name);
    }

    static Expression unwrapRounding(Expression expression) {
        if (expression instanceof Call call && call.arguments().size() == 1
                && Set.of("floor", "ceil", "ceiling", "trunc", "round").contains(call.name().toLowerCase())) {
            return call.arguments().get(0);
        }
        return expression;
    }

    private static Update slower(Update a, Update b) {
        var additive = EnumSet.of(Update.INCREMENT, Update.DECREMENT);
        if (a == Update.OTHER) {
            return b;
        }
        if (b == Update.OTHER) {
            return a;
        }
        if (additive.contains(b) && !additive.contains(a)) {
            return b;
        }
        return a;
    }

    /** Assignments in the body and its branches; nested loops update on their own schedule and are skipped. */
    private static void collectAssignments(Statement statement, List<Assignment> into) {
        if (statement instanceof Block block) {
            block.statements().forEach(s -> collectAssignments(s, into));
        } else if (statement instanceof If branch) {
            collectAssignments(branch.thenBranch(), into);
            branch.elseBranch().ifPresent(e -> collectAssignments(e, into));
        } else if (statement instanceof Assignment assignment) {
            into.add(assignment);
        }
    }

    static Set<String> guardVariables(Expression condition) {
        return variables(condition);
    }

    /** Names read by an expression; array bases and called function names are not included. */
    public static Set<String> variables(Expression expression) {
        Set<String> names = new LinkedHashSet<>();
        collectVariables(expression, names);
        return names;
    }

    private static void collectVariables(Expression expression, Set<String> into) {
        if (expression instanceof Variable v) {
            into.add(v.name());
        } else if (expression instanceof Binary b) {
            collectVariables(b.left(), into);
            collectVariables(b.right(), into);
        } else if (expression instanceof Unary u) {
            collectVariables(u.operand(), into);
        } else if (expression instanceof ArrayAccess a) {
            a.indices().forEach(i -> collectVariables(i, into));
        } else if (expression instanceof Call c) {
            c.arguments().forEach(arg -> collectVariables(arg, into));
        } else if (expression instanceof Length l) {
            collectVariables(l.argument(), into);
        } else if (expression instanceof FieldAccess f) {
            collectVariables(f.target(), into);
        }
    }

    public static boolean mentions(Expression expression, String variable) {
        return variables(expression).contains(variable);
    }

}
