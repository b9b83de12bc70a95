package com.github.asymptotic.cost;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.asymptotic.cost.LoopClassifier.TripCount;
import com.github.asymptotic.parser.Program.ArrayAccess;
import com.github.asymptotic.parser.Program.Assignment;
import com.github.asymptotic.parser.Program.Binary;
import com.github.asymptotic.parser.Program.Block;
import com.github.asymptotic.parser.Program.Call;
import com.github.asymptotic.parser.Program.Declaration;
import com.github.asymptotic.parser.Program.Expression;
import com.github.asymptotic.parser.Program.FieldAccess;
import com.github.asymptotic.parser.Program.ForLoop;
import com.github.asymptotic.parser.Program.FunctionDefinition;
import com.github.asymptotic.parser.Program.If;
import com.github.asymptotic.parser.Program.Length;
import com.github.asymptotic.parser.Program.RepeatLoop;
import com.github.asymptotic.parser.Program.Return;
import com.github.asymptotic.parser.Program.Statement;
import com.github.asymptotic.parser.Program.Unary;
import com.github.asymptotic.parser.Program.WhileLoop;
import com.github.asymptotic.result.SemanticWarning;

import lombok.RequiredArgsConstructor;

/**
 * Assigns worst, best and tight costs to every statement of a function, bottom-up.
 * <p>
 * Calls are priced through a {@link CallContext}: functions already analyzed cost what their
 * analysis found, configured subroutines cost their table entry, and calls into the current
 * recursive component cost nothing here so the remainder is the non-recursive work {@code f(n)}.
 */
@RequiredArgsConstructor
public class CostComposer {

    private static final Logger logger = LoggerFactory.getLogger(CostComposer.class);

    /** Math helpers that show up inside expressions and never cost more than a constant. */
    static final Set<String> BUILTINS = Set.of(
            "floor", "ceil", "ceiling", "abs", "min", "max", "sqrt", "log", "lg", "log2", "ln",
            "round", "trunc", "length");

    private final LoopClassifier loopClassifier;

    public CostComposer() {
        this(new LoopClassifier());
    }

    public record CallContext(Map<String, Costs> analyzed, Map<String, CostExpression> subroutines, Set<String> recursive) {
        public CallContext {
            analyzed = Map.copyOf(analyzed);
            subroutines = Map.copyOf(subroutines);
            recursive = Set.copyOf(recursive);
        }

        public static CallContext empty() {
            return new CallContext(Map.of(), Map.of(), Set.of());
        }

        public CallContext withRecursive(Set<String> members) {
            return new CallContext(analyzed, subroutines, members);
        }

        Optional<CostExpression> subroutine(String name) {
            return Optional.ofNullable(subroutines.get(name.toLowerCase(Locale.ROOT)));
        }
    }

    public record Composition(Costs costs, CostTerm term, Map<Statement, Costs> nodeCosts,
            List<SemanticWarning> warnings, List<String> notes) {
        public Composition {
            nodeCosts = Collections.unmodifiableMap(nodeCosts);
            warnings = List.copyOf(warnings);
            notes = List.copyOf(notes);
        }

        public Costs costOf(Statement statement) {
            var costs = nodeCosts.get(statement);
            if (costs == null) {
                throw new IllegalArgumentException("statement was not part of this composition: " + statement);
            }
            return costs;
        }
    }

    public Composition compose(FunctionDefinition function, CallContext context) {
        logger.debug("composing {} with recursive members {}", function.name(), context.recursive());
        return compose(function.body(), context);
    }

    public Composition compose(Block block, CallContext context) {
        var walk = new Walk(context);
        var result = walk.block(block);
        return new Composition(result.costs, result.term, walk.nodeCosts, walk.warnings, walk.notes);
    }

    private record Priced(Costs costs, CostTerm term) {}

    private class Walk {
        private final CallContext context;
        private final Map<Statement, Costs> nodeCosts = new IdentityHashMap<>();
        private final List<SemanticWarning> warnings = new ArrayList<>();
        private final List<String> notes = new ArrayList<>();

        Walk(CallContext context) {
            this.context = context;
        }

        Priced statement(Statement statement) {
            Priced priced;
            if (statement instanceof Block block) {
                priced = block(block);
            } else if (statement instanceof ForLoop loop) {
                priced = forLoop(loop);
            } else if (statement instanceof WhileLoop loop) {
                priced = guardedLoop(loopClassifier.classify(loop), loop.condition(), loop.body(), loop);
            } else if (statement instanceof RepeatLoop loop) {
                priced = guardedLoop(loopClassifier.classify(loop), loop.condition(), loop.body(), loop);
            } else if (statement instanceof If branch) {
                priced = branch(branch);
            } else if (statement instanceof Assignment assignment) {
                var costs = expression(assignment.target()).plus(expression(assignment.value()));
                priced = new Priced(costs, CostTerm.leaf(costs.worst(), "assignment"));
            } else if (statement instanceof Return ret) {
                var costs = ret.value().map(this::expression).orElse(Costs.CONSTANT);
                priced = new Priced(costs, CostTerm.leaf(costs.worst(), "return"));
            } else if (statement instanceof Call call) {
                var costs = expression(call);
                priced = new Priced(costs, CostTerm.leaf(costs.worst(), "call " + call.name()));
            } else if (statement instanceof Declaration) {
                priced = new Priced(Costs.CONSTANT, CostTerm.leaf(CostExpression.constant(), "declaration"));
            } else {
                throw new IllegalStateException("unhandled statement " + statement);
            }
            nodeCosts.put(statement, priced.costs);
            return priced;
        }

        Priced block(Block block) {
            int warningsBefore = warnings.size();
            var costs = Costs.CONSTANT;
            var terms = new ArrayList<CostTerm>();
            for (var child : block.statements()) {
                var priced = statement(child);
                costs = costs.plus(priced.costs);
                terms.add(priced.term);
            }
            CostTerm term = new CostTerm.Sum(terms);
            if (block.hint().isPresent()) {
                var hint = block.hint().get();
                if (hint.bound() != ComplexityHint.Bound.LOWER && warnings.size() > warningsBefore) {
                    // the stated bound replaces whatever could not be classified below it
                    warnings.subList(warningsBefore, warnings.size()).clear();
                }
                notes.add("hint " + hint.literal() + " at " + block.position() + " replaces inferred "
                        + costs.worst().describe());
                costs = hint.applyTo(costs);
                term = new CostTerm.Hinted(hint, term);
            }
            nodeCosts.put(block, costs);
            return new Priced(costs, term);
        }

        private Priced forLoop(ForLoop loop) {
            var trips = loopClassifier.classify(loop);
            var bounds = expression(loop.start()).plus(expression(loop.end()));
            var loopCosts = iterate(trips, body(loop.body(), Costs.CONSTANT), loop.body(), loop);
            return new Priced(bounds.plus(loopCosts.costs), loopCosts.term);
        }

        private Priced guardedLoop(TripCount trips, Expression condition, Block body, Statement loop) {
            return iterate(trips, body(body, expression(condition)), body, loop);
        }

        private Priced body(Block body, Costs perIterationOverhead) {
            var priced = statement(body);
            return new Priced(priced.costs.plus(perIterationOverhead), priced.term);
        }

        private Priced iterate(TripCount trips, Priced body, Block bodyBlock, Statement loop) {
            if (trips.isUnknown()) {
                var warning = new SemanticWarning(SemanticWarning.Kind.INDETERMINATE_LOOP, loop.position(), trips.reason());
                logger.warn("{}", warning);
                warnings.add(warning);
            }
            var count = trips.count();
            var worst = count.times(body.costs.worst());
            var tight = count.times(body.costs.tight());
            CostExpression best;
            if (containsReturn(bodyBlock)) {
                // can leave on the first iteration
                best = body.costs.best();
                notes.add("loop at " + loop.position() + " may exit early, best case is one iteration");
            } else {
                best = count.times(body.costs.best());
            }
            var term = new CostTerm.Product(CostTerm.leaf(count, trips.reason()), body.term);
            return new Priced(new Costs(worst, best, tight), term);
        }

        private Priced branch(If branch) {
            var condition = expression(branch.condition());
            var thenPriced = statement(branch.thenBranch());
            var elsePriced = branch.elseBranch().map(this::statement)
                    .orElse(new Priced(Costs.CONSTANT, CostTerm.leaf(CostExpression.constant(), "no else")));
            var then = thenPriced.costs;
            var otherwise = elsePriced.costs;
            var costs = new Costs(
                    condition.worst().plus(CostExpression.max(then.worst(), otherwise.worst())),
                    condition.best().plus(CostExpression.min(then.best(), otherwise.best())),
                    condition.tight().plus(CostExpression.max(then.tight(), otherwise.tight())));
            var term = new CostTerm.Choice(CostTerm.leaf(condition.worst(), "condition"), thenPriced.term, elsePriced.term);
            return new Priced(costs, term);
        }

        /** Cost of evaluating an expression: constant, plus whatever the calls inside it cost. */
        Costs expression(Expression expression) {
            if (expression instanceof Call call) {
                var costs = call(call);
                for (var argument : call.arguments()) {
                    costs = costs.plus(expression(argument));
                }
                return costs;
            }
            if (expression instanceof Binary binary) {
                return expression(binary.left()).plus(expression(binary.right()));
            }
            if (expression instanceof Unary unary) {
                return expression(unary.operand());
            }
            if (expression instanceof ArrayAccess access) {
                var costs = expression(access.base());
                for (var index : access.indices()) {
                    costs = costs.plus(expression(index));
                }
                return costs;
            }
            if (expression instanceof Length length) {
                return expression(length.argument());
            }
            if (expression instanceof FieldAccess field) {
                return expression(field.target());
            }
            return Costs.CONSTANT;
        }

        private Costs call(Call call) {
            var name = call.name();
            if (context.recursive().contains(name)) {
                return Costs.CONSTANT;
            }
            var analyzed = context.analyzed().get(name);
            if (analyzed != null) {
                return analyzed;
            }
            var subroutine = context.subroutine(name);
            if (subroutine.isPresent()) {
                notes.add("subroutine " + name + " costs " + subroutine.get().label('O'));
                return Costs.uniform(subroutine.get());
            }
            if (!BUILTINS.contains(name.toLowerCase(Locale.ROOT))) {
                notes.add("external call " + name + " at " + call.position() + " assumed constant");
            }
            return Costs.CONSTANT;
        }
    }

    /** Whether a return can be reached anywhere below {@code statement}. */
    public static boolean containsReturn(Statement statement) {
        if (statement instanceof Return) {
            return true;
        }
        if (statement instanceof Block block) {
            return block.statements().stream().anyMatch(CostComposer::containsReturn);
        }
        if (statement instanceof ForLoop loop) {
            return containsReturn(loop.body());
        }
        if (statement instanceof WhileLoop loop) {
            return containsReturn(loop.body());
        }
        if (statement instanceof RepeatLoop loop) {
            return containsReturn(loop.body());
        }
        if (statement instanceof If branch) {
            return containsReturn(branch.thenBranch()) || branch.elseBranch().map(CostComposer::containsReturn).orElse(false);
        }
        return false;
    }

}
