package com.github.asymptotic.recursion;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.IntUnaryOperator;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.asymptotic.Tokenizer.TokenType;
import com.github.asymptotic.cost.CostComposer;
import com.github.asymptotic.cost.CostComposer.CallContext;
import com.github.asymptotic.cost.CostExpression;
import com.github.asymptotic.cost.Costs;
import com.github.asymptotic.cost.LoopClassifier;
import com.github.asymptotic.dp.DpPatternDetector;
import com.github.asymptotic.parser.AstWalker;
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
import com.github.asymptotic.parser.Program.NumberLiteral;
import com.github.asymptotic.parser.Program.RepeatLoop;
import com.github.asymptotic.parser.Program.Return;
import com.github.asymptotic.parser.Program.Statement;
import com.github.asymptotic.parser.Program.Variable;
import com.github.asymptotic.parser.Program.WhileLoop;
import com.github.asymptotic.recursion.Recurrence.Shrink;
import com.github.asymptotic.recursion.Recurrence.Shrink.ShrinkKind;
import com.github.asymptotic.result.Confidence;
import com.github.asymptotic.result.FunctionTrace;
import com.github.asymptotic.result.FunctionTrace.Solver;
import com.github.asymptotic.result.SemanticWarning;

import lombok.RequiredArgsConstructor;

/**
 * Turns a recursive function into a recurrence and solves it.
 * <p>
 * Calls into the function's own strongly connected component are the recursive calls; everything
 * else the body does is the per-call work {@code f(n)}. Dividing recurrences go to the
 * {@link MasterTheorem}, uniform decrements are unrolled, and the rest is estimated numerically.
 */
@RequiredArgsConstructor
public class RecursionAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(RecursionAnalyzer.class);

    private static final Pattern BOUND_WORDS = Pattern.compile("bound|cota|upper|lower|mejor|best", Pattern.CASE_INSENSITIVE);
    private static final int PATH_CALL_CAP = 32;
    private static final int REFERENCE_SIZE = 1024;

    private final CostComposer composer;
    private final LoopClassifier loopClassifier;
    private final HeuristicSolver heuristicSolver;
    private final DpPatternDetector dpDetector;

    public RecursionAnalyzer() {
        this(new CostComposer(), new LoopClassifier(), new HeuristicSolver(), new DpPatternDetector());
    }

    public record Analysis(FunctionTrace trace, List<SemanticWarning> warnings) {
        public Analysis {
            warnings = List.copyOf(warnings);
        }
    }

    public Analysis analyze(FunctionDefinition function, Set<String> component, CallContext context, List<Declaration> globals) {
        // a hint on the whole body bounds the solved function, not the work of one call
        var body = function.body();
        var unhinted = body.hint().isPresent() ? new Block(body.statements(), body.position()) : body;
        var composition = composer.compose(unhinted, context.withRecursive(component));
        var work = composition.costs();
        var warnings = new ArrayList<>(composition.warnings());
        var notes = new ArrayList<>(composition.notes());

        var sites = AstWalker.calls(function.body()).stream()
                .filter(call -> component.contains(call.name()))
                .toList();
        if (sites.isEmpty()) {
            var trace = new FunctionTrace(function.name(), work, composition.term(), Optional.empty(), Optional.empty(),
                    Solver.COMPOSITION, warnings.isEmpty() ? Confidence.HIGH : Confidence.LOW, notes);
            return new Analysis(trace, warnings);
        }

        var parameters = function.parameters();
        var midpoints = midpointVariables(function, parameters);
        var shrinks = new ArrayList<Shrink>();
        for (var site : sites) {
            var shrink = shrinkOf(site, parameters, midpoints);
            if (shrink.kind() == ShrinkKind.UNRESOLVED) {
                var warning = new SemanticWarning(SemanticWarning.Kind.UNRESOLVED_SHRINK, site.position(),
                        "cannot tell how the argument of " + site.name() + " shrinks");
                logger.warn("{}", warning);
                warnings.add(warning);
            }
            shrinks.add(shrink);
        }

        var paths = new PathCounter(component, parameters).count(function.body());
        var loopFactor = loopFactor(function.body(), component);
        var recurrence = new Recurrence(paths.maximum, paths.minimum, shrinks, work.worst(), loopFactor);
        logger.debug("{}: {} ({}), early exit {}", function.name(), recurrence, recurrence.kind(), paths.earlyExit);

        // a call that recurses does the full work; only a path that returns early gets away with less
        CostExpression worst;
        CostExpression best;
        Solver solver;
        Confidence confidence;
        switch (recurrence.kind()) {
            case DIVIDE: {
                var b = recurrence.divisor();
                var solution = MasterTheorem.solve(recurrence.calls(), b, work.worst());
                notes.add("master theorem case " + solution.masterCase() + ": " + solution.explanation());
                worst = solution.cost();
                best = paths.earlyExit ? work.best() : MasterTheorem.solve(recurrence.minimumCalls(), b, work.worst()).cost();
                solver = Solver.MASTER_THEOREM;
                confidence = Confidence.HIGH;
                break;
            }
            case DECREMENT: {
                worst = unroll(recurrence.calls(), work.worst());
                best = paths.earlyExit ? work.best() : unroll(recurrence.minimumCalls(), work.worst());
                notes.add(recurrence.calls() == 1
                        ? "one call per level over n levels"
                        : recurrence.calls() + " calls per level over n levels");
                solver = Solver.DECREMENT_UNROLLING;
                confidence = Confidence.HIGH;
                break;
            }
            default: {
                var worstEstimate = heuristicSolver.solve(worstCalls(recurrence), loopFactor, work.worst());
                var bestEstimate = heuristicSolver.solve(bestCalls(recurrence), loopFactor, work.worst());
                worst = worstEstimate.cost();
                best = paths.earlyExit ? work.best() : CostExpression.min(bestEstimate.cost(), worst);
                notes.add("worst case estimated: " + worstEstimate.detail());
                notes.add("best case estimated: " + bestEstimate.detail());
                var warning = new SemanticWarning(SemanticWarning.Kind.HEURISTIC_BOUND, function.position(),
                        recurrence + " has no closed form here, bound of " + function.name() + " is estimated");
                logger.warn("{}", warning);
                warnings.add(warning);
                solver = Solver.HEURISTIC;
                confidence = Confidence.LOW;
                break;
            }
        }
        if (paths.earlyExit) {
            notes.add("a path returns without recursing, best case is a single call");
        }

        if (isBranchAndBound(function)) {
            best = CostExpression.min(worst, CostExpression.linear());
            notes.add("branch and bound pruning, best case taken as linear");
            solver = Solver.BRANCH_AND_BOUND;
            confidence = confidence.and(Confidence.MEDIUM);
        }

        var dp = dpDetector.detectMemoization(function, globals);
        if (dp.isPresent()) {
            var cap = dp.get().cost(work.worst());
            if (cap.compareTo(worst) < 0) {
                notes.add("memoized through " + dp.get().tableName() + ", each of " + dp.get().cellCount().describe()
                        + " cells computed once");
                worst = cap;
                best = CostExpression.min(best, cap);
                solver = Solver.MEMOIZATION;
                if (recurrence.kind() != Recurrence.Kind.IRREGULAR) {
                    confidence = Confidence.HIGH;
                }
            }
        }
        if (dp.isEmpty()) {
            dp = dpDetector.detectTabulation(function, globals);
            dp.ifPresent(signature -> notes.add("tabulation over " + signature.cellCount().describe() + " cells of "
                    + signature.tableName() + " in every call"));
        }
        if (!composition.warnings().isEmpty()) {
            confidence = Confidence.LOW;
        }

        var costs = new Costs(worst, CostExpression.min(best, worst), worst);
        if (function.body().hint().isPresent()) {
            costs = function.body().hint().get().applyTo(costs);
            notes.add("hint " + function.body().hint().get().literal() + " overrides the solved recurrence");
        }
        var trace = new FunctionTrace(function.name(), costs, composition.term(), Optional.of(recurrence), dp,
                solver, confidence, notes);
        logger.debug("{} solved by {}: {}", function.name(), solver, costs);
        return new Analysis(trace, warnings);
    }

    /** {@code T(n) = a T(n-c) + f(n)}: n levels, with {@code a^level} calls on level {@code level}. */
    static CostExpression unroll(int calls, CostExpression work) {
        if (calls <= 1) {
            return CostExpression.linear().times(work);
        }
        return CostExpression.exponential(calls).plus(work);
    }

    /** Variables assigned a midpoint of two parameters, such as {@code mid <- (low + high) / 2}. */
    static Set<String> midpointVariables(FunctionDefinition function, List<String> parameters) {
        var operands = Set.copyOf(parameters);
        Set<String> midpoints = new LinkedHashSet<>();
        AstWalker.forEachStatement(function.body(), s -> {
            if (s instanceof Assignment assignment && assignment.target() instanceof Variable target
                    && LoopClassifier.isMidpoint(assignment.value(), operands)) {
                midpoints.add(target.name());
            }
        });
        return midpoints;
    }

    /** How the call's arguments relate to the caller's parameters at the same positions. */
    static Shrink shrinkOf(Call call, List<String> parameters, Set<String> midpoints) {
        Shrink decrement = null;
        for (int i = 0; i < call.arguments().size() && i < parameters.size(); i++) {
            var shrink = shrinkOf(call.arguments().get(i), parameters.get(i), midpoints, call);
            if (shrink.isPresent() && shrink.get().kind() == ShrinkKind.DIVIDE) {
                return shrink.get();
            }
            if (shrink.isPresent() && decrement == null) {
                decrement = shrink.get();
            }
        }
        return decrement != null ? decrement : Shrink.unresolved(call.position());
    }

    private static Optional<Shrink> shrinkOf(Expression argument, String parameter, Set<String> midpoints, Call call) {
        var value = stripRounding(argument);
        if (value instanceof Variable v && midpoints.contains(v.name())) {
            return Optional.of(new Shrink(ShrinkKind.DIVIDE, 2, call.position()));
        }
        if (!(value instanceof Binary binary) || !(binary.right() instanceof NumberLiteral number)) {
            return Optional.empty();
        }
        var left = stripRounding(binary.left());
        boolean ofParameter = left instanceof Variable v && v.name().equals(parameter);
        boolean ofMidpoint = left instanceof Variable v && midpoints.contains(v.name());
        switch (binary.operator()) {
            case SLASH:
            case DIV:
                if (ofParameter && number.value() > 1) {
                    return Optional.of(new Shrink(ShrinkKind.DIVIDE, number.value(), call.position()));
                }
                return Optional.empty();
            case MINUS:
                if (ofParameter && number.value() > 0) {
                    return Optional.of(new Shrink(ShrinkKind.DECREMENT, number.value(), call.position()));
                }
                return ofMidpoint ? Optional.of(new Shrink(ShrinkKind.DIVIDE, 2, call.position())) : Optional.empty();
            case PLUS:
                if (ofMidpoint) {
                    return Optional.of(new Shrink(ShrinkKind.DIVIDE, 2, call.position()));
                }
                // an index counting up towards a fixed end, as in f(i + 1)
                return ofParameter && number.value() > 0
                        ? Optional.of(new Shrink(ShrinkKind.DECREMENT, number.value(), call.position()))
                        : Optional.empty();
            default:
                return Optional.empty();
        }
    }

    private static Expression stripRounding(Expression expression) {
        if (expression instanceof Call call && call.arguments().size() == 1
                && Set.of("floor", "ceil", "ceiling", "trunc", "round").contains(call.name().toLowerCase())) {
            return call.arguments().get(0);
        }
        return expression;
    }

    /** The largest product of trip counts around a recursive call site; constant when none sits in a loop. */
    private CostExpression loopFactor(Block body, Set<String> component) {
        var factors = new IdentityHashMap<Call, CostExpression>();
        collectLoopFactors(body, component, CostExpression.constant(), factors);
        return factors.values().stream().reduce(CostExpression.constant(), CostExpression::max);
    }

    private void collectLoopFactors(Statement statement, Set<String> component, CostExpression enclosing,
            Map<Call, CostExpression> into) {
        for (var call : AstWalker.directCalls(statement)) {
            if (component.contains(call.name())) {
                into.put(call, enclosing);
            }
        }
        var inner = enclosing;
        if (statement instanceof ForLoop loop) {
            inner = enclosing.times(loopClassifier.classify(loop).count());
        } else if (statement instanceof WhileLoop loop) {
            inner = enclosing.times(loopClassifier.classify(loop).count());
        } else if (statement instanceof RepeatLoop loop) {
            inner = enclosing.times(loopClassifier.classify(loop).count());
        }
        for (var child : AstWalker.children(statement)) {
            collectLoopFactors(child, component, inner, into);
        }
    }

    private static List<IntUnaryOperator> worstCalls(Recurrence recurrence) {
        List<IntUnaryOperator> calls = new ArrayList<>();
        if (hasUnresolved(recurrence)) {
            // the most unbalanced split: one call keeps all but one element
            calls.add(n -> n - 1);
            for (int i = 1; i < recurrence.calls(); i++) {
                calls.add(n -> 0);
            }
            return calls;
        }
        var slowestFirst = recurrence.shrinks().stream()
                .map(RecursionAnalyzer::operator)
                .sorted(Comparator.comparingInt((IntUnaryOperator op) -> op.applyAsInt(REFERENCE_SIZE)).reversed())
                .toList();
        for (int i = 0; i < recurrence.calls(); i++) {
            calls.add(slowestFirst.get(i % slowestFirst.size()));
        }
        return calls;
    }

    private static List<IntUnaryOperator> bestCalls(Recurrence recurrence) {
        List<IntUnaryOperator> calls = new ArrayList<>();
        int count = Math.max(1, recurrence.minimumCalls());
        if (hasUnresolved(recurrence)) {
            // a balanced split
            int parts = Math.max(2, count);
            for (int i = 0; i < count; i++) {
                calls.add(n -> n / parts);
            }
            return calls;
        }
        var fastestFirst = recurrence.shrinks().stream()
                .map(RecursionAnalyzer::operator)
                .sorted(Comparator.comparingInt((IntUnaryOperator op) -> op.applyAsInt(REFERENCE_SIZE)))
                .toList();
        for (int i = 0; i < count; i++) {
            calls.add(fastestFirst.get(i % fastestFirst.size()));
        }
        return calls;
    }

    private static boolean hasUnresolved(Recurrence recurrence) {
        return recurrence.shrinks().stream().anyMatch(s -> s.kind() == ShrinkKind.UNRESOLVED);
    }

    private static IntUnaryOperator operator(Shrink shrink) {
        return switch (shrink.kind()) {
            case DIVIDE -> n -> (int) (n / shrink.amount());
            case DECREMENT -> n -> n - (int) Math.max(1, shrink.amount());
            case UNRESOLVED -> n -> n - 1;
        };
    }

    /** Mentions a bound and prunes by returning from an {@code if}. */
    static boolean isBranchAndBound(FunctionDefinition function) {
        var c = new Object() {
            boolean mentionsBound;
            boolean prunes;
        };
        AstWalker.forEachStatement(function.body(), s -> {
            if (s instanceof If branch && branch.thenBranch().statements().stream().anyMatch(t -> t instanceof Return)) {
                c.prunes = true;
            }
            if (s instanceof Declaration d && BOUND_WORDS.matcher(d.name()).find()) {
                c.mentionsBound = true;
            }
            for (var expression : AstWalker.expressions(s)) {
                AstWalker.forEachExpression(expression, e -> {
                    if (e instanceof Variable v && BOUND_WORDS.matcher(v.name()).find()
                            || e instanceof FieldAccess f && BOUND_WORDS.matcher(f.field()).find()
                            || e instanceof Call call && BOUND_WORDS.matcher(call.name()).find()) {
                        c.mentionsBound = true;
                    }
                });
            }
        });
        return c.mentionsBound && c.prunes;
    }

    record Paths(int maximum, int minimum, boolean earlyExit) {}

    /**
     * Counts recursive calls along every execution path. Branches are alternatives, sequences add
     * up, and a {@code return} ends its path. A return without any recursive call is an early exit
     * unless the nearest {@code if} around it tests the size parameters, which makes it a base case.
     */
    static class PathCounter {
        private final Set<String> component;
        private final Set<String> parameters;

        record State(int calls, boolean returned, boolean earlyExit) {
            State plus(int more) {
                return new State(Math.min(PATH_CALL_CAP, calls + more), returned, earlyExit);
            }
        }

        PathCounter(Set<String> component, List<String> parameters) {
            this.component = component;
            this.parameters = Set.copyOf(parameters);
        }

        Paths count(Block body) {
            var end = run(body, Set.of(new State(0, false, false)), true);
            int maximum = end.stream().mapToInt(State::calls).max().orElse(0);
            int minimum = end.stream().mapToInt(State::calls).filter(c -> c > 0).min().orElse(maximum);
            boolean earlyExit = end.stream().anyMatch(State::earlyExit);
            return new Paths(Math.max(1, maximum), Math.max(1, minimum), earlyExit);
        }

        private Set<State> run(Statement statement, Set<State> in, boolean sizeGuarded) {
            Set<State> out = new HashSet<>();
            Set<State> open = new HashSet<>();
            for (var state : in) {
                (state.returned() ? out : open).add(state);
            }
            if (open.isEmpty()) {
                return out;
            }
            int calls = recursiveCalls(statement);

            if (statement instanceof Block block) {
                Set<State> current = open;
                for (var child : block.statements()) {
                    current = run(child, current, sizeGuarded);
                }
                out.addAll(current);
            } else if (statement instanceof If branch) {
                boolean guard = isSizeGuard(branch.condition());
                Set<State> entered = new HashSet<>();
                open.forEach(state -> entered.add(state.plus(calls)));
                out.addAll(run(branch.thenBranch(), entered, guard));
                if (branch.elseBranch().isPresent()) {
                    out.addAll(run(branch.elseBranch().get(), entered, guard));
                } else {
                    out.addAll(entered);
                }
            } else if (statement instanceof ForLoop || statement instanceof WhileLoop || statement instanceof RepeatLoop) {
                Set<State> entered = new HashSet<>();
                open.forEach(state -> entered.add(state.plus(calls)));
                // one pass through the body stands for all iterations; the loop factor accounts for the rest
                out.addAll(entered);
                for (var child : AstWalker.children(statement)) {
                    out.addAll(run(child, entered, sizeGuarded));
                }
            } else if (statement instanceof Return) {
                open.forEach(state -> {
                    var next = state.plus(calls);
                    boolean early = next.calls() == 0 && !sizeGuarded;
                    out.add(new State(next.calls(), true, next.earlyExit() || early));
                });
            } else {
                open.forEach(state -> out.add(state.plus(calls)));
            }
            return out;
        }

        private int recursiveCalls(Statement statement) {
            return (int) AstWalker.directCalls(statement).stream().filter(c -> component.contains(c.name())).count();
        }

        /** A comparison over parameters and constants only, like {@code n <= 1} or {@code low > high}. */
        private boolean isSizeGuard(Expression condition) {
            var c = new Object() {
                boolean comparison;
                boolean other;
            };
            AstWalker.forEachExpression(condition, e -> {
                if (e instanceof Binary b && b.operator().isComparison()) {
                    c.comparison = true;
                } else if (e instanceof Binary b && (b.operator() == TokenType.AND || b.operator() == TokenType.OR)) {
                    return;
                } else if (e instanceof Variable v) {
                    c.other |= !parameters.contains(v.name());
                } else if (e instanceof ArrayAccess || e instanceof FieldAccess) {
                    c.other = true;
                } else if (e instanceof Call call && !Set.of("length", "floor", "ceil").contains(call.name().toLowerCase())) {
                    c.other = true;
                }
            });
            return c.comparison && !c.other;
        }
    }

}
