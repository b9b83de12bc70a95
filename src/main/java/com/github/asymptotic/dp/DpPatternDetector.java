package com.github.asymptotic.dp;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.asymptotic.cost.CostComposer;
import com.github.asymptotic.cost.CostExpression;
import com.github.asymptotic.cost.LoopClassifier;
import com.github.asymptotic.cost.SizeExpressions;
import com.github.asymptotic.dp.DpSignature.FillPattern;
import com.github.asymptotic.parser.AstWalker;
import com.github.asymptotic.parser.Program.ArrayAccess;
import com.github.asymptotic.parser.Program.Assignment;
import com.github.asymptotic.parser.Program.Declaration;
import com.github.asymptotic.parser.Program.Expression;
import com.github.asymptotic.parser.Program.ForLoop;
import com.github.asymptotic.parser.Program.FunctionDefinition;
import com.github.asymptotic.parser.Program.If;
import com.github.asymptotic.parser.Program.Statement;
import com.github.asymptotic.parser.Program.Variable;

/**
 * Recognizes tables that are filled by loops (tabulation) and tables that guard recursive calls
 * (memoization).
 */
public class DpPatternDetector {

    private static final Logger logger = LoggerFactory.getLogger(DpPatternDetector.class);

    /**
     * A table written inside for-loops at indices built from the loop variables. Tables passed in
     * as parameters are the function's input, not a table it fills.
     */
    public Optional<DpSignature> detectTabulation(FunctionDefinition function, List<Declaration> globals) {
        var c = new Object() {
            ArrayAccess best;
            List<String> indexVariables = List.of();
        };
        visitLoops(function.body(), new ArrayDeque<>(), (access, loopVariables) -> {
            var table = ((Variable) access.base()).name();
            if (function.parameters().contains(table)) {
                return;
            }
            var used = new ArrayList<String>();
            for (var index : access.indices()) {
                var names = LoopClassifier.variables(index);
                names.retainAll(loopVariables);
                if (names.isEmpty()) {
                    return;
                }
                used.addAll(names);
            }
            if (c.best == null || access.indices().size() > c.best.indices().size()) {
                c.best = access;
                c.indexVariables = List.copyOf(new LinkedHashSet<>(used));
            }
        });
        if (c.best == null) {
            return Optional.empty();
        }
        var name = ((Variable) c.best.base()).name();
        var signature = new DpSignature(c.best.indices().size(), FillPattern.LOOP_FILLED, c.indexVariables, name,
                cellCount(name, c.best.indices().size(), function, globals));
        logger.debug("{} fills {}", function.name(), signature);
        return Optional.of(signature);
    }

    /**
     * A recursive function that reads a table in an {@code if} guard, and either returns from that
     * guard or stores into the same table there. The table must be one the function stores into;
     * a guard on a read-only input array such as {@code w[i] > W} is ordinary control flow.
     */
    public Optional<DpSignature> detectMemoization(FunctionDefinition function, List<Declaration> globals) {
        List<If> guards = new ArrayList<>();
        AstWalker.forEachStatement(function.body(), s -> {
            if (s instanceof If branch) {
                guards.add(branch);
            }
        });
        for (var guard : guards) {
            for (var read : tableReads(guard.condition())) {
                var table = ((Variable) read.base()).name();
                if (!writes(function.body(), table)) {
                    continue;
                }
                if (CostComposer.containsReturn(guard.thenBranch()) || writes(guard.thenBranch(), table)) {
                    var indexVariables = new LinkedHashSet<String>();
                    read.indices().forEach(i -> indexVariables.addAll(LoopClassifier.variables(i)));
                    var signature = new DpSignature(read.indices().size(), FillPattern.MEMO_GUARDED_RECURSIVE,
                            List.copyOf(indexVariables), table, cellCount(table, read.indices().size(), function, globals));
                    logger.debug("{} memoizes through {}", function.name(), signature);
                    return Optional.of(signature);
                }
            }
        }
        return Optional.empty();
    }

    /** Cells of a table: declared extents when there is a declaration, one linear factor per index otherwise. */
    static CostExpression cellCount(String table, int indices, FunctionDefinition function, List<Declaration> globals) {
        var declaration = findDeclaration(table, function, globals);
        if (declaration.isPresent() && declaration.get().dimensions() > 0) {
            var cells = CostExpression.constant();
            for (var extent : declaration.get().shape()) {
                var growth = extent.flatMap(SizeExpressions::growthOf).orElse(CostExpression.linear());
                cells = cells.times(growth);
            }
            return cells;
        }
        return CostExpression.polynomial(indices);
    }

    private static Optional<Declaration> findDeclaration(String table, FunctionDefinition function, List<Declaration> globals) {
        var local = new ArrayList<Declaration>();
        AstWalker.forEachStatement(function.body(), s -> {
            if (s instanceof Declaration d && d.name().equals(table)) {
                local.add(d);
            }
        });
        if (!local.isEmpty()) {
            return Optional.of(local.get(0));
        }
        return globals.stream().filter(d -> d.name().equals(table)).findFirst();
    }

    private static List<ArrayAccess> tableReads(Expression condition) {
        var reads = new ArrayList<ArrayAccess>();
        AstWalker.forEachExpression(condition, e -> {
            if (e instanceof ArrayAccess access && access.base() instanceof Variable) {
                reads.add(access);
            }
        });
        return reads;
    }

    private static boolean writes(Statement body, String table) {
        var found = new boolean[1];
        AstWalker.forEachStatement(body, s -> {
            if (s instanceof Assignment assignment && assignment.target() instanceof ArrayAccess access
                    && access.base() instanceof Variable v && v.name().equals(table)) {
                found[0] = true;
            }
        });
        return found[0];
    }

    private interface TableWrite {
        void accept(ArrayAccess access, Deque<String> loopVariables);
    }

    private static void visitLoops(Statement statement, Deque<String> loopVariables, TableWrite action) {
        if (statement instanceof ForLoop loop) {
            loopVariables.push(loop.variable());
            visitLoops(loop.body(), loopVariables, action);
            loopVariables.pop();
            return;
        }
        if (statement instanceof Assignment assignment && !loopVariables.isEmpty()
                && assignment.target() instanceof ArrayAccess access && access.base() instanceof Variable) {
            action.accept(access, loopVariables);
        }
        for (var child : AstWalker.children(statement)) {
            visitLoops(child, loopVariables, action);
        }
    }

}
