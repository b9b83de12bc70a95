package com.github.asymptotic.result;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.asymptotic.cost.CostComposer;
import com.github.asymptotic.cost.CostComposer.CallContext;
import com.github.asymptotic.cost.CostExpression;
import com.github.asymptotic.cost.Costs;
import com.github.asymptotic.dp.DpPatternDetector;
import com.github.asymptotic.parser.Program;
import com.github.asymptotic.parser.Program.FunctionDefinition;
import com.github.asymptotic.recursion.CallGraph;
import com.github.asymptotic.recursion.RecursionAnalyzer;

import lombok.RequiredArgsConstructor;

/**
 * Analyzes every function callees first and reports the bounds of the entry function.
 */
@RequiredArgsConstructor
public class ResultSynthesizer {

    private static final Logger logger = LoggerFactory.getLogger(ResultSynthesizer.class);

    private final CostComposer composer;
    private final RecursionAnalyzer recursionAnalyzer;
    private final DpPatternDetector dpDetector;
    /** Cost of subroutines that are called but not defined, keyed by lower-case name. */
    private final Map<String, CostExpression> subroutines;
    private final Optional<String> entry;

    public AnalysisResult synthesize(Program program) {
        var graph = CallGraph.of(program);
        logger.debug("call graph {}, components {}", graph, graph.components());

        Map<String, Costs> analyzed = new LinkedHashMap<>();
        Map<String, FunctionTrace> traces = new LinkedHashMap<>();
        List<SemanticWarning> warnings = new ArrayList<>();
        for (var component : graph.components()) {
            for (var name : component) {
                var function = program.function(name).orElseThrow();
                var context = new CallContext(analyzed, subroutines, Set.of());
                FunctionTrace trace;
                if (graph.isRecursive(name)) {
                    var analysis = recursionAnalyzer.analyze(function, component, context, program.declarations());
                    warnings.addAll(analysis.warnings());
                    trace = analysis.trace();
                } else {
                    trace = compose(function, context, program, warnings);
                }
                logger.debug("{}", trace.render());
                analyzed.put(name, trace.costs());
                traces.put(name, trace);
            }
        }

        var entryName = entryFunction(program, graph);
        var entryTrace = traces.get(entryName);
        var confidence = entryTrace.confidence();
        for (var reachable : reachableFrom(entryName, graph)) {
            confidence = confidence.and(traces.get(reachable).confidence());
        }
        var costs = entryTrace.costs();
        var result = new AnalysisResult(entryName, costs.worst(), costs.best(), costs.tight(), confidence, warnings, traces);
        logger.info("{}: {} {} {} [{}]", entryName, result.worstLabel(), result.bestLabel(), result.tightLabel(), confidence);
        return result;
    }

    /**
     * Costs a function that does not recurse. A tabulation signature is recorded as evidence only:
     * the loops that fill the table already multiply out to cells times per-cell work, and a
     * declared extent such as {@code T[100]} bounds the table, not the loops that index it.
     */
    private FunctionTrace compose(FunctionDefinition function, CallContext context, Program program, List<SemanticWarning> warnings) {
        var composition = composer.compose(function, context);
        warnings.addAll(composition.warnings());
        var notes = new ArrayList<>(composition.notes());
        var dp = dpDetector.detectTabulation(function, program.declarations());
        dp.ifPresent(signature -> notes.add("tabulation over " + signature.cellCount().describe() + " cells of "
                + signature.tableName()));
        var confidence = composition.warnings().isEmpty() ? Confidence.HIGH : Confidence.LOW;
        return new FunctionTrace(function.name(), composition.costs(), composition.term(), Optional.empty(), dp,
                FunctionTrace.Solver.COMPOSITION, confidence, notes);
    }

    /** The configured entry, or else the first function no other function calls. */
    String entryFunction(Program program, CallGraph graph) {
        if (entry.isPresent()) {
            if (program.function(entry.get()).isEmpty()) {
                throw new IllegalStateException("configured entry function '" + entry.get() + "' is not defined, have "
                        + graph.functions());
            }
            return entry.get();
        }
        return program.functions().stream()
                .map(FunctionDefinition::name)
                .filter(name -> !graph.isCalledByOthers(name))
                .findFirst()
                .orElse(program.functions().get(0).name());
    }

    private static Set<String> reachableFrom(String entry, CallGraph graph) {
        Set<String> seen = new LinkedHashSet<>();
        var pending = new ArrayDeque<String>();
        pending.add(entry);
        while (!pending.isEmpty()) {
            var next = pending.poll();
            if (seen.add(next)) {
                pending.addAll(graph.callees(next));
            }
        }
        return seen;
    }

}
