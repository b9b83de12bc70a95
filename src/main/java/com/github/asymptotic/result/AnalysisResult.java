package com.github.asymptotic.result;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.github.asymptotic.cost.CostExpression;

/**
 * Bounds of a whole program, taken at its entry function.
 *
 * @param entry the function the bounds describe
 * @param perFunctionTrace every analyzed function in the order it was analyzed
 */
public record AnalysisResult(String entry, CostExpression worst, CostExpression best, CostExpression tight,
        Confidence confidence, List<SemanticWarning> warnings, Map<String, FunctionTrace> perFunctionTrace) {

    public AnalysisResult {
        warnings = List.copyOf(warnings);
        perFunctionTrace = Collections.unmodifiableMap(new LinkedHashMap<>(perFunctionTrace));
    }

    public String worstLabel() {
        return worst.label('O');
    }

    public String bestLabel() {
        return best.label('Ω');
    }

    public String tightLabel() {
        return tight.label('Θ');
    }

    /** {@code Θ(x)} when best and worst case agree, otherwise the range between them. */
    public String rangeLabel() {
        if (worst.compareTo(best) == 0 && !worst.indeterminate()) {
            return worst.label('Θ');
        }
        return "between " + bestLabel() + " and " + worstLabel();
    }

    public FunctionTrace trace(String function) {
        var trace = perFunctionTrace.get(function);
        if (trace == null) {
            throw new IllegalArgumentException("no function named " + function + ", have " + perFunctionTrace.keySet());
        }
        return trace;
    }

    public String render() {
        var sb = new StringBuilder();
        sb.append(entry).append(": ").append(worstLabel()).append(' ').append(bestLabel()).append(' ').append(tightLabel())
                .append(" [").append(confidence).append("]");
        perFunctionTrace.values().forEach(trace -> sb.append('\n').append(trace.render()));
        warnings.forEach(warning -> sb.append("\nwarning: ").append(warning));
        return sb.toString();
    }

}
