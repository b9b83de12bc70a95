package com.github.asymptotic.result;

import java.util.List;
import java.util.Optional;

import com.github.asymptotic.cost.CostTerm;
import com.github.asymptotic.cost.Costs;
import com.github.asymptotic.dp.DpSignature;
import com.github.asymptotic.recursion.Recurrence;

/**
 * How one function's costs were derived.
 *
 * @param name the function
 * @param costs its worst, best and tight costs
 * @param term the composition of its body with recursive calls left out
 * @param recurrence the recurrence, for recursive functions
 * @param dp a table the function fills or memoizes through
 * @param solver what produced {@code costs}
 * @param confidence how far {@code costs} can be trusted
 * @param notes assumptions made along the way
 */
public record FunctionTrace(String name, Costs costs, CostTerm term, Optional<Recurrence> recurrence,
        Optional<DpSignature> dp, Solver solver, Confidence confidence, List<String> notes) {

    public enum Solver {
        COMPOSITION,
        MASTER_THEOREM,
        DECREMENT_UNROLLING,
        HEURISTIC,
        BRANCH_AND_BOUND,
        MEMOIZATION
    }

    public FunctionTrace {
        notes = List.copyOf(notes);
    }

    public String render() {
        var sb = new StringBuilder();
        sb.append(name).append(": ").append(costs.worst().label('O'))
                .append(", ").append(costs.best().label('Ω'))
                .append(" via ").append(solver).append(" (").append(confidence).append(")");
        recurrence.ifPresent(r -> sb.append("\n  ").append(r));
        dp.ifPresent(d -> sb.append("\n  ").append(d));
        sb.append("\n  body: ").append(term.render());
        notes.forEach(note -> sb.append("\n  - ").append(note));
        return sb.toString();
    }

}
