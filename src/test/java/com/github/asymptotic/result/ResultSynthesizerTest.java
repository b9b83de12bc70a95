package com.github.asymptotic.result;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.github.asymptotic.Tokenizer;
import com.github.asymptotic.cost.CostComposer;
import com.github.asymptotic.cost.CostExpression;
import com.github.asymptotic.dp.DpPatternDetector;
import com.github.asymptotic.dp.DpSignature;
import com.github.asymptotic.parser.Parser;
import com.github.asymptotic.parser.Program;
import com.github.asymptotic.recursion.CallGraph;
import com.github.asymptotic.recursion.RecursionAnalyzer;

public class ResultSynthesizerTest {

    private static final String PROGRAM = """
        suma(A, n)
        begin
          s 🡨 0
          for i 🡨 1 to n do
            s 🡨 s + A[i]
          end
          return s
        end

        fact(n)
        begin
          if (n <= 1) then
            return 1
          end
          return n * fact(n - 1)
        end

        begin
          for k 🡨 1 to n do
            t 🡨 t + suma(A, n)
          end
        end
        """;

    @Test
    public void testEntryIsFunctionNobodyCalls() {
        var result = synthesizer(Optional.empty()).synthesize(parse(PROGRAM));
        assertEquals("fact", result.entry());
        assertEquals(CostExpression.linear(), result.worst());
        assertEquals(List.of("suma", "fact", "main"), List.copyOf(result.perFunctionTrace().keySet()));
    }

    @Test
    public void testConfiguredEntry() {
        var result = synthesizer(Optional.of("main")).synthesize(parse(PROGRAM));
        assertEquals("main", result.entry());
        assertEquals(CostExpression.polynomial(2), result.worst());
        assertEquals(CostExpression.polynomial(2), result.best());
        assertEquals(CostExpression.polynomial(2), result.tight());
        assertEquals(Confidence.HIGH, result.confidence());
        assertEquals(FunctionTrace.Solver.COMPOSITION, result.trace("main").solver());
        assertEquals(FunctionTrace.Solver.DECREMENT_UNROLLING, result.trace("fact").solver());
    }

    @Test
    public void testConfiguredEntryMustExist() {
        var synthesizer = synthesizer(Optional.of("principal"));
        var program = parse(PROGRAM);
        assertThrows(IllegalStateException.class, () -> synthesizer.synthesize(program));
    }

    @Test
    public void testCalleeConfidenceReachesEntry() {
        var result = synthesizer(Optional.empty()).synthesize(parse("""
            espera(x)
            begin
              while (x > 0) do
                y 🡨 y + 1
              end
            end

            begin
              CALL espera(5)
            end
            """));
        assertEquals("main", result.entry());
        assertEquals(Confidence.LOW, result.confidence());
        assertEquals(1, result.warnings().size());
        assertEquals(SemanticWarning.Kind.INDETERMINATE_LOOP, result.warnings().get(0).kind());
        assertTrue(result.worst().indeterminate());
    }

    @Test
    public void testTabulationIsNoted() {
        var result = synthesizer(Optional.empty()).synthesize(parse("""
            fib_tab(n)
            begin
              for i 🡨 2 to n do
                F[i] 🡨 F[i - 1] + F[i - 2]
              end
              return F[n]
            end
            """));
        var trace = result.trace("fib_tab");
        assertTrue(trace.dp().isPresent());
        assertTrue(trace.notes().contains("tabulation over n cells of F"));
    }

    @Test
    public void testTabulationInsideRecursionIsRecorded() {
        var result = synthesizer(Optional.empty()).synthesize(parse("""
            cortar(n)
            begin
              if (n <= 0) then
                return 0
              end
              for i 🡨 1 to n do
                R[i] 🡨 i
              end
              return cortar(n - 1)
            end
            """));
        var trace = result.trace("cortar");
        assertEquals(CostExpression.polynomial(2), result.worst());
        assertEquals(DpSignature.FillPattern.LOOP_FILLED, trace.dp().orElseThrow().fillPattern());
        assertTrue(trace.notes().contains("tabulation over n cells of R in every call"));
    }

    @Test
    public void testEntryFunctionSkipsCallees() {
        var program = parse(PROGRAM);
        var graph = CallGraph.of(program);
        assertEquals("fact", synthesizer(Optional.empty()).entryFunction(program, graph));
    }

    private static ResultSynthesizer synthesizer(Optional<String> entry) {
        return new ResultSynthesizer(new CostComposer(), new RecursionAnalyzer(), new DpPatternDetector(), Map.of(), entry);
    }

    private static Program parse(String code) {
        return new Parser().parseProgram(new Tokenizer().tokenize(code));
    }

}
