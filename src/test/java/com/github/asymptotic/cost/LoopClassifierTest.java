package com.github.asymptotic.cost;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import com.github.asymptotic.Tokenizer;
import com.github.asymptotic.parser.Parser;
import com.github.asymptotic.parser.Program.ForLoop;
import com.github.asymptotic.parser.Program.RepeatLoop;
import com.github.asymptotic.parser.Program.Statement;
import com.github.asymptotic.parser.Program.WhileLoop;

public class LoopClassifierTest {

    private final LoopClassifier classifier = new LoopClassifier();

    @ParameterizedTest
    @MethodSource("loops")
    public void testTripCount(String loop, CostExpression expected) {
        assertEquals(expected, classify(loop).count());
    }

    private static Object[][] loops() {
        return new Object[][] {
            {
                "for i 🡨 1 to n do\n  s 🡨 s + i\nend",
                CostExpression.linear()
            }, {
                "for i 🡨 1 to 10 do\n  s 🡨 s + i\nend",
                CostExpression.constant()
            }, {
                "for i 🡨 1 to n * n do\n  s 🡨 s + i\nend",
                CostExpression.polynomial(2)
            }, {
                "for j 🡨 i to length(A) - 1 do\n  s 🡨 s + A[j]\nend",
                CostExpression.linear()
            }, {
                "for i 🡨 1 to sqrt(n) do\n  s 🡨 s + i\nend",
                CostExpression.polynomial(0.5)
            }, {
                "while (i < n) do\n  i 🡨 i + 1\nend",
                CostExpression.linear()
            }, {
                "while (i > 0) do\n  i 🡨 i - 1\nend",
                CostExpression.linear()
            }, {
                "while (i < 100) do\n  i 🡨 i + 1\nend",
                CostExpression.constant()
            }, {
                "while (n > 1) do\n  n 🡨 n / 2\nend",
                CostExpression.logarithmic()
            }, {
                "while (i ≤ n) do\n  s 🡨 s + i\n  i 🡨 i * 2\nend",
                CostExpression.logarithmic()
            }, {
                "while (i < n and A[i] != x) do\n  i 🡨 i + 1\nend",
                CostExpression.linear()
            }, {
                """
                while (izq ≤ der) do
                  medio 🡨 (izq + der) div 2
                  if (A[medio] < x) then
                    izq 🡨 medio + 1
                  else
                    der 🡨 medio - 1
                  end
                end
                """,
                CostExpression.logarithmic()
            }, {
                """
                while (izq < der) do
                  medio 🡨 floor((izq + der) / 2)
                  if (A[medio] < x) then
                    izq 🡨 medio + 1
                  else
                    der 🡨 medio
                  end
                end
                """,
                CostExpression.logarithmic()
            }, {
                "repeat\n  i 🡨 i + 1\nuntil (i ≥ n)",
                CostExpression.linear()
            }, {
                "repeat\n  k 🡨 k div 3\nuntil (k = 0)",
                CostExpression.logarithmic()
            }
        };
    }

    @Test
    public void testDataDependentBoundIsUnknown() {
        var trips = classify("for i 🡨 1 to A[k] do\n  s 🡨 s + i\nend");
        assertTrue(trips.isUnknown());
        assertTrue(trips.reason().contains("depends on data"));
    }

    @Test
    public void testGuardNeverUpdatedIsUnknown() {
        var trips = classify("while (x > 0) do\n  y 🡨 y + 1\nend");
        assertTrue(trips.isUnknown());
    }

    @Test
    public void testUnrecognizedUpdateIsUnknown() {
        var trips = classify("while (x > 0) do\n  x 🡨 A[x]\nend");
        assertTrue(trips.isUnknown());
    }

    @Test
    public void testNestedLoopUpdatesDoNotCount() {
        var trips = classify("while (x > 0) do\n  for k 🡨 1 to n do\n    x 🡨 x - 1\n  end\nend");
        assertTrue(trips.isUnknown());
    }

    @Test
    public void testKnownCountIsExplained() {
        var trips = classify("while (n > 1) do\n  n 🡨 n / 2\nend");
        assertFalse(trips.isUnknown());
        assertEquals("n changes by a constant factor", trips.reason());
    }

    @Test
    public void testMidpointRecognition() {
        var loop = (WhileLoop) statement("while (a < b) do\n  m 🡨 (a + b) / 2\n  a 🡨 m\nend");
        var midpoint = ((com.github.asymptotic.parser.Program.Assignment) loop.body().statements().get(0)).value();
        assertTrue(LoopClassifier.isMidpoint(midpoint, Set.of("a")));
        assertFalse(LoopClassifier.isMidpoint(midpoint, Set.of("c")));
    }

    private LoopClassifier.TripCount classify(String code) {
        var statement = statement(code);
        if (statement instanceof ForLoop loop) {
            return classifier.classify(loop);
        }
        if (statement instanceof WhileLoop loop) {
            return classifier.classify(loop);
        }
        return classifier.classify((RepeatLoop) statement);
    }

    private static Statement statement(String code) {
        var program = new Parser().parseProgram(new Tokenizer().tokenize("begin\n" + code + "\nend"));
        return program.functions().get(0).body().statements().get(0);
    }

}
