package com.github.asymptotic.dp;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.github.asymptotic.Tokenizer;
import com.github.asymptotic.cost.CostExpression;
import com.github.asymptotic.dp.DpSignature.FillPattern;
import com.github.asymptotic.parser.Parser;
import com.github.asymptotic.parser.Program;

public class DpPatternDetectorTest {

    private final DpPatternDetector detector = new DpPatternDetector();

    @Test
    public void testTwoDimensionalTabulation() {
        var program = parse("""
            lcs(X, Y, n, m)
            begin
              C[n + 1][m + 1]
              for i 🡨 1 to n do
                for j 🡨 1 to m do
                  if (X[i] = Y[j]) then
                    C[i][j] 🡨 C[i - 1][j - 1] + 1
                  else
                    C[i][j] 🡨 max(C[i - 1][j], C[i][j - 1])
                  end
                end
              end
              return C[n][m]
            end
            """);
        var signature = detector.detectTabulation(program.functions().get(0), program.declarations()).orElseThrow();
        assertEquals(2, signature.dimensions());
        assertEquals(FillPattern.LOOP_FILLED, signature.fillPattern());
        assertEquals("C", signature.tableName());
        assertEquals(List.of("i", "j"), signature.indexVariables());
        assertEquals(CostExpression.polynomial(2), signature.cellCount());
        assertEquals("2D table C[i, j] LOOP_FILLED with n^2 cells", signature.toString());
    }

    @Test
    public void testUndeclaredTableCountsOneFactorPerIndex() {
        var program = parse("""
            fib_tab(n)
            begin
              for i 🡨 2 to n do
                F[i] 🡨 F[i - 1] + F[i - 2]
              end
              return F[n]
            end
            """);
        var signature = detector.detectTabulation(program.functions().get(0), program.declarations()).orElseThrow();
        assertEquals(1, signature.dimensions());
        assertEquals(CostExpression.linear(), signature.cellCount());
    }

    @Test
    public void testGlobalDeclarationGivesExtents() {
        var program = parse("""
            tabla[100]

            llenar(n)
            begin
              for i 🡨 1 to n do
                tabla[i] 🡨 i
              end
            end
            """);
        var signature = detector.detectTabulation(program.functions().get(0), program.declarations()).orElseThrow();
        assertEquals(CostExpression.constant(), signature.cellCount());
    }

    @Test
    public void testParameterArraysAreNotTables() {
        var program = parse("""
            limpiar(A, n)
            begin
              for i 🡨 1 to n do
                A[i] 🡨 0
              end
            end
            """);
        assertTrue(detector.detectTabulation(program.functions().get(0), program.declarations()).isEmpty());
    }

    @Test
    public void testWritesOutsideLoopsAreNotTabulation() {
        var program = parse("""
            f(n)
            begin
              T[1] 🡨 n
              T[2] 🡨 n
            end
            """);
        assertTrue(detector.detectTabulation(program.functions().get(0), program.declarations()).isEmpty());
    }

    @Test
    public void testMemoizationByGuardedReturn() {
        var program = parse("""
            fib_memo(n, memo)
            begin
              if (memo[n] != -1) then
                return memo[n]
              end
              memo[n] 🡨 fib_memo(n - 1, memo) + fib_memo(n - 2, memo)
              return memo[n]
            end
            """);
        var signature = detector.detectMemoization(program.functions().get(0), program.declarations()).orElseThrow();
        assertEquals(FillPattern.MEMO_GUARDED_RECURSIVE, signature.fillPattern());
        assertEquals("memo", signature.tableName());
        assertEquals(List.of("n"), signature.indexVariables());
        assertEquals(CostExpression.linear(), signature.cost(CostExpression.constant()));
    }

    @Test
    public void testMemoizationByGuardedWrite() {
        var program = parse("""
            T[n][n]

            caminos(i, j)
            begin
              if (T[i][j] = 0) then
                T[i][j] 🡨 caminos(i - 1, j) + caminos(i, j - 1)
              end
              return T[i][j]
            end
            """);
        var signature = detector.detectMemoization(program.functions().get(0), program.declarations()).orElseThrow();
        assertEquals(2, signature.dimensions());
        assertEquals(List.of("i", "j"), signature.indexVariables());
        assertEquals(CostExpression.polynomial(2), signature.cellCount());
    }

    @Test
    public void testReadOnlyInputGuardIsNotMemoization() {
        var program = parse("""
            mochila(i, W)
            begin
              if (i = 0) then
                return 0
              end
              if (w[i] > W) then
                return mochila(i - 1, W)
              end
              return max(mochila(i - 1, W), v[i] + mochila(i - 1, W - w[i]))
            end
            """);
        assertTrue(detector.detectMemoization(program.functions().get(0), program.declarations()).isEmpty());
    }

    @Test
    public void testParameterArrayGuardIsNotMemoization() {
        var program = parse("""
            subconjunto(A, i, s)
            begin
              if (i = 0) then
                return 0
              end
              if (A[i] > s) then
                return subconjunto(A, i - 1, s)
              end
              return subconjunto(A, i - 1, s) or subconjunto(A, i - 1, s - A[i])
            end
            """);
        assertTrue(detector.detectMemoization(program.functions().get(0), program.declarations()).isEmpty());
    }

    @Test
    public void testNoTableNoSignature() {
        var program = parse("""
            f(n)
            begin
              if (n <= 1) then
                return 1
              end
              return f(n - 1)
            end
            """);
        assertTrue(detector.detectMemoization(program.functions().get(0), program.declarations()).isEmpty());
    }

    private static Program parse(String code) {
        return new Parser().parseProgram(new Tokenizer().tokenize(code));
    }

}
