package com.github.asymptotic.recursion;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.github.asymptotic.Tokenizer;
import com.github.asymptotic.parser.Parser;

public class CallGraphTest {

    @Test
    public void testComponentsCalleesFirst() {
        var graph = new CallGraph(Map.of(
                "main", Set.of("sort"),
                "sort", Set.of("sort", "merge"),
                "merge", Set.of()));
        var components = graph.components();
        assertEquals(List.of(Set.of("merge"), Set.of("sort"), Set.of("main")), components);
        assertTrue(graph.isRecursive("sort"));
        assertFalse(graph.isRecursive("merge"));
        assertFalse(graph.isRecursive("main"));
    }

    @Test
    public void testMutualRecursion() {
        var graph = new CallGraph(Map.of(
                "par", Set.of("impar"),
                "impar", Set.of("par")));
        assertEquals(1, graph.components().size());
        assertEquals(Set.of("par", "impar"), graph.componentOf("par"));
        assertTrue(graph.isRecursive("par"));
        assertTrue(graph.isRecursive("impar"));
        assertTrue(graph.isCalledByOthers("par"));
    }

    @Test
    public void testSelfCallIsNotCalledByOthers() {
        var graph = new CallGraph(Map.of("fib", Set.of("fib")));
        assertFalse(graph.isCalledByOthers("fib"));
        assertTrue(graph.isRecursive("fib"));
    }

    @Test
    public void testOfProgramKeepsOnlyDefinedCallees() {
        var program = new Parser().parseProgram(new Tokenizer().tokenize("""
            ordenar(A, n)
            begin
              for i 🡨 1 to n do
                CALL intercambiar(A, i, n)
                x 🡨 auxiliar(i) + floor(n / 2)
              end
            end

            auxiliar(k)
            begin
              return k
            end

            begin
              CALL ordenar(datos, 10)
            end
            """));
        var graph = CallGraph.of(program);
        assertEquals(Set.of("ordenar", "auxiliar", "main"), graph.functions());
        assertEquals(Set.of("auxiliar"), graph.callees("ordenar"));
        assertEquals(Set.of("ordenar"), graph.callees("main"));
        assertTrue(graph.isCalledByOthers("auxiliar"));
        assertFalse(graph.isCalledByOthers("main"));
        assertEquals(List.of(Set.of("auxiliar"), Set.of("ordenar"), Set.of("main")), graph.components());
    }

}
