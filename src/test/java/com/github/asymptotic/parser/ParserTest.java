package com.github.asymptotic.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import com.github.asymptotic.Tokenizer;
import com.github.asymptotic.Tokenizer.TokenType;
import com.github.asymptotic.cost.ComplexityHint;
import com.github.asymptotic.cost.CostExpression;
import com.github.asymptotic.parser.Program.ArrayAccess;
import com.github.asymptotic.parser.Program.Assignment;
import com.github.asymptotic.parser.Program.Binary;
import com.github.asymptotic.parser.Program.Block;
import com.github.asymptotic.parser.Program.Call;
import com.github.asymptotic.parser.Program.Declaration;
import com.github.asymptotic.parser.Program.Expression;
import com.github.asymptotic.parser.Program.FieldAccess;
import com.github.asymptotic.parser.Program.ForLoop;
import com.github.asymptotic.parser.Program.If;
import com.github.asymptotic.parser.Program.Length;
import com.github.asymptotic.parser.Program.NumberLiteral;
import com.github.asymptotic.parser.Program.RepeatLoop;
import com.github.asymptotic.parser.Program.Return;
import com.github.asymptotic.parser.Program.Unary;
import com.github.asymptotic.parser.Program.Variable;
import com.github.asymptotic.parser.Program.WhileLoop;

public class ParserTest {

    @ParameterizedTest
    @MethodSource("expressions")
    public void testExpressionParse(String code, Expression expected) {
        var tokens = new Tokenizer().tokenize(code);
        var parsed = new Parser().parseExpression(tokens);
        assertEquals(expected, parsed);
    }

    private static Object[][] expressions() {
        return new Object[][] {
            {
                "a + b * c",
                new Binary(
                    new Variable("a"),
                    TokenType.PLUS,
                    new Binary(new Variable("b"), TokenType.STAR, new Variable("c")))
            }, {
                "(a + b) * c",
                new Binary(
                    new Binary(new Variable("a"), TokenType.PLUS, new Variable("b")),
                    TokenType.STAR,
                    new Variable("c"))
            }, {
                "n - 1 - 1",
                new Binary(
                    new Binary(new Variable("n"), TokenType.MINUS, new NumberLiteral(1)),
                    TokenType.MINUS,
                    new NumberLiteral(1))
            }, {
                "2 ^ 3 ^ k",
                new Binary(
                    new NumberLiteral(2),
                    TokenType.CARET,
                    new Binary(new NumberLiteral(3), TokenType.CARET, new Variable("k")))
            }, {
                "(i + j) div 2",
                new Binary(
                    new Binary(new Variable("i"), TokenType.PLUS, new Variable("j")),
                    TokenType.DIV,
                    new NumberLiteral(2))
            }, {
                "memo[n] != -1",
                new Binary(
                    new ArrayAccess(new Variable("memo"), List.of(new Variable("n"))),
                    TokenType.NOT_EQUALS,
                    new Unary(TokenType.MINUS, new NumberLiteral(1)))
            }, {
                "i < n and not encontrado",
                new Binary(
                    new Binary(new Variable("i"), TokenType.LT, new Variable("n")),
                    TokenType.AND,
                    new Unary(TokenType.NOT, new Variable("encontrado")))
            }, {
                "a or b and c",
                new Binary(
                    new Variable("a"),
                    TokenType.OR,
                    new Binary(new Variable("b"), TokenType.AND, new Variable("c")))
            }, {
                "A[i][j]",
                new ArrayAccess(new Variable("A"), List.of(new Variable("i"), new Variable("j")))
            }, {
                "A[i, j]",
                new ArrayAccess(new Variable("A"), List.of(new Variable("i"), new Variable("j")))
            }, {
                "length(A) - 1",
                new Binary(new Length(new Variable("A")), TokenType.MINUS, new NumberLiteral(1))
            }, {
                "fib(n - 1) + fib(n - 2)",
                new Binary(
                    new Call("fib", List.of(new Binary(new Variable("n"), TokenType.MINUS, new NumberLiteral(1))), null),
                    TokenType.PLUS,
                    new Call("fib", List.of(new Binary(new Variable("n"), TokenType.MINUS, new NumberLiteral(2))), null))
            }, {
                "floor((i + j) / 2)",
                new Call("floor", List.of(new Binary(
                    new Binary(new Variable("i"), TokenType.PLUS, new Variable("j")),
                    TokenType.SLASH,
                    new NumberLiteral(2))), null)
            }, {
                "CALL max(a, b)",
                new Call("max", List.of(new Variable("a"), new Variable("b")), null)
            }, {
                "casa.area + 0.5",
                new Binary(new FieldAccess(new Variable("casa"), "area"), TokenType.PLUS, new NumberLiteral(0.5))
            }
        };
    }

    @Test
    public void testAssignmentWithArrayTarget() {
        var statement = parseStatement("C[i][j] 🡨 C[i - 1][j] + 1");
        var assignment = assertInstanceOf(Assignment.class, statement);
        assertEquals(new ArrayAccess(new Variable("C"), List.of(new Variable("i"), new Variable("j"))), assignment.target());
        assertEquals(1, assignment.position().line());
    }

    @Test
    public void testDeclarationWithExtents() {
        var declaration = assertInstanceOf(Declaration.class, parseStatement("C[n + 1][m + 1]"));
        assertEquals("C", declaration.name());
        assertEquals(2, declaration.dimensions());
        assertEquals(Optional.of(new Binary(new Variable("n"), TokenType.PLUS, new NumberLiteral(1))), declaration.shape().get(0));
    }

    @Test
    public void testTypedDeclaration() {
        var declaration = assertInstanceOf(Declaration.class, parseStatement("Casa mi_casa"));
        assertEquals("mi_casa", declaration.name());
        assertEquals(Optional.of("Casa"), declaration.typeName());
        assertEquals(0, declaration.dimensions());
    }

    @Test
    public void testOpenArrayDeclaration() {
        var declaration = assertInstanceOf(Declaration.class, parseStatement("datos[]"));
        assertEquals(List.of(Optional.empty()), declaration.shape());
    }

    @Test
    public void testEmptyIndexCannotBeAssigned() {
        assertThrows(SyntaxException.class, () -> parseStatement("datos[] 🡨 1"));
    }

    @Test
    public void testForLoopWithBlock() {
        var loop = assertInstanceOf(ForLoop.class, parseStatement("for i 🡨 1 to n do\nbegin\n  s 🡨 s + i\nend"));
        assertEquals("i", loop.variable());
        assertEquals(new NumberLiteral(1), loop.start());
        assertEquals(new Variable("n"), loop.end());
        assertEquals(1, loop.body().statements().size());
    }

    @Test
    public void testImplicitLoopBodyRunsToEnd() {
        var loop = assertInstanceOf(WhileLoop.class, parseStatement("while (i < n) do\n  i 🡨 i + 1\n  s 🡨 s + i\nend"));
        assertEquals(2, loop.body().statements().size());
        assertEquals(new Binary(new Variable("i"), TokenType.LT, new Variable("n")), loop.condition());
    }

    @Test
    public void testRepeatUntil() {
        var loop = assertInstanceOf(RepeatLoop.class, parseStatement("repeat\n  i 🡨 i + 1\nuntil (i ≥ n)"));
        assertEquals(1, loop.body().statements().size());
        assertEquals(new Binary(new Variable("i"), TokenType.GE, new Variable("n")), loop.condition());
    }

    @Test
    public void testIfWithImplicitBranches() {
        var branch = assertInstanceOf(If.class, parseStatement("if (a > b) then\n  m 🡨 a\nelse\n  m 🡨 b\nend"));
        assertEquals(1, branch.thenBranch().statements().size());
        assertTrue(branch.elseBranch().isPresent());
        assertEquals(1, branch.elseBranch().get().statements().size());
    }

    @Test
    public void testElseIfNests() {
        var code = """
            if (x = 1) then
              a 🡨 1
            else if (x = 2) then
              a 🡨 2
            else
              a 🡨 3
            end
            """;
        var branch = assertInstanceOf(If.class, parseStatement(code));
        var nested = assertInstanceOf(If.class, branch.elseBranch().orElseThrow().statements().get(0));
        assertEquals(new Binary(new Variable("x"), TokenType.EQUALS, new NumberLiteral(2)), nested.condition());
        assertTrue(nested.elseBranch().isPresent());
    }

    @Test
    public void testReturnValueOnlyOnSameLine() {
        var block = parseBlock("begin\n  return\n  x 🡨 1\nend");
        var bare = assertInstanceOf(Return.class, block.statements().get(0));
        assertEquals(Optional.empty(), bare.value());
        assertEquals(2, block.statements().size());

        var valued = assertInstanceOf(Return.class, parseStatement("return fib(n - 1) + 1"));
        assertTrue(valued.value().isPresent());
    }

    @Test
    public void testCallStatementWithAndWithoutKeyword() {
        assertEquals(new Call("swap", List.of(new Variable("A"), new Variable("i")), null), parseStatement("CALL swap(A, i)"));
        assertEquals(new Call("swap", List.of(new Variable("A"), new Variable("i")), null), parseStatement("swap(A, i)"));
    }

    @Test
    public void testProgramWithFunctionsAndDeclarations() {
        var code = """
            tabla[100]

            suma(A[], n)
            begin
              s 🡨 0
              for i 🡨 1 to n do
                s 🡨 s + A[i]
              end
              return s
            end

            begin
              x 🡨 suma(datos, 10)
            end
            """;
        var program = parse(code);
        assertEquals(1, program.declarations().size());
        assertEquals("tabla", program.declarations().get(0).name());
        assertEquals(2, program.functions().size());
        var suma = program.function("suma").orElseThrow();
        assertEquals(List.of("A", "n"), suma.parameters());
        assertEquals(3, suma.body().statements().size());
        assertTrue(program.function("main").isPresent());
    }

    @Test
    public void testHeaderlessBlocksGetDistinctNames() {
        var program = parse("begin\n  x 🡨 1\nend\nbegin\n  y 🡨 2\nend");
        assertEquals(List.of("main", "main2"), program.functions().stream().map(f -> f.name()).toList());
    }

    @Test
    public void testHeaderlessBlockUsesConfiguredName() {
        var program = new Parser("principal").parseProgram(new Tokenizer().tokenize("begin end"));
        assertEquals("principal", program.functions().get(0).name());
    }

    @Test
    public void testHintBeforeFunctionAttachesToBody() {
        var program = parse("► O(n^2)\nbegin\n  x 🡨 1\nend");
        var hint = program.functions().get(0).body().hint().orElseThrow();
        assertEquals(ComplexityHint.Bound.UPPER, hint.bound());
        assertEquals(CostExpression.polynomial(2), hint.cost());
    }

    @Test
    public void testHintAfterSignatureAttachesToBody() {
        var program = parse("busca(A, n) ► O(log n)\nbegin\n  return 1\nend");
        assertEquals(CostExpression.logarithmic(), program.functions().get(0).body().hint().orElseThrow().cost());
    }

    @Test
    public void testStandaloneHintWrapsFollowingStatement() {
        var block = parseBlock("begin\n  ► O(n)\n  CALL ordenar(A)\n  x 🡨 1\nend");
        assertEquals(2, block.statements().size());
        var hinted = assertInstanceOf(Block.class, block.statements().get(0));
        assertEquals(CostExpression.linear(), hinted.hint().orElseThrow().cost());
        assertInstanceOf(Call.class, hinted.statements().get(0));
    }

    @Test
    public void testTrailingHintWrapsStatementOnSameLine() {
        var block = parseBlock("begin\n  CALL ordenar(A) ► O(n log n)\n  x 🡨 1\nend");
        var hinted = assertInstanceOf(Block.class, block.statements().get(0));
        assertEquals(CostExpression.linearithmic(), hinted.hint().orElseThrow().cost());
        assertInstanceOf(Assignment.class, block.statements().get(1));
    }

    @Test
    public void testHintBeforeEndIsEmptyHintedBlock() {
        var block = parseBlock("begin\n  x 🡨 1\n  ► Ω(1)\nend");
        var hinted = assertInstanceOf(Block.class, block.statements().get(1));
        assertTrue(hinted.statements().isEmpty());
        assertEquals(ComplexityHint.Bound.LOWER, hinted.hint().orElseThrow().bound());
    }

    @Test
    public void testFreeTextAfterMarkerIsComment() {
        var block = parseBlock("begin\n  x 🡨 1 ► inicializa\nend");
        assertInstanceOf(Assignment.class, block.statements().get(0));
    }

    @Test
    public void testMissingEndReportsOpeningBegin() {
        var e = assertThrows(SyntaxException.class, () -> parse("begin\n  x 🡨 1\n  for i 🡨 1 to n do\n    x 🡨 x + 1\nend"));
        assertEquals(1, e.getPosition().line());
        assertEquals(1, e.getPosition().column());
        assertEquals("'end' closing the block opened here", e.getExpectedConstruct());
    }

    @Test
    public void testStrayEnd() {
        var e = assertThrows(SyntaxException.class, () -> parse("begin\nend\nend"));
        assertEquals(3, e.getPosition().line());
    }

    @Test
    public void testRepeatWithoutUntil() {
        var e = assertThrows(SyntaxException.class, () -> parse("begin\n  repeat\n    x 🡨 1\nend"));
        assertEquals(2, e.getPosition().line());
    }

    @Test
    public void testUnsupportedConstruct() {
        var e = assertThrows(UnsupportedConstructException.class, () -> parse("begin\n  switch (x)\nend"));
        assertEquals("switch", e.getConstruct());
        assertEquals(2, e.getPosition().line());
    }

    @Test
    public void testDuplicateFunction() {
        assertThrows(SyntaxException.class, () -> parse("f(n)\nbegin\nend\nf(m)\nbegin\nend"));
    }

    @Test
    public void testEmptyProgram() {
        assertThrows(SyntaxException.class, () -> parse("// nothing here\n"));
    }

    @Test
    public void testMissingExpression() {
        var e = assertThrows(SyntaxException.class, () -> parse("begin\n  x 🡨\nend"));
        assertEquals("an expression", e.getExpectedConstruct());
    }

    private static Program parse(String code) {
        return new Parser().parseProgram(new Tokenizer().tokenize(code));
    }

    private static Program.Statement parseStatement(String code) {
        return new Parser().parseStatement(new Tokenizer().tokenize(code));
    }

    private static Block parseBlock(String code) {
        return new Parser().parseBlock(new Tokenizer().tokenize(code), Optional.empty());
    }

}
