package com.github.asymptotic.parser;

import java.util.List;
import java.util.Optional;

import com.github.asymptotic.Tokenizer.Position;
import com.github.asymptotic.Tokenizer.TokenType;
import com.github.asymptotic.cost.ComplexityHint;

public record Program(List<Declaration> declarations, List<FunctionDefinition> functions) {

    public Program {
        declarations = List.copyOf(declarations);
        functions = List.copyOf(functions);
    }

    public Optional<FunctionDefinition> function(String name) {
        return functions.stream().filter(f -> f.name().equals(name)).findFirst();
    }

    public record FunctionDefinition(String name, List<String> parameters, Block body, Position position) {
        public FunctionDefinition {
            parameters = List.copyOf(parameters);
        }
    }

    public sealed interface Statement {
        Position position();
    }

    public sealed interface Expression {}

    public record Block(List<Statement> statements, Optional<ComplexityHint> hint, Position position) implements Statement {
        public Block {
            statements = List.copyOf(statements);
        }
        public Block(List<Statement> statements, Position position) {
            this(statements, Optional.empty(), position);
        }
    }

    public record ForLoop(String variable, Expression start, Expression end, Block body, Position position) implements Statement {}
    public record WhileLoop(Expression condition, Block body, Position position) implements Statement {}
    public record RepeatLoop(Block body, Expression condition, Position position) implements Statement {}
    public record If(Expression condition, Block thenBranch, Optional<Block> elseBranch, Position position) implements Statement {}
    public record Assignment(Expression target, Expression value, Position position) implements Statement {}
    public record Return(Optional<Expression> value, Position position) implements Statement {}

    /**
     * A declared scalar or array; each element of {@code shape} is one dimension, empty when the
     * extent was left out as in {@code datos[]}.
     */
    public record Declaration(String name, Optional<String> typeName, List<Optional<Expression>> shape, Position position) implements Statement {
        public Declaration {
            shape = List.copyOf(shape);
        }
        public int dimensions() {
            return shape.size();
        }
    }

    /** A call, either as a statement ({@code CALL f(x)}) or inside an expression. */
    public record Call(String name, List<Expression> arguments, Position position) implements Statement, Expression {
        public Call {
            arguments = List.copyOf(arguments);
        }
        @Override
        public boolean equals(Object o) {
            return o instanceof Call c && c.name.equals(name) && c.arguments.equals(arguments);
        }
        @Override
        public int hashCode() {
            return name.hashCode() * 31 + arguments.hashCode();
        }
    }

    public record Variable(String name) implements Expression {}
    public record NumberLiteral(double value) implements Expression {}
    public record Binary(Expression left, TokenType operator, Expression right) implements Expression {}
    public record Unary(TokenType operator, Expression operand) implements Expression {}
    public record Length(Expression argument) implements Expression {}
    public record FieldAccess(Expression target, String field) implements Expression {}
    public record ArrayAccess(Expression base, List<Expression> indices) implements Expression {
        public ArrayAccess {
            indices = List.copyOf(indices);
        }
    }

}
