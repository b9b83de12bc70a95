package com.github.asymptotic.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

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
import com.github.asymptotic.parser.Program.RepeatLoop;
import com.github.asymptotic.parser.Program.Return;
import com.github.asymptotic.parser.Program.Statement;
import com.github.asymptotic.parser.Program.Unary;
import com.github.asymptotic.parser.Program.WhileLoop;

/**
 * Pre-order traversal helpers over the {@link Program} tree.
 */
public final class AstWalker {

    private AstWalker() {}

    public static void forEachStatement(Statement statement, Consumer<Statement> action) {
        action.accept(statement);
        for (var child : children(statement)) {
            forEachStatement(child, action);
        }
    }

    /** Direct child statements; loop and branch bodies are blocks. */
    public static List<Statement> children(Statement statement) {
        if (statement instanceof Block block) {
            return block.statements();
        }
        if (statement instanceof ForLoop loop) {
            return List.of(loop.body());
        }
        if (statement instanceof WhileLoop loop) {
            return List.of(loop.body());
        }
        if (statement instanceof RepeatLoop loop) {
            return List.of(loop.body());
        }
        if (statement instanceof If branch) {
            var children = new ArrayList<Statement>();
            children.add(branch.thenBranch());
            branch.elseBranch().ifPresent(children::add);
            return children;
        }
        return List.of();
    }

    /** Expressions a statement evaluates itself, not counting those of nested statements. */
    public static List<Expression> expressions(Statement statement) {
        if (statement instanceof ForLoop loop) {
            return List.of(loop.start(), loop.end());
        }
        if (statement instanceof WhileLoop loop) {
            return List.of(loop.condition());
        }
        if (statement instanceof RepeatLoop loop) {
            return List.of(loop.condition());
        }
        if (statement instanceof If branch) {
            return List.of(branch.condition());
        }
        if (statement instanceof Assignment assignment) {
            return List.of(assignment.target(), assignment.value());
        }
        if (statement instanceof Return ret) {
            return ret.value().map(List::of).orElse(List.of());
        }
        if (statement instanceof Call call) {
            return List.of(call);
        }
        if (statement instanceof Declaration declaration) {
            var extents = new ArrayList<Expression>();
            declaration.shape().forEach(extent -> extent.ifPresent(extents::add));
            return extents;
        }
        return List.of();
    }

    public static void forEachExpression(Expression expression, Consumer<Expression> action) {
        action.accept(expression);
        if (expression instanceof Binary binary) {
            forEachExpression(binary.left(), action);
            forEachExpression(binary.right(), action);
        } else if (expression instanceof Unary unary) {
            forEachExpression(unary.operand(), action);
        } else if (expression instanceof Call call) {
            call.arguments().forEach(argument -> forEachExpression(argument, action));
        } else if (expression instanceof ArrayAccess access) {
            forEachExpression(access.base(), action);
            access.indices().forEach(index -> forEachExpression(index, action));
        } else if (expression instanceof Length length) {
            forEachExpression(length.argument(), action);
        } else if (expression instanceof FieldAccess field) {
            forEachExpression(field.target(), action);
        }
    }

    /** Every call evaluated by the statement or anything nested in it, in source order. */
    public static List<Call> calls(Statement root) {
        var calls = new ArrayList<Call>();
        forEachStatement(root, statement -> expressions(statement)
                .forEach(expression -> forEachExpression(expression, e -> {
                    if (e instanceof Call call) {
                        calls.add(call);
                    }
                })));
        return calls;
    }

    /** Calls evaluated by this statement alone, nested statements excluded. */
    public static List<Call> directCalls(Statement statement) {
        var calls = new ArrayList<Call>();
        expressions(statement).forEach(expression -> forEachExpression(expression, e -> {
            if (e instanceof Call call) {
                calls.add(call);
            }
        }));
        return calls;
    }

}
