package com.github.asymptotic.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.asymptotic.Tokenizer.Token;
import com.github.asymptotic.Tokenizer.TokenType;
import com.github.asymptotic.Tokenizer.Tokens;
import com.github.asymptotic.cost.ComplexityHint;
import com.github.asymptotic.parser.Program.ArrayAccess;
import com.github.asymptotic.parser.Program.Assignment;
import com.github.asymptotic.parser.Program.Binary;
import com.github.asymptotic.parser.Program.Block;
import com.github.asymptotic.parser.Program.Call;
import com.github.asymptotic.parser.Program.Declaration;
import com.github.asymptotic.parser.Program.Expression;
import com.github.asymptotic.parser.Program.FieldAccess;
import com.github.asymptotic.parser.Program.ForLoop;
import com.github.asymptotic.parser.Program.FunctionDefinition;
import com.github.asymptotic.parser.Program.If;
import com.github.asymptotic.parser.Program.Length;
import com.github.asymptotic.parser.Program.NumberLiteral;
import com.github.asymptotic.parser.Program.RepeatLoop;
import com.github.asymptotic.parser.Program.Return;
import com.github.asymptotic.parser.Program.Statement;
import com.github.asymptotic.parser.Program.Unary;
import com.github.asymptotic.parser.Program.Variable;
import com.github.asymptotic.parser.Program.WhileLoop;

import lombok.RequiredArgsConstructor;

/**
 * Recursive descent parser for the pseudocode dialect.
 * <p>
 * Open {@code begin} scopes are kept on an explicit stack so that a block left open at the end of
 * input is reported at the position where it was opened. A parser instance holds that stack and
 * must not be shared between threads.
 */
@RequiredArgsConstructor
public class Parser {

    private static final Logger logger = LoggerFactory.getLogger(Parser.class);

    private static final Set<TokenType> EXPRESSION_STARTS = EnumSet.of(
        TokenType.IDENTIFIER, TokenType.NUMBER, TokenType.LPAREN, TokenType.MINUS,
        TokenType.NOT, TokenType.LENGTH, TokenType.CALL);

    private final String defaultFunctionName;

    private final Deque<Token> openBlocks = new ArrayDeque<>();

    public Parser() {
        this("main");
    }

    public Program parseProgram(Tokens tokens) {
        openBlocks.clear();
        List<Declaration> declarations = new ArrayList<>();
        List<FunctionDefinition> functions = new ArrayList<>();
        Set<String> names = new HashSet<>();
        Optional<ComplexityHint> pendingHint = Optional.empty();

        while (!tokens.matches(TokenType.EOF)) {
            var token = tokens.peek();
            switch (token.type()) {
                case HINT -> pendingHint = Optional.of(tokens.next().hint());
                case SEMICOLON -> tokens.next();
                case BEGIN -> {
                    var name = uniqueName(defaultFunctionName, names);
                    var body = parseBlock(tokens, pendingHint);
                    functions.add(new FunctionDefinition(name, List.of(), body, token.position()));
                    pendingHint = Optional.empty();
                }
                case IDENTIFIER -> {
                    if (tokens.peek(1).type() == TokenType.LPAREN) {
                        var function = parseFunction(tokens, pendingHint);
                        if (!names.add(function.name())) {
                            throw new SyntaxException(token.position(), "a function name not declared before", "'" + function.name() + "'");
                        }
                        functions.add(function);
                        pendingHint = Optional.empty();
                    } else {
                        declarations.add(parseDeclaration(tokens));
                    }
                }
                case END -> throw new SyntaxException(token.position(), "a function or declaration", "'end' without matching 'begin'");
                case UNSUPPORTED -> throw new UnsupportedConstructException(token.position(), token.image());
                default -> throw new SyntaxException(token.position(), "a function or declaration", "'" + token.image() + "'");
            }
        }

        if (functions.isEmpty()) {
            throw new SyntaxException(tokens.peek().position(), "a 'begin' block");
        }
        logger.debug("Parsed {} function(s) and {} top-level declaration(s)", functions.size(), declarations.size());
        return new Program(declarations, functions);
    }

    // <> name "(" (param ("," param)*)? ")" block
    private FunctionDefinition parseFunction(Tokens tokens, Optional<ComplexityHint> hint) {
        var nameToken = tokens.next(TokenType.IDENTIFIER);
        tokens.next(TokenType.LPAREN);
        List<String> parameters = new ArrayList<>();
        while (!tokens.matches(TokenType.RPAREN)) {
            parameters.add(tokens.next(TokenType.IDENTIFIER, "a parameter name").image());
            // array parameters may be written A[] or A[1..n]; only the name matters
            while (tokens.matches(TokenType.LBRACKET)) {
                skipBracket(tokens);
            }
            if (!tokens.matches(TokenType.RPAREN)) {
                tokens.next(TokenType.COMMA);
            }
        }
        tokens.next(TokenType.RPAREN);
        if (tokens.matches(TokenType.HINT)) {
            hint = Optional.of(tokens.next().hint());
        }
        tokens.peek(TokenType.BEGIN);
        var body = parseBlock(tokens, hint);
        return new FunctionDefinition(nameToken.image(), parameters, body, nameToken.position());
    }

    private void skipBracket(Tokens tokens) {
        var open = tokens.next(TokenType.LBRACKET);
        int depth = 1;
        while (depth > 0) {
            var token = tokens.next();
            switch (token.type()) {
                case LBRACKET -> depth++;
                case RBRACKET -> depth--;
                case EOF -> throw new SyntaxException(open.position(), "']'", "end of input");
                default -> { }
            }
        }
    }

    // <> "begin" statement* "end"
    Block parseBlock(Tokens tokens, Optional<ComplexityHint> hint) {
        var begin = tokens.next(TokenType.BEGIN);
        openBlocks.push(begin);
        var statements = parseStatements(tokens, EnumSet.of(TokenType.END));
        closeScope(tokens, TokenType.END);
        return new Block(statements, hint, begin.position());
    }

    /**
     * A loop or branch body: an explicit block, or the statements up to one of the stop tokens.
     * An implicit body that stops at {@code end} consumes it.
     */
    private Block parseBody(Tokens tokens, Token opener, Set<TokenType> stops) {
        if (tokens.matches(TokenType.BEGIN)) {
            return parseBlock(tokens, Optional.empty());
        }
        openBlocks.push(opener);
        var statements = parseStatements(tokens, stops);
        if (tokens.matches(TokenType.END)) {
            closeScope(tokens, TokenType.END);
        } else if (tokens.matches(TokenType.EOF)) {
            throw unclosed(tokens);
        } else {
            openBlocks.pop();
        }
        return new Block(statements, opener.position());
    }

    private void closeScope(Tokens tokens, TokenType closer) {
        if (!tokens.matches(closer)) {
            throw unclosed(tokens);
        }
        tokens.next();
        openBlocks.pop();
    }

    private SyntaxException unclosed(Tokens tokens) {
        var open = openBlocks.peek();
        var found = tokens.peek();
        return new SyntaxException(open.position(),
                "'end' closing the block opened here",
                found.type() == TokenType.EOF ? "end of input" : "'" + found.image() + "' at " + found.position());
    }

    private List<Statement> parseStatements(Tokens tokens, Set<TokenType> stops) {
        List<Statement> statements = new ArrayList<>();
        while (!tokens.matches(TokenType.EOF) && !stops.contains(tokens.peek().type())) {
            if (tokens.matches(TokenType.SEMICOLON)) {
                tokens.next();
                continue;
            }
            if (tokens.matches(TokenType.HINT)) {
                statements.add(parseHinted(tokens, stops));
                continue;
            }
            var statement = parseStatement(tokens);
            if (tokens.matches(TokenType.HINT) && tokens.peek().position().line() == tokens.previous().position().line()) {
                // a hint trailing a statement on its own line annotates that statement
                var hint = tokens.next().hint();
                statement = wrap(statement, hint);
            }
            statements.add(statement);
        }
        return statements;
    }

    private Block parseHinted(Tokens tokens, Set<TokenType> stops) {
        var hintToken = tokens.next(TokenType.HINT);
        var hint = hintToken.hint();
        if (tokens.matches(TokenType.BEGIN)) {
            return parseBlock(tokens, Optional.of(hint));
        }
        if (tokens.matches(TokenType.EOF) || stops.contains(tokens.peek().type())) {
            return new Block(List.of(), Optional.of(hint), hintToken.position());
        }
        return wrap(parseStatement(tokens), hint);
    }

    private static Block wrap(Statement statement, ComplexityHint hint) {
        return new Block(List.of(statement), Optional.of(hint), statement.position());
    }

    Statement parseStatement(Tokens tokens) {
        var token = tokens.peek();

        return switch (token.type()) {
            case BEGIN -> parseBlock(tokens, Optional.empty());
            case FOR -> parseForLoop(tokens);
            case WHILE -> parseWhileLoop(tokens);
            case REPEAT -> parseRepeatLoop(tokens);
            case IF -> parseIf(tokens);
            case RETURN -> parseReturn(tokens);
            case CALL -> parseCall(tokens);
            case IDENTIFIER -> parseIdentifierStatement(tokens);
            case UNSUPPORTED -> throw new UnsupportedConstructException(token.position(), token.image());
            case END -> throw new SyntaxException(token.position(), "a statement", "'end' without matching 'begin'");
            default -> throw new SyntaxException(token.position(), "a statement", "'" + token.image() + "'");
        };
    }

    // <> "for" ident "<-" expr "to" expr "do" body
    private ForLoop parseForLoop(Tokens tokens) {
        var forToken = tokens.next(TokenType.FOR);
        var variable = tokens.next(TokenType.IDENTIFIER, "a loop variable");
        tokens.next(TokenType.ARROW);
        var start = parseExpression(tokens);
        tokens.next(TokenType.TO);
        var end = parseExpression(tokens);
        var doToken = tokens.next(TokenType.DO);
        var body = parseBody(tokens, doToken, EnumSet.of(TokenType.END));
        return new ForLoop(variable.image(), start, end, body, forToken.position());
    }

    // <> "while" "(" cond ")" "do" body
    private WhileLoop parseWhileLoop(Tokens tokens) {
        var whileToken = tokens.next(TokenType.WHILE);
        var condition = parseExpression(tokens);
        var doToken = tokens.next(TokenType.DO);
        var body = parseBody(tokens, doToken, EnumSet.of(TokenType.END));
        return new WhileLoop(condition, body, whileToken.position());
    }

    // <> "repeat" (block | statement*) "until" "(" cond ")"
    private RepeatLoop parseRepeatLoop(Tokens tokens) {
        var repeatToken = tokens.next(TokenType.REPEAT);
        Block body;
        if (tokens.matches(TokenType.BEGIN)) {
            body = parseBlock(tokens, Optional.empty());
        } else {
            openBlocks.push(repeatToken);
            var statements = parseStatements(tokens, EnumSet.of(TokenType.UNTIL, TokenType.END));
            if (!tokens.matches(TokenType.UNTIL)) {
                throw new SyntaxException(repeatToken.position(), "'until' closing this repeat",
                        tokens.matches(TokenType.EOF) ? "end of input" : "'" + tokens.peek().image() + "' at " + tokens.peek().position());
            }
            openBlocks.pop();
            body = new Block(statements, repeatToken.position());
        }
        tokens.next(TokenType.UNTIL);
        var condition = parseExpression(tokens);
        return new RepeatLoop(body, condition, repeatToken.position());
    }

    // <> "if" "(" cond ")" "then" body ("else" body)?
    private If parseIf(Tokens tokens) {
        var ifToken = tokens.next(TokenType.IF);
        var condition = parseExpression(tokens);
        var thenToken = tokens.next(TokenType.THEN);
        var thenBranch = parseBody(tokens, thenToken, EnumSet.of(TokenType.END, TokenType.ELSE));
        Optional<Block> elseBranch = Optional.empty();
        if (tokens.matches(TokenType.ELSE)) {
            var elseToken = tokens.next();
            if (tokens.matches(TokenType.IF)) {
                // else if chains nest without an extra end
                var nested = parseIf(tokens);
                elseBranch = Optional.of(new Block(List.of(nested), elseToken.position()));
            } else {
                elseBranch = Optional.of(parseBody(tokens, elseToken, EnumSet.of(TokenType.END)));
            }
        }
        return new If(condition, thenBranch, elseBranch, ifToken.position());
    }

    // <> "return" expr?
    private Return parseReturn(Tokens tokens) {
        var returnToken = tokens.next(TokenType.RETURN);
        var next = tokens.peek();
        if (EXPRESSION_STARTS.contains(next.type()) && next.position().line() == returnToken.position().line()) {
            return new Return(Optional.of(parseExpression(tokens)), returnToken.position());
        }
        return new Return(Optional.empty(), returnToken.position());
    }

    // <> "CALL" ident "(" argList ")"
    private Call parseCall(Tokens tokens) {
        tokens.next(TokenType.CALL);
        var nameToken = tokens.next(TokenType.IDENTIFIER, "a procedure name after CALL");
        return parseCallArguments(tokens, nameToken);
    }

    private Call parseCallArguments(Tokens tokens, Token nameToken) {
        tokens.next(TokenType.LPAREN);
        List<Expression> arguments = new ArrayList<>();
        while (!tokens.matches(TokenType.RPAREN)) {
            arguments.add(parseExpression(tokens));
            if (!tokens.matches(TokenType.RPAREN)) {
                tokens.next(TokenType.COMMA);
            }
        }
        tokens.next(TokenType.RPAREN);
        return new Call(nameToken.image(), arguments, nameToken.position());
    }

    /**
     * Statements that start with a name: a call without the CALL keyword, an assignment, or a
     * declaration such as {@code i}, {@code datos[10]} or {@code Casa mi_casa}.
     */
    private Statement parseIdentifierStatement(Tokens tokens) {
        var nameToken = tokens.peek(TokenType.IDENTIFIER);
        if (tokens.peek(1).type() == TokenType.LPAREN) {
            tokens.next();
            return parseCallArguments(tokens, nameToken);
        }
        if (tokens.peek(1).type() == TokenType.IDENTIFIER
                && tokens.peek(1).position().line() == nameToken.position().line()) {
            return parseDeclaration(tokens);
        }

        tokens.next();
        Expression target = new Variable(nameToken.image());
        List<Optional<Expression>> shape = new ArrayList<>();
        boolean declarable = true;
        while (tokens.matches(TokenType.LBRACKET, TokenType.DOT)) {
            if (tokens.matches(TokenType.DOT)) {
                tokens.next();
                var field = tokens.next(TokenType.IDENTIFIER, "a field name");
                target = new FieldAccess(target, field.image());
                declarable = false;
                continue;
            }
            var open = tokens.next(TokenType.LBRACKET);
            if (tokens.matches(TokenType.RBRACKET)) {
                tokens.next();
                if (tokens.matches(TokenType.ARROW)) {
                    throw new SyntaxException(open.position(), "an index expression", "'[]'");
                }
                shape.add(Optional.empty());
                continue;
            }
            var indices = parseIndices(tokens);
            indices.forEach(i -> shape.add(Optional.of(i)));
            target = flatten(new ArrayAccess(target, indices));
        }

        if (tokens.matches(TokenType.ARROW)) {
            if (shape.contains(Optional.<Expression>empty())) {
                throw new SyntaxException(nameToken.position(), "an index expression", "'[]'");
            }
            tokens.next();
            var value = parseExpression(tokens);
            return new Assignment(target, value, nameToken.position());
        }
        if (!declarable) {
            throw new SyntaxException(tokens.peek().position(), "'<-' after '" + nameToken.image() + "'", "'" + tokens.peek().image() + "'");
        }
        return new Declaration(nameToken.image(), Optional.empty(), shape, nameToken.position());
    }

    // <> (typeName)? name ("[" expr? "]")*
    private Declaration parseDeclaration(Tokens tokens) {
        var first = tokens.next(TokenType.IDENTIFIER);
        Optional<String> typeName = Optional.empty();
        var nameToken = first;
        if (tokens.matches(TokenType.IDENTIFIER) && tokens.peek().position().line() == first.position().line()) {
            typeName = Optional.of(first.image());
            nameToken = tokens.next();
        }
        List<Optional<Expression>> shape = new ArrayList<>();
        while (tokens.matches(TokenType.LBRACKET)) {
            tokens.next();
            if (tokens.matches(TokenType.RBRACKET)) {
                tokens.next();
                shape.add(Optional.empty());
                continue;
            }
            parseIndices(tokens).forEach(i -> shape.add(Optional.of(i)));
        }
        return new Declaration(nameToken.image(), typeName, shape, first.position());
    }

    // "[" expr ("," expr)* "]" after the opening bracket
    private List<Expression> parseIndices(Tokens tokens) {
        List<Expression> indices = new ArrayList<>();
        indices.add(parseExpression(tokens));
        while (tokens.matches(TokenType.COMMA)) {
            tokens.next();
            indices.add(parseExpression(tokens));
        }
        tokens.next(TokenType.RBRACKET);
        return indices;
    }

    Expression parseExpression(Tokens tokens) {
        return parseOr(tokens);
    }

    private Expression parseOr(Tokens tokens) {
        var expr = parseAnd(tokens);
        while (tokens.matches(TokenType.OR)) {
            var operator = tokens.next().type();
            expr = new Binary(expr, operator, parseAnd(tokens));
        }
        return expr;
    }

    private Expression parseAnd(Tokens tokens) {
        var expr = parseNot(tokens);
        while (tokens.matches(TokenType.AND)) {
            var operator = tokens.next().type();
            expr = new Binary(expr, operator, parseNot(tokens));
        }
        return expr;
    }

    private Expression parseNot(Tokens tokens) {
        if (tokens.matches(TokenType.NOT)) {
            tokens.next();
            return new Unary(TokenType.NOT, parseNot(tokens));
        }
        return parseComparison(tokens);
    }

    private Expression parseComparison(Tokens tokens) {
        var expr = parsePlus(tokens);

        while (tokens.peek().type().isComparison()) {
            var operator = tokens.next().type();
            var right = parsePlus(tokens);
            expr = new Binary(expr, operator, right);
        }
        return expr;
    }

    private Expression parsePlus(Tokens tokens) {
        var expr = parseTimes(tokens);

        while (tokens.matches(TokenType.PLUS, TokenType.MINUS)) {
            var operator = tokens.next().type();
            var right = parseTimes(tokens);
            expr = new Binary(expr, operator, right);
        }
        return expr;
    }

    private Expression parseTimes(Tokens tokens) {
        var expr = parsePower(tokens);

        while (tokens.matches(TokenType.STAR, TokenType.SLASH, TokenType.MOD, TokenType.DIV)) {
            var operator = tokens.next().type();
            var right = parsePower(tokens);
            expr = new Binary(expr, operator, right);
        }
        return expr;
    }

    private Expression parsePower(Tokens tokens) {
        var base = parseUnary(tokens);
        if (tokens.matches(TokenType.CARET)) {
            tokens.next();
            return new Binary(base, TokenType.CARET, parsePower(tokens));
        }
        return base;
    }

    private Expression parseUnary(Tokens tokens) {
        if (tokens.matches(TokenType.MINUS)) {
            tokens.next();
            return new Unary(TokenType.MINUS, parseUnary(tokens));
        }
        return parseAtom(tokens);
    }

    private Expression parseAtom(Tokens tokens) {
        var token = tokens.peek();

        Expression expression = switch (token.type()) {
            case NUMBER -> {
                tokens.next();
                yield new NumberLiteral(Double.parseDouble(token.image()));
            }
            case IDENTIFIER -> {
                tokens.next();
                if (tokens.matches(TokenType.LPAREN)) {
                    yield parseCallArguments(tokens, token);
                }
                yield new Variable(token.image());
            }
            case CALL -> parseCall(tokens);
            case LENGTH -> {
                tokens.next();
                tokens.next(TokenType.LPAREN);
                var argument = parseExpression(tokens);
                tokens.next(TokenType.RPAREN);
                yield new Length(argument);
            }
            case LPAREN -> {
                tokens.next(TokenType.LPAREN);
                var e = parseExpression(tokens);
                tokens.next(TokenType.RPAREN);
                yield e;
            }
            case UNSUPPORTED -> throw new UnsupportedConstructException(token.position(), token.image());
            default -> throw new SyntaxException(token.position(), "an expression",
                    token.type() == TokenType.EOF ? "end of input" : "'" + token.image() + "'");
        };

        while (tokens.matches(TokenType.DOT, TokenType.LBRACKET)) {
            var postfixToken = tokens.next();
            if (postfixToken.type() == TokenType.DOT) {
                var field = tokens.next(TokenType.IDENTIFIER, "a field name");
                expression = new FieldAccess(expression, field.image());
            } else {
                expression = flatten(new ArrayAccess(expression, parseIndices(tokens)));
            }
        }

        return expression;
    }

    /** {@code A[i][j]} and {@code A[i, j]} are the same two-dimensional access. */
    private static Expression flatten(Expression expression) {
        if (expression instanceof ArrayAccess outer && outer.base() instanceof ArrayAccess inner) {
            List<Expression> indices = new ArrayList<>(inner.indices());
            indices.addAll(outer.indices());
            return new ArrayAccess(inner.base(), indices);
        }
        return expression;
    }

    private static String uniqueName(String base, Set<String> names) {
        var name = base;
        int suffix = 2;
        while (!names.add(name)) {
            name = base + suffix++;
        }
        return name;
    }

}
