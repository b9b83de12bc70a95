package com.github.asymptotic;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.asymptotic.cost.ComplexityHint;
import com.github.asymptotic.cost.ComplexityLiteral;
import com.github.asymptotic.parser.SyntaxException;

public class Tokenizer {

    private static final Logger logger = LoggerFactory.getLogger(Tokenizer.class);

    static final String HINT_MARKER = "►";

    private static final Map<String, TokenType> KEYWORDS = new HashMap<>();

    static {
        for (var tokenType : TokenType.values()) {
            for (var keyword : tokenType.keywords) {
                KEYWORDS.put(keyword, tokenType);
            }
        }
    }

    List<Pattern> patterns = new ArrayList<>();

    {
        for (var tokenType : TokenType.values()) {
            for (var constantPattern : tokenType.constantPatterns) {
                patterns.add(new StaticPattern(constantPattern, tokenType));
            }
        }

        patterns.add(new IdentifierPattern());
        patterns.add(new NumberPattern());
        patterns.add(new CommentPattern());
        patterns.add(new HintPattern());

        // comments and hints before operators, then longest operator first so "<-" wins over "<"
        patterns.sort(Comparator.comparingInt((Pattern p) -> {
            if (p instanceof CommentPattern || p instanceof HintPattern) {
                return Integer.MAX_VALUE;
            }
            return p instanceof StaticPattern sp ? sp.pattern.length() : Integer.MIN_VALUE;
        }).reversed());
    }

    public Tokens tokenize(String programString) {
        var lines = new LineIndex(programString);
        List<Token> tokens = new ArrayList<>();

        int index = 0;
        while (index < programString.length()) {
            if (Character.isWhitespace(programString.charAt(index))) {
                index++;
                continue;
            }

            boolean gotMatch = false;
            for (var pattern : patterns) {
                var result = pattern.match(programString, index, lines);
                if (result.isPresent()) {
                    var token = result.get();
                    tokens.add(token);
                    index = token.position().offset() + token.image().length();
                    gotMatch = true;
                    break;
                }
            }
            if (!gotMatch) {
                int codePoint = programString.codePointAt(index);
                throw new LexException(lines.positionOf(index), new String(Character.toChars(codePoint)));
            }
        }

        tokens.add(new Token(TokenType.EOF, "", lines.positionOf(index)));
        logger.debug("Tokenized {} characters into {} tokens", programString.length(), tokens.size());

        return new Tokens(tokens);
    }

    interface Pattern {
        Optional<Token> match(String programString, int index, LineIndex lines);
    }

    static class StaticPattern implements Pattern {
        String pattern;
        TokenType tokenType;

        public StaticPattern(String pattern, TokenType tokenType) {
            this.pattern = pattern;
            this.tokenType = tokenType;
        }

        @Override
        public Optional<Token> match(String programString, int index, LineIndex lines) {
            if (programString.startsWith(pattern, index)) {
                return Optional.of(new Token(tokenType, pattern, lines.positionOf(index)));
            } else {
                return Optional.empty();
            }
        }
    }

    static class NumberPattern implements Pattern {
        @Override
        public Optional<Token> match(String programString, int index, LineIndex lines) {
            if (Character.isDigit(programString.charAt(index))) {
                int start = index;
                while (index < programString.length() && Character.isDigit(programString.charAt(index))) {
                    index++;
                }
                if (index + 1 < programString.length() && programString.charAt(index) == '.'
                        && Character.isDigit(programString.charAt(index + 1))) {
                    index++;
                    while (index < programString.length() && Character.isDigit(programString.charAt(index))) {
                        index++;
                    }
                }
                return Optional.of(new Token(TokenType.NUMBER, programString.substring(start, index), lines.positionOf(start)));
            } else {
                return Optional.empty();
            }
        }
    }

    static class IdentifierPattern implements Pattern {
        @Override
        public Optional<Token> match(String programString, int index, LineIndex lines) {
            if (Character.isLetter(programString.charAt(index)) || programString.charAt(index) == '_') {
                int start = index;
                while (index < programString.length()
                        && (Character.isLetterOrDigit(programString.charAt(index)) || programString.charAt(index) == '_')) {
                    index++;
                }
                var image = programString.substring(start, index);
                var type = KEYWORDS.getOrDefault(image.toLowerCase(Locale.ROOT), TokenType.IDENTIFIER);
                return Optional.of(new Token(type, image, lines.positionOf(start)));
            } else {
                return Optional.empty();
            }
        }
    }

    static class CommentPattern implements Pattern {
        @Override
        public Optional<Token> match(String programString, int index, LineIndex lines) {
            if (programString.startsWith("//", index)) {
                int start = index;
                index = endOfLine(programString, index);
                return Optional.of(new Token(TokenType.COMMENT, programString.substring(start, index), lines.positionOf(start)));
            } else {
                return Optional.empty();
            }
        }
    }

    /**
     * The hint marker either introduces a Big-O literal such as {@code ► O(n^2)} or, when
     * followed by free text, a comment running to the end of the line.
     */
    static class HintPattern implements Pattern {
        @Override
        public Optional<Token> match(String programString, int index, LineIndex lines) {
            if (!programString.startsWith(HINT_MARKER, index)) {
                return Optional.empty();
            }
            int start = index;
            int cursor = index + HINT_MARKER.length();
            while (cursor < programString.length() && programString.charAt(cursor) != '\n'
                    && Character.isWhitespace(programString.charAt(cursor))) {
                cursor++;
            }
            if (!startsBoundLiteral(programString, cursor)) {
                int end = endOfLine(programString, cursor);
                return Optional.of(new Token(TokenType.COMMENT, programString.substring(start, end), lines.positionOf(start)));
            }

            int open = programString.indexOf('(', cursor);
            int depth = 0;
            int close = -1;
            for (int i = open; i < programString.length() && programString.charAt(i) != '\n'; i++) {
                char c = programString.charAt(i);
                if (c == '(') {
                    depth++;
                } else if (c == ')') {
                    depth--;
                    if (depth == 0) {
                        close = i;
                        break;
                    }
                }
            }
            if (close < 0) {
                throw new LexException(lines.positionOf(cursor), programString.substring(cursor, endOfLine(programString, cursor)),
                        "unterminated complexity hint");
            }

            var literal = programString.substring(cursor, close + 1);
            var literalPosition = lines.positionOf(cursor);
            var hint = ComplexityLiteral.parseHint(literal)
                    .orElseThrow(() -> new LexException(literalPosition, literal, "malformed complexity hint"));
            return Optional.of(new Token(TokenType.HINT, programString.substring(start, close + 1), lines.positionOf(start), hint));
        }

        private static boolean startsBoundLiteral(String programString, int cursor) {
            if (cursor >= programString.length()) {
                return false;
            }
            char c = programString.charAt(cursor);
            if (c != 'O' && c != 'Θ' && c != 'Ω') {
                return false;
            }
            int next = cursor + 1;
            while (next < programString.length() && programString.charAt(next) == ' ') {
                next++;
            }
            return next < programString.length() && programString.charAt(next) == '(';
        }
    }

    private static int endOfLine(String programString, int index) {
        while (index < programString.length() && programString.charAt(index) != '\n') {
            index++;
        }
        return index;
    }

    /** Maps character offsets to 1-based line and column numbers. */
    static class LineIndex {
        private final int[] lineStarts;

        LineIndex(String programString) {
            List<Integer> starts = new ArrayList<>();
            starts.add(0);
            for (int i = 0; i < programString.length(); i++) {
                if (programString.charAt(i) == '\n') {
                    starts.add(i + 1);
                }
            }
            lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
        }

        Position positionOf(int offset) {
            int line = Arrays.binarySearch(lineStarts, offset);
            if (line < 0) {
                line = -line - 2;
            }
            return new Position(offset, line + 1, offset - lineStarts[line] + 1);
        }
    }

    public record Position(int offset, int line, int column) {
        @Override
        public String toString() {
            return line + ":" + column;
        }
    }

    public record Token(TokenType type, String image, Position position, ComplexityHint hint) {
        public Token(TokenType type, String image, Position position) {
            this(type, image, position, null);
        }
    }

    public enum TokenType {
        BEGIN(List.of(), "begin"),
        END(List.of(), "end"),
        FOR(List.of(), "for"),
        TO(List.of(), "to"),
        DO(List.of(), "do"),
        WHILE(List.of(), "while"),
        REPEAT(List.of(), "repeat"),
        UNTIL(List.of(), "until"),
        IF(List.of(), "if"),
        THEN(List.of(), "then"),
        ELSE(List.of(), "else"),
        RETURN(List.of(), "return"),
        CALL(List.of(), "call"),
        LENGTH(List.of(), "length"),
        AND(List.of("&&"), "and"),
        OR(List.of("||"), "or"),
        NOT(List.of(), "not"),
        MOD(List.of("%"), "mod"),
        DIV(List.of(), "div"),
        UNSUPPORTED(List.of(), "switch", "case", "goto", "foreach", "class"),

        NUMBER,
        IDENTIFIER,
        HINT,
        COMMENT,

        ARROW(List.of("🡨", "←", "<-", ":=")),
        EQUALS_EQUALS(List.of("==")),
        NOT_EQUALS(List.of("!=", "<>", "≠")),
        LE(List.of("<=", "≤")),
        GE(List.of(">=", "≥")),
        LT(List.of("<")),
        GT(List.of(">")),
        EQUALS(List.of("=")),
        PLUS(List.of("+")),
        MINUS(List.of("-")),
        STAR(List.of("*", "×")),
        SLASH(List.of("/")),
        CARET(List.of("^")),

        LPAREN(List.of("(")),
        RPAREN(List.of(")")),
        LBRACKET(List.of("[")),
        RBRACKET(List.of("]")),
        DOT(List.of(".")),
        COMMA(List.of(",")),
        SEMICOLON(List.of(";")),
        EOF;

        final List<String> constantPatterns;
        final List<String> keywords;

        private TokenType() {
            this(List.of());
        }
        private TokenType(List<String> constantPatterns, String... keywords) {
            this.constantPatterns = constantPatterns;
            this.keywords = List.of(keywords);
        }

        public boolean isComparison() {
            return this == EQUALS || this == EQUALS_EQUALS || this == NOT_EQUALS
                || this == LT || this == GT || this == LE || this == GE;
        }
    }

    public static class Tokens {
        final List<Token> tokens;
        int index;

        Tokens(List<Token> tokens) {
            this.tokens = tokens;
        }

        public Token next() {
            skipComments();
            var token = tokens.get(index);
            if (token.type() != TokenType.EOF) {
                index++;
            }
            return token;
        }

        public Token peek() {
            skipComments();
            return tokens.get(index);
        }

        /** Looks past the next token; comments are not counted. */
        public Token peek(int ahead) {
            skipComments();
            int cursor = index;
            while (true) {
                var token = tokens.get(cursor);
                if (token.type() == TokenType.EOF) {
                    return token;
                }
                if (token.type() != TokenType.COMMENT) {
                    if (ahead == 0) {
                        return token;
                    }
                    ahead--;
                }
                cursor++;
            }
        }

        /** The last token consumed by {@link #next()}, or {@code null} at the start. */
        public Token previous() {
            int cursor = index - 1;
            while (cursor >= 0 && tokens.get(cursor).type() == TokenType.COMMENT) {
                cursor--;
            }
            return cursor < 0 ? null : tokens.get(cursor);
        }

        public boolean matches(TokenType... types) {
            TokenType peekType = peek().type();
            for (var type : types) {
                if (peekType == type) {
                    return true;
                }
            }
            return false;
        }

        public Token peek(TokenType type) {
            var token = peek();
            if (token.type() != type) {
                throw new SyntaxException(token.position(), describe(type), describe(token));
            }
            return token;
        }

        public Token next(TokenType type) {
            var token = peek(type);
            next();
            return token;
        }

        public Token next(TokenType type, String construct) {
            var token = peek();
            if (token.type() != type) {
                throw new SyntaxException(token.position(), construct, describe(token));
            }
            return next();
        }

        public List<Token> all() {
            return List.copyOf(tokens);
        }

        private void skipComments() {
            while (tokens.get(index).type() == TokenType.COMMENT) {
                index++;
            }
        }

        static String describe(TokenType type) {
            var patterns = type.keywords.isEmpty() ? type.constantPatterns : type.keywords;
            return patterns.isEmpty() ? type.name().toLowerCase(Locale.ROOT) : "'" + patterns.get(0) + "'";
        }

        static String describe(Token token) {
            return token.type() == TokenType.EOF ? "end of input" : "'" + token.image() + "'";
        }
    }

}
