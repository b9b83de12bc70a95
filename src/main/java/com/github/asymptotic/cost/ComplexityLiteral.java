package com.github.asymptotic.cost;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads Big-O style literals such as {@code O(n^2)}, {@code Θ(n log n)} or {@code O(2^n)}
 * into the {@link CostExpression} vocabulary.
 * <p>
 * The argument is read as a product of factors separated by blanks, {@code *} or {@code ·}:
 * plain numbers, size variables with an optional exponent, {@code log}/{@code lg} of a size
 * variable with an optional power, {@code sqrt(n)} and constant powers {@code c^n}.
 */
public final class ComplexityLiteral {

    private static final Pattern BOUND = Pattern.compile("^\\s*([OΘΩ])\\s*\\((.*)\\)\\s*$");

    private static final Pattern NUMBER = Pattern.compile("\\d+(\\.\\d+)?");
    private static final Pattern EXPONENTIAL = Pattern.compile("(\\d+(\\.\\d+)?)\\^[a-z]\\w*");
    private static final Pattern POWER = Pattern.compile("([a-z]\\w*)(\\^(\\d+(\\.\\d+)?))?");
    private static final Pattern LOG = Pattern.compile("(log|lg)(\\^(\\d+))?(\\(?[a-z]\\w*\\)?)?");
    private static final Pattern SQRT = Pattern.compile("(sqrt|√)\\(?[a-z]\\w*\\)?");

    private ComplexityLiteral() {
    }

    public static Optional<ComplexityHint> parseHint(String literal) {
        Matcher matcher = BOUND.matcher(literal);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return parseCost(matcher.group(2))
                .map(cost -> new ComplexityHint(ComplexityHint.Bound.of(matcher.group(1).charAt(0)), cost, literal.trim()));
    }

    /** Parses the argument of a bound, e.g. {@code n log n}. */
    public static Optional<CostExpression> parseCost(String argument) {
        var normalized = argument.toLowerCase(Locale.ROOT)
                .replace("·", " ")
                .replace("*", " ")
                .replaceAll("\\s*\\^\\s*", "^")
                .replaceAll("(log|lg|sqrt|√)\\s*\\(\\s*", "$1(")
                .replaceAll("\\s*\\)", ")")
                .trim();
        if (normalized.isEmpty()) {
            return Optional.empty();
        }

        var words = normalized.split("\\s+");
        var result = CostExpression.constant();
        for (int i = 0; i < words.length; i++) {
            var word = words[i];
            // "log n" arrives as two words
            if ((word.equals("log") || word.equals("lg") || word.matches("(log|lg)\\^\\d+"))
                    && i + 1 < words.length && words[i + 1].matches("\\(?[a-z]\\w*\\)?")) {
                word = word + words[++i];
            }
            var factor = parseFactor(word);
            if (factor.isEmpty()) {
                return Optional.empty();
            }
            result = result.times(factor.get());
        }
        return Optional.of(result);
    }

    private static Optional<CostExpression> parseFactor(String word) {
        if (NUMBER.matcher(word).matches()) {
            return Optional.of(CostExpression.constant());
        }
        Matcher m = EXPONENTIAL.matcher(word);
        if (m.matches()) {
            double base = Double.parseDouble(m.group(1));
            return base <= 1 ? Optional.of(CostExpression.constant()) : Optional.of(CostExpression.exponential(base));
        }
        m = SQRT.matcher(word);
        if (m.matches()) {
            return Optional.of(CostExpression.polynomial(0.5));
        }
        m = LOG.matcher(word);
        if (m.matches() && m.group(4) != null) {
            int power = m.group(3) == null ? 1 : Integer.parseInt(m.group(3));
            return Optional.of(CostExpression.polynomial(0, power));
        }
        m = POWER.matcher(word);
        if (m.matches() && !word.startsWith("log") && !word.startsWith("lg")) {
            double degree = m.group(3) == null ? 1 : Double.parseDouble(m.group(3));
            return Optional.of(CostExpression.polynomial(degree));
        }
        return Optional.empty();
    }

}
