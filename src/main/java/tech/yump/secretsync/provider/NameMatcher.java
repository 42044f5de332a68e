package tech.yump.secretsync.provider;

import tech.yump.secretsync.provider.error.InvalidPatternException;

import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A compiled secret-name filter. Matching is against the whole name, not a substring.
 */
public final class NameMatcher {

    private final Pattern pattern;

    private NameMatcher(Pattern pattern) {
        this.pattern = pattern;
    }

    /**
     * Compiles a filter expression once per query.
     *
     * @throws InvalidPatternException if the expression is not a valid regular expression
     */
    public static NameMatcher compile(String expression) throws InvalidPatternException {
        Objects.requireNonNull(expression, "Name filter expression cannot be null.");
        try {
            return new NameMatcher(Pattern.compile(expression));
        } catch (PatternSyntaxException e) {
            throw new InvalidPatternException("Invalid name filter '" + expression + "': " + e.getDescription(), e);
        }
    }

    public boolean matches(String name) {
        return name != null && pattern.matcher(name).matches();
    }

    @Override
    public String toString() {
        return pattern.pattern();
    }
}
