package tech.yump.secretsync.provider;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.yump.secretsync.provider.error.ErrorKind;
import tech.yump.secretsync.provider.error.InvalidPatternException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NameMatcherTest {

    @Test
    @DisplayName("matches: Should match the whole name only")
    void matches_wholeName() {
        NameMatcher matcher = NameMatcher.compile("test-.*");

        assertThat(matcher.matches("test-db")).isTrue();
        assertThat(matcher.matches("prod-test-db")).isFalse();
        assertThat(matcher.matches(null)).isFalse();
    }

    @Test
    @DisplayName("matches: Anchored expressions behave the same as unanchored ones")
    void matches_anchoredExpression() {
        NameMatcher matcher = NameMatcher.compile("^test-.*");

        assertThat(matcher.matches("test-db")).isTrue();
        assertThat(matcher.matches("other")).isFalse();
    }

    @Test
    @DisplayName("compile: Should reject an invalid expression with INVALID_PATTERN")
    void compile_invalidExpression_throws() {
        assertThatThrownBy(() -> NameMatcher.compile("["))
                .isInstanceOf(InvalidPatternException.class)
                .hasMessageContaining("Invalid name filter '['")
                .satisfies(e -> assertThat(((InvalidPatternException) e).getKind()).isEqualTo(ErrorKind.INVALID_PATTERN));
    }
}
