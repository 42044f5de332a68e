package tech.yump.secretsync.provider;

/**
 * Tri-state health signal. {@link #UNKNOWN} means "never checked" (or the last check expired).
 */
public enum ValidationResult {
    UNKNOWN,
    READY,
    ERROR
}
