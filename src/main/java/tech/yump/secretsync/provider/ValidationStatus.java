package tech.yump.secretsync.provider;

import org.springframework.lang.Nullable;
import tech.yump.secretsync.provider.error.SecretSyncException;

/**
 * Outcome of {@link SecretsClient#validate()}: the result plus the error that caused an {@link ValidationResult#ERROR}.
 */
public record ValidationStatus(ValidationResult result, @Nullable SecretSyncException error) {

    private static final ValidationStatus READY = new ValidationStatus(ValidationResult.READY, null);
    private static final ValidationStatus UNKNOWN = new ValidationStatus(ValidationResult.UNKNOWN, null);

    public static ValidationStatus ready() {
        return READY;
    }

    public static ValidationStatus unknown() {
        return UNKNOWN;
    }

    public static ValidationStatus error(SecretSyncException error) {
        return new ValidationStatus(ValidationResult.ERROR, error);
    }

    public boolean isReady() {
        return result == ValidationResult.READY;
    }
}
