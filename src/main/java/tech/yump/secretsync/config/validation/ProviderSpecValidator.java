package tech.yump.secretsync.config.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import tech.yump.secretsync.store.ProviderSpec;

public class ProviderSpecValidator implements ConstraintValidator<ValidProviderSpec, ProviderSpec> {

    @Override
    public boolean isValid(ProviderSpec value, ConstraintValidatorContext context) {
        if (value == null) {
            return true; // @NotNull on the field reports missing specs
        }
        return value.configuredVariants().size() == 1;
    }
}
