package tech.yump.secretsync.config.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

@Documented
@Constraint(validatedBy = ProviderSpecValidator.class)
@Target({ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
public @interface ValidProviderSpec {
    String message() default "Exactly one store provider (memory, local or aws) must be configured.";
    Class<?>[] groups() default {};
    Class<? extends Payload>[] payload() default {};
}
