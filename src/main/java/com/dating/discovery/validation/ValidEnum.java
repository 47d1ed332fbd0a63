package com.dating.discovery.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.*;

/**
 * The annotated string must name a constant of {@link #enumClass()}. Surrounding whitespace is ignored.
 * Null passes; pair with {@code @NotBlank} when the value is required.
 */
@Documented
@Constraint(validatedBy = EnumValidator.class)
@Target({ElementType.FIELD, ElementType.PARAMETER})
@Retention(RetentionPolicy.RUNTIME)
public @interface ValidEnum {
    Class<? extends Enum<?>> enumClass();

    boolean ignoreCase() default true;

    String message() default "must name a supported value";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
