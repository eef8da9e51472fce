package com.usermanagement.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * The annotated string must have at least {@link #min()} characters once leading and
 * trailing whitespace is removed. Null and blank values are accepted; combine with
 * {@code @NotBlank} to require a value.
 */
@Documented
@Constraint(validatedBy = TrimmedSizeValidator.class)
@Target({ElementType.FIELD, ElementType.PARAMETER})
@Retention(RetentionPolicy.RUNTIME)
public @interface TrimmedSize {

    int min();

    String message() default "must be at least {min} characters long";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
