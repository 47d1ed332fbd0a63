package com.dating.discovery.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

public class EnumValidator implements ConstraintValidator<ValidEnum, String> {
    private Set<String> accepted;
    private boolean ignoreCase;

    @Override
    public void initialize(ValidEnum annotation) {
        ignoreCase = annotation.ignoreCase();
        accepted = Arrays.stream(annotation.enumClass().getEnumConstants())
                .map(e -> normalise(e.name()))
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return value == null || accepted.contains(normalise(value.trim()));
    }

    private String normalise(String value) {
        return ignoreCase ? value.toLowerCase(Locale.ROOT) : value;
    }
}
