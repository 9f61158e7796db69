package com.example.paylog.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

@Getter
@ToString
@EqualsAndHashCode
public final class ValidationResult {
    private final boolean valid;
    private final List<String> errors;
    private final List<String> warnings;

    private ValidationResult(boolean valid, List<String> errors, List<String> warnings) {
        this.valid = valid;
        this.errors = List.copyOf(errors);
        this.warnings = List.copyOf(warnings);
    }

    public static ValidationResult of(List<String> errors, List<String> warnings) {
        return new ValidationResult(errors.isEmpty(), errors, warnings);
    }

    public static ValidationResult success() {
        return new ValidationResult(true, List.of(), List.of());
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
