package org.dxworks.flowframe.model;

import java.util.List;

public final class ValidationResult {
    public final boolean isValid;
    public final List<String> errors;
    public final List<String> warnings;

    public ValidationResult(List<String> errors, List<String> warnings) {
        this.errors = List.copyOf(errors);
        this.warnings = List.copyOf(warnings);
        this.isValid = this.errors.isEmpty();
    }
}
