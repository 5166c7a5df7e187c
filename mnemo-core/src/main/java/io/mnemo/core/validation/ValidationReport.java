package io.mnemo.core.validation;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

public record ValidationReport(
    Path path,
    long entityCount,
    long relationCount,
    int linesScanned,
    List<ValidationError> errors,
    List<ValidationWarning> warnings
) {

    public ValidationReport {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static ValidationReport empty(Path path) {
        return new ValidationReport(path, 0, 0, 0, List.of(), List.of());
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public boolean truncated() {
        return errors.stream().anyMatch(error -> error.kind() == ValidationErrorKind.TOO_MANY_ERRORS);
    }

    public String summary() {
        if (isValid()) {
            return "valid: " + entityCount + " entities, " + relationCount + " relations";
        }
        return errors.stream()
            .limit(5)
            .map(ValidationError::toString)
            .collect(Collectors.joining("; ", errors.size() + " error(s): ", errors.size() > 5 ? "; ..." : ""));
    }
}
