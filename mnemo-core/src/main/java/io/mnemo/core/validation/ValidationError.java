package io.mnemo.core.validation;

public record ValidationError(ValidationErrorKind kind, int lineNumber, String message) {

    @Override
    public String toString() {
        String where = lineNumber > 0 ? "line " + lineNumber + ": " : "";
        return where + kind + " " + message;
    }
}
