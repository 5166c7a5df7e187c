package io.mnemo.core.validation;

public enum ValidationErrorKind {
    MALFORMED,
    UNKNOWN_KIND,
    MISSING_FIELD,
    BAD_PREFIX,
    DUPLICATE_ENTITY,
    TOO_MANY_ERRORS,
    IO
}
