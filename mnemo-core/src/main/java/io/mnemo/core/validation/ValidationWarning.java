package io.mnemo.core.validation;

public record ValidationWarning(Kind kind, String message) {

    public enum Kind {
        SIZE_PRESSURE
    }
}
