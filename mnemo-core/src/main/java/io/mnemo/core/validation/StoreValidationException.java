package io.mnemo.core.validation;

import java.io.IOException;

public class StoreValidationException extends IOException {
    private final transient ValidationReport report;

    public StoreValidationException(String message, ValidationReport report) {
        super(message + " (" + report.summary() + ")");
        this.report = report;
    }

    public ValidationReport report() {
        return report;
    }
}
