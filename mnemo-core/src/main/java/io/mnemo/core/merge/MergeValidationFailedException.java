package io.mnemo.core.merge;

import io.mnemo.core.validation.StoreValidationException;
import io.mnemo.core.validation.ValidationReport;

public final class MergeValidationFailedException extends StoreValidationException {

    public MergeValidationFailedException(String message, ValidationReport report) {
        super(message, report);
    }
}
