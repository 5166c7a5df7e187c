package io.mnemo.core.merge;

import io.mnemo.core.store.StoreDecodeException;
import java.io.IOException;
import java.nio.file.Path;

public final class MergeInputException extends IOException {
    private final transient Path input;
    private final int lineNumber;

    public MergeInputException(Path input, StoreDecodeException cause) {
        super("Cannot merge " + input + ": " + cause.getMessage(), cause);
        this.input = input;
        this.lineNumber = cause.lineNumber();
    }

    public Path input() {
        return input;
    }

    public int lineNumber() {
        return lineNumber;
    }
}
