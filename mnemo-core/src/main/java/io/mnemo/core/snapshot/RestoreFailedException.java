package io.mnemo.core.snapshot;

import java.io.IOException;
import java.nio.file.Path;

public final class RestoreFailedException extends IOException {
    private final transient Path backupPath;

    public RestoreFailedException(Path backupPath, String message, Throwable cause) {
        super(message, cause);
        this.backupPath = backupPath;
    }

    public Path backupPath() {
        return backupPath;
    }
}
