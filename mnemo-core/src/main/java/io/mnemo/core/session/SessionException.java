package io.mnemo.core.session;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

public final class SessionException extends IOException {
    private final Path recoveryFile;

    public SessionException(String message, Path recoveryFile, Throwable cause) {
        super(recoveryFile == null ? message : message + "; live store backup kept at " + recoveryFile, cause);
        this.recoveryFile = recoveryFile;
    }

    public Optional<Path> recoveryFile() {
        return Optional.ofNullable(recoveryFile);
    }
}
