package io.mnemo.core.store;

public final class StoreDecodeException extends RuntimeException {
    private final Kind kind;
    private final int lineNumber;

    public StoreDecodeException(Kind kind, String message) {
        this(kind, 0, message, null);
    }

    public StoreDecodeException(Kind kind, String message, Throwable cause) {
        this(kind, 0, message, cause);
    }

    private StoreDecodeException(Kind kind, int lineNumber, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.lineNumber = lineNumber;
    }

    public Kind kind() {
        return kind;
    }

    public int lineNumber() {
        return lineNumber;
    }

    StoreDecodeException atLine(int line) {
        return new StoreDecodeException(kind, line, "line " + line + ": " + getMessage(), getCause());
    }

    public enum Kind {
        MALFORMED,
        UNKNOWN_KIND
    }
}
