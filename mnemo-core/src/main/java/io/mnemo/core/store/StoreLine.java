package io.mnemo.core.store;

public record StoreLine(int number, String text, String encodingError) {

    public StoreLine(int number, String text) {
        this(number, text, null);
    }

    static StoreLine undecodable(int number, String encodingError) {
        return new StoreLine(number, null, encodingError);
    }

    public boolean isUndecodable() {
        return encodingError != null;
    }

    public MemoryRecord decode() {
        if (isUndecodable()) {
            throw new StoreDecodeException(StoreDecodeException.Kind.MALFORMED, "invalid UTF-8: " + encodingError);
        }
        return StoreCodec.decode(text);
    }
}
