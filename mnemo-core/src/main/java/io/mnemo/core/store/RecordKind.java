package io.mnemo.core.store;

import java.util.Locale;

public enum RecordKind {
    ENTITY("entity"),
    RELATION("relation");

    private final String wireName;

    RecordKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static RecordKind fromWireName(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (RecordKind kind : values()) {
            if (kind.wireName.equals(normalized)) {
                return kind;
            }
        }
        return null;
    }
}
