package io.mnemo.core.store;

public record RelationRecord(String from, String to, String relationType) implements MemoryRecord {

    public static RelationRecord of(String from, String to, String relationType) {
        return new RelationRecord(from, to, relationType);
    }

    public RelationKey key() {
        return new RelationKey(from, to, relationType);
    }

    @Override
    public RecordKind kind() {
        return RecordKind.RELATION;
    }
}
