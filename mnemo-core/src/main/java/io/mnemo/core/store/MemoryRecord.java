package io.mnemo.core.store;

public sealed interface MemoryRecord permits EntityRecord, RelationRecord {

    RecordKind kind();
}
