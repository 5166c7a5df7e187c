package io.mnemo.core.store;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public record EntityRecord(
    String name,
    String entityType,
    List<String> observations,
    Long timestamp
) implements MemoryRecord {

    public EntityRecord {
        observations = observations == null
            ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(observations));
    }

    public static EntityRecord of(String name, String entityType, String... observations) {
        return new EntityRecord(name, entityType, Arrays.asList(observations), null);
    }

    public EntityRecord withTimestamp(long epochMillis) {
        return new EntityRecord(name, entityType, observations, epochMillis);
    }

    @Override
    public RecordKind kind() {
        return RecordKind.ENTITY;
    }
}
