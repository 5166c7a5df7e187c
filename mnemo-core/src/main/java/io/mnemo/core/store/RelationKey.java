package io.mnemo.core.store;

public record RelationKey(String from, String to, String relationType) {
}
