package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkspaceConfig(String root, String liveStore) {

    public static WorkspaceConfig defaults() {
        return new WorkspaceConfig(".", ".aipm/memory.json");
    }
}
