package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MergeConfig(String conflictPolicy) {

    public static MergeConfig defaults() {
        return new MergeConfig("remote-wins");
    }
}
