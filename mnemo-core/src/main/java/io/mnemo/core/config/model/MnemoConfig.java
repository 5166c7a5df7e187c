package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MnemoConfig(
    WorkspaceConfig workspace,
    ValidationConfig validation,
    MergeConfig merge,
    HandoffConfig handoff
) {

    public static MnemoConfig defaults() {
        return new MnemoConfig(
            WorkspaceConfig.defaults(),
            ValidationConfig.defaults(),
            MergeConfig.defaults(),
            HandoffConfig.defaults()
        );
    }
}
