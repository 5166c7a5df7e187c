package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ValidationConfig(
    String frameworkPrefix,
    Map<String, String> projectPrefixes,
    boolean caseInsensitivePrefix,
    boolean strictDuplicates,
    int maxErrors,
    long sizeWarningBytes
) {

    public ValidationConfig {
        projectPrefixes = projectPrefixes == null ? Map.of() : Map.copyOf(projectPrefixes);
    }

    public static ValidationConfig defaults() {
        return new ValidationConfig(
            "AIPM_",
            Map.of(),
            false,
            false,
            10,
            10L * 1024 * 1024
        );
    }
}
