package io.mnemo.core.session;

import io.mnemo.core.config.model.ValidationConfig;
import io.mnemo.core.validation.NamingPolicy;
import java.util.Locale;
import java.util.Objects;

public final class ContextPolicies {
    private final ValidationConfig config;

    public ContextPolicies(ValidationConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    public NamingPolicy forContext(SessionContext context) {
        return new NamingPolicy(prefixFor(context), config.caseInsensitivePrefix(), config.strictDuplicates());
    }

    public String prefixFor(SessionContext context) {
        if (context.isFramework()) {
            return config.frameworkPrefix();
        }
        String configured = config.projectPrefixes().get(context.projectName());
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        return derivedPrefix(context.projectName());
    }

    static String derivedPrefix(String projectName) {
        return projectName.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]", "_") + "_";
    }
}
