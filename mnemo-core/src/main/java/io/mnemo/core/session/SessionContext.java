package io.mnemo.core.session;

import java.util.Objects;

public record SessionContext(ContextKind kind, String projectName) {
    private static final String FRAMEWORK_LABEL = "framework";
    private static final String PROJECT_LABEL_PREFIX = "project:";

    public SessionContext {
        Objects.requireNonNull(kind, "kind must not be null");
        if (kind == ContextKind.FRAMEWORK) {
            projectName = null;
        } else {
            requireProjectName(projectName);
        }
    }

    public static SessionContext framework() {
        return new SessionContext(ContextKind.FRAMEWORK, null);
    }

    public static SessionContext project(String name) {
        return new SessionContext(ContextKind.PROJECT, name);
    }

    public static SessionContext parse(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Context must not be blank");
        }
        String trimmed = label.trim();
        if (FRAMEWORK_LABEL.equalsIgnoreCase(trimmed)) {
            return framework();
        }
        if (trimmed.startsWith(PROJECT_LABEL_PREFIX)) {
            return project(trimmed.substring(PROJECT_LABEL_PREFIX.length()));
        }
        throw new IllegalArgumentException("Unknown context '" + label + "'; expected framework or project:<name>");
    }

    public String label() {
        return kind == ContextKind.FRAMEWORK ? FRAMEWORK_LABEL : PROJECT_LABEL_PREFIX + projectName;
    }

    public boolean isFramework() {
        return kind == ContextKind.FRAMEWORK;
    }

    private static void requireProjectName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Project name must not be blank");
        }
        if (name.contains("/") || name.contains("\\") || name.equals(".") || name.equals("..")) {
            throw new IllegalArgumentException("Project name must be a single directory name: " + name);
        }
    }

    @Override
    public String toString() {
        return label();
    }
}
