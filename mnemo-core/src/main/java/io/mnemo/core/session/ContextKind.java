package io.mnemo.core.session;

public enum ContextKind {
    FRAMEWORK,
    PROJECT
}
