package io.mnemo.core.validation;

import java.util.Locale;

public record NamingPolicy(String expectedPrefix, boolean caseInsensitive, boolean strictDuplicates) {

    public NamingPolicy {
        expectedPrefix = expectedPrefix == null ? "" : expectedPrefix;
    }

    public static NamingPolicy prefix(String expectedPrefix) {
        return new NamingPolicy(expectedPrefix, false, false);
    }

    public static NamingPolicy structural() {
        return new NamingPolicy("", false, false);
    }

    public NamingPolicy withStrictDuplicates(boolean strict) {
        return new NamingPolicy(expectedPrefix, caseInsensitive, strict);
    }

    public boolean checksPrefix() {
        return !expectedPrefix.isBlank();
    }

    public boolean matches(String name) {
        if (!checksPrefix()) {
            return true;
        }
        if (name == null) {
            return false;
        }
        if (caseInsensitive) {
            return name.toLowerCase(Locale.ROOT).startsWith(expectedPrefix.toLowerCase(Locale.ROOT));
        }
        return name.startsWith(expectedPrefix);
    }
}
