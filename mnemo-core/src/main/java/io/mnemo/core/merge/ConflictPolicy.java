package io.mnemo.core.merge;

import io.mnemo.core.store.EntityRecord;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public enum ConflictPolicy {
    REMOTE_WINS("remote-wins") {
        @Override
        public EntityRecord resolve(EntityRecord local, EntityRecord remote) {
            return remote;
        }
    },
    LOCAL_WINS("local-wins") {
        @Override
        public EntityRecord resolve(EntityRecord local, EntityRecord remote) {
            return local;
        }
    },
    NEWEST_WINS("newest-wins") {
        @Override
        public EntityRecord resolve(EntityRecord local, EntityRecord remote) {
            // ties and missing timestamps keep local
            return timestampOf(remote) > timestampOf(local) ? remote : local;
        }
    };

    public static final ConflictPolicy DEFAULT = REMOTE_WINS;

    private static final Pattern TIMESTAMP_OBSERVATION = Pattern.compile("^\\s*timestamp\\s*[:=]\\s*(-?\\d+)\\s*$");

    private final String label;

    ConflictPolicy(String label) {
        this.label = label;
    }

    public abstract EntityRecord resolve(EntityRecord local, EntityRecord remote);

    public String label() {
        return label;
    }

    public static ConflictPolicy fromLabel(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (ConflictPolicy policy : values()) {
            if (policy.label.equals(normalized)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown conflict policy: " + value + " (expected remote-wins, local-wins or newest-wins)");
    }

    static long timestampOf(EntityRecord entity) {
        if (entity.timestamp() != null) {
            return entity.timestamp();
        }
        for (String observation : entity.observations()) {
            if (observation == null) {
                continue;
            }
            Matcher matcher = TIMESTAMP_OBSERVATION.matcher(observation);
            if (matcher.matches()) {
                try {
                    return Long.parseLong(matcher.group(1));
                } catch (NumberFormatException ignored) {
                    return 0L;
                }
            }
        }
        return 0L;
    }
}
