package io.mnemo.core.session;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionRecord(
    String id,
    String context,
    Instant startedAt,
    String liveStore,
    String snapshot,
    String backup
) {

    @JsonIgnore
    public SessionContext sessionContext() {
        return SessionContext.parse(context);
    }
}
