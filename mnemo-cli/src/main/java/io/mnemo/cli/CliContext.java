package io.mnemo.cli;

import io.mnemo.core.config.ConfigService;
import io.mnemo.core.runtime.MnemoRuntime;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;

public record CliContext(ConfigService configService, Path configPath, Clock clock) {

    public CliContext(ConfigService configService, Path configPath) {
        this(configService, configPath, Clock.systemDefaultZone());
    }

    public MnemoRuntime runtime() throws IOException {
        return MnemoRuntime.create(configService.load(configPath), clock);
    }
}
