package io.mnemo.core.config;

import static org.assertj.core.api.Assertions.assertThat;

import io.mnemo.core.config.model.MnemoConfig;
import io.mnemo.core.config.model.WorkspaceConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadDefaultsWhenConfigMissing() throws Exception {
        MnemoConfig config = new ConfigService().load(tempDir.resolve("config.json"));

        assertThat(config.validation().frameworkPrefix()).isEqualTo("AIPM_");
        assertThat(config.merge().conflictPolicy()).isEqualTo("remote-wins");
        assertThat(config.handoff().releaseTimeoutMillis()).isEqualTo(30_000);
        assertThat(config.workspace().liveStore()).isEqualTo(".aipm/memory.json");
    }

    @Test
    void shouldMergeDefaultsWithExistingValues() throws Exception {
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "validation": {
                "strictDuplicates": true,
                "projectPrefixes": { "legacy": "OLD_" }
              },
              "merge": { "conflictPolicy": "newest-wins" },
              "unknown": 1
            }
            """);

        MnemoConfig config = new ConfigService().load(configPath);

        assertThat(config.validation().strictDuplicates()).isTrue();
        assertThat(config.validation().projectPrefixes()).containsEntry("legacy", "OLD_");
        assertThat(config.validation().frameworkPrefix()).isEqualTo("AIPM_");
        assertThat(config.validation().maxErrors()).isEqualTo(10);
        assertThat(config.merge().conflictPolicy()).isEqualTo("newest-wins");
        assertThat(config.handoff().settleMillis()).isEqualTo(500);
    }

    @Test
    void initShouldCreateConfigAndWorkspaceDirectories() throws Exception {
        Path configPath = tempDir.resolve(".mnemo/config.json");
        Path workspace = tempDir.resolve("ws");
        Files.createDirectories(configPath.getParent());
        Files.writeString(configPath, "{\"workspace\": {\"root\": \"" + workspace.toString().replace("\\", "\\\\") + "\"}}");

        InitResult result = new ConfigService().init(configPath, false);

        assertThat(result.createdConfig()).isFalse();
        assertThat(result.workspacePath()).isEqualTo(workspace);
        assertThat(workspace.resolve(".memory")).isDirectory();
        assertThat(workspace.resolve(".aipm")).isDirectory();
        assertThat(Files.readString(configPath)).contains("\"frameworkPrefix\" : \"AIPM_\"");
    }

    @Test
    void resolveLiveStoreShouldHonorAbsolutePaths() {
        Path absolute = tempDir.resolve("elsewhere/memory.json");
        MnemoConfig defaults = MnemoConfig.defaults();
        MnemoConfig config = new MnemoConfig(
            new WorkspaceConfig(tempDir.toString(), absolute.toString()),
            defaults.validation(),
            defaults.merge(),
            defaults.handoff()
        );

        assertThat(ConfigPaths.resolveLiveStore(config)).isEqualTo(absolute);
        assertThat(ConfigPaths.resolveWorkspace(config)).isEqualTo(tempDir);
    }
}
