package io.mnemo.core.session;

import java.nio.file.Path;
import java.util.Objects;

public record ContextPaths(Path memoryDir, Path snapshot, Path backup) {
    public static final String MEMORY_DIR = ".memory";
    public static final String SNAPSHOT_FILE = "local_memory.json";
    public static final String BACKUP_FILE = "backup.json";

    public static ContextPaths resolve(Path workspace, SessionContext context) {
        Objects.requireNonNull(workspace, "workspace must not be null");
        Objects.requireNonNull(context, "context must not be null");
        Path base = context.isFramework() ? workspace : workspace.resolve(context.projectName());
        Path memoryDir = base.resolve(MEMORY_DIR);
        return new ContextPaths(memoryDir, memoryDir.resolve(SNAPSHOT_FILE), memoryDir.resolve(BACKUP_FILE));
    }
}
