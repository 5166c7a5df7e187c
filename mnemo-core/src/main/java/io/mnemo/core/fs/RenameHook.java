package io.mnemo.core.fs;

import java.io.IOException;
import java.nio.file.Path;

@FunctionalInterface
public interface RenameHook {
    RenameHook NONE = (staged, target) -> {
    };

    void beforeRename(Path staged, Path target) throws IOException;
}
