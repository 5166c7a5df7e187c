package io.mnemo.core.fs;

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Temporary sibling of a target file. Content becomes visible at the target only through
 * {@link #commit()}; closing an uncommitted stage deletes the temporary file.
 */
public final class StagedFile implements Closeable {
    private static final Logger LOG = LoggerFactory.getLogger(StagedFile.class);

    private final Path target;
    private final Path path;
    private final RenameHook renameHook;
    private boolean committed;

    StagedFile(Path target, Path path, RenameHook renameHook) {
        this.target = target;
        this.path = path;
        this.renameHook = renameHook;
    }

    public Path target() {
        return target;
    }

    public Path path() {
        return path;
    }

    public boolean committed() {
        return committed;
    }

    public void write(ContentSource source) throws IOException {
        ensureOpen();
        try (FileChannel channel = FileChannel.open(
            path,
            StandardOpenOption.WRITE,
            StandardOpenOption.TRUNCATE_EXISTING
        )) {
            OutputStream out = Channels.newOutputStream(channel);
            source.writeTo(out);
            out.flush();
            channel.force(true);
        }
    }

    public void commit() throws IOException {
        ensureOpen();
        renameHook.beforeRename(path, target);
        Files.move(path, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        committed = true;
        LOG.debug("Committed {} onto {}", path.getFileName(), target);
    }

    @Override
    public void close() throws IOException {
        if (!committed && Files.deleteIfExists(path)) {
            LOG.debug("Discarded staged file {}", path);
        }
    }

    private void ensureOpen() {
        if (committed) {
            throw new IllegalStateException("staged file already committed: " + target);
        }
    }
}
