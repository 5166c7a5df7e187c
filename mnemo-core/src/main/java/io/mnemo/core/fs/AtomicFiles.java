package io.mnemo.core.fs;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.util.Objects;

/**
 * Crash-safe file replacement.
 * <p>
 * Content is written to a temporary file in the target's own directory (same filesystem), forced to
 * disk and then renamed onto the target with {@code ATOMIC_MOVE}. A reader of the target therefore
 * sees either the previous content or the complete new content. No file locks are taken; the rename
 * is the only mutation of the target.
 * <p>
 * Temporary names carry the process id and a random suffix, so concurrent writers in different
 * processes never collide: {@code .<name>.<pid>.<random>.tmp}.
 */
public final class AtomicFiles {
    private static final SecureRandom RANDOM = new SecureRandom();

    private final RenameHook renameHook;

    public AtomicFiles() {
        this(RenameHook.NONE);
    }

    public AtomicFiles(RenameHook renameHook) {
        this.renameHook = Objects.requireNonNull(renameHook, "renameHook must not be null");
    }

    public void replace(Path target, ContentSource source) throws IOException {
        Objects.requireNonNull(source, "source must not be null");
        try (StagedFile staged = stage(target)) {
            staged.write(source);
            staged.commit();
        }
    }

    public void copy(Path source, Path target) throws IOException {
        Objects.requireNonNull(source, "source must not be null");
        if (!Files.exists(source)) {
            throw new NoSuchFileException(source.toString());
        }
        if (!Files.isReadable(source)) {
            throw new AccessDeniedException(source.toString(), null, "source is not readable");
        }
        replace(target, out -> {
            try (InputStream in = Files.newInputStream(source)) {
                in.transferTo(out);
            }
        });
    }

    public void writeString(Path target, String content) throws IOException {
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        replace(target, out -> out.write(bytes));
    }

    public StagedFile stage(Path target) throws IOException {
        Objects.requireNonNull(target, "target must not be null");
        Path absolute = target.toAbsolutePath();
        Path dir = absolute.getParent();
        Files.createDirectories(dir);
        if (!Files.isWritable(dir)) {
            throw new AccessDeniedException(dir.toString(), null, "directory is not writable");
        }
        Path tmp = Files.createFile(dir.resolve(tempName(absolute)));
        return new StagedFile(absolute, tmp, renameHook);
    }

    static String tempName(Path target) {
        long pid = ProcessHandle.current().pid();
        String random = Long.toHexString(RANDOM.nextLong() & Long.MAX_VALUE);
        return "." + target.getFileName() + "." + pid + "." + random + ".tmp";
    }
}
