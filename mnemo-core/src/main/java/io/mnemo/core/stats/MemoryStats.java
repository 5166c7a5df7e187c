package io.mnemo.core.stats;

import io.mnemo.core.store.EntityRecord;
import io.mnemo.core.store.MemoryRecord;
import io.mnemo.core.store.StoreDecodeException;
import io.mnemo.core.store.StoreLine;
import io.mnemo.core.store.StoreReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

public record MemoryStats(Path path, long entities, long relations, long undecodable, long sizeBytes) {

    public static MemoryStats of(Path path) throws IOException {
        if (!Files.exists(path)) {
            return new MemoryStats(path, 0, 0, 0, 0);
        }
        long entities = 0;
        long relations = 0;
        long undecodable = 0;
        try (StoreReader reader = StoreReader.open(path)) {
            StoreLine line;
            while ((line = reader.nextLine()) != null) {
                try {
                    MemoryRecord record = line.decode();
                    if (record instanceof EntityRecord) {
                        entities++;
                    } else {
                        relations++;
                    }
                } catch (StoreDecodeException e) {
                    undecodable++;
                }
            }
        }
        return new MemoryStats(path, entities, relations, undecodable, Files.size(path));
    }

    public String formattedSize() {
        return formatSize(sizeBytes);
    }

    public static String formatSize(long bytes) {
        if (bytes < 1024) {
            return bytes + "B";
        }
        if (bytes < 1024L * 1024) {
            return String.format(Locale.ROOT, "%.1fKB", bytes / 1024.0);
        }
        return String.format(Locale.ROOT, "%.1fMB", bytes / (1024.0 * 1024.0));
    }
}
