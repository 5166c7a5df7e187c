package io.mnemo.core.store;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;

public final class StoreWriter {
    private final BufferedWriter writer;
    private long written;

    public StoreWriter(OutputStream out) {
        this.writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
    }

    public void write(MemoryRecord record) throws IOException {
        writer.write(StoreCodec.encode(record));
        writer.write('\n');
        written++;
    }

    public long written() {
        return written;
    }

    public void flush() throws IOException {
        writer.flush();
    }
}
