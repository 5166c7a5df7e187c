package io.mnemo.core.store;

import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Sequential reader over a store file, one record line at a time.
 * <p>
 * Lines are split on raw bytes and decoded one by one, so a line holding invalid UTF-8 comes back
 * as an undecodable {@link StoreLine} instead of failing the whole read. Blank lines are skipped.
 * An empty JSON object on the first non-blank line is the empty-store marker and is skipped too;
 * anywhere else it is returned like any other line and fails to decode.
 */
public final class StoreReader implements Closeable {
    private final InputStream in;
    private final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT);
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream(256);
    private int lineNumber;
    private boolean seenContent;

    private StoreReader(InputStream in) {
        this.in = in;
    }

    public static StoreReader open(Path path) throws IOException {
        return new StoreReader(new BufferedInputStream(Files.newInputStream(path), 64 * 1024));
    }

    public static StoreReader openOrEmpty(Path path) throws IOException {
        if (!Files.exists(path)) {
            return new StoreReader(new ByteArrayInputStream(new byte[0]));
        }
        return open(path);
    }

    public StoreLine nextLine() throws IOException {
        while (readRawLine()) {
            lineNumber++;
            String raw;
            try {
                raw = decoder.reset().decode(ByteBuffer.wrap(buffer.toByteArray())).toString();
            } catch (CharacterCodingException e) {
                seenContent = true;
                return StoreLine.undecodable(lineNumber, e.getMessage());
            }
            if (raw.isBlank()) {
                continue;
            }
            boolean first = !seenContent;
            seenContent = true;
            if (first && StoreCodec.isEmptyStoreMarker(raw)) {
                continue;
            }
            return new StoreLine(lineNumber, raw);
        }
        return null;
    }

    public MemoryRecord nextRecord() throws IOException {
        StoreLine line = nextLine();
        if (line == null) {
            return null;
        }
        try {
            return line.decode();
        } catch (StoreDecodeException e) {
            throw e.atLine(line.number());
        }
    }

    public int lineNumber() {
        return lineNumber;
    }

    @Override
    public void close() throws IOException {
        in.close();
    }

    // Fills buffer with the next line minus its terminator (\n, \r\n or a lone \r).
    private boolean readRawLine() throws IOException {
        buffer.reset();
        int b = in.read();
        if (b < 0) {
            return false;
        }
        while (b >= 0 && b != '\n') {
            if (b == '\r') {
                in.mark(1);
                if (in.read() != '\n') {
                    in.reset();
                }
                return true;
            }
            buffer.write(b);
            b = in.read();
        }
        return true;
    }
}
