package io.mnemo.core.fs;

import java.io.IOException;
import java.io.OutputStream;

@FunctionalInterface
public interface ContentSource {

    // Must not close out.
    void writeTo(OutputStream out) throws IOException;
}
