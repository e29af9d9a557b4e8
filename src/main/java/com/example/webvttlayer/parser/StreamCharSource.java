package com.example.webvttlayer.parser;

import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Character source over an {@link InputStream}.
 * The stream is buffered here; closing is left to whoever opened it.
 */
public class StreamCharSource implements CharSource, Closeable {

    private final InputStream in;

    public StreamCharSource(InputStream in) {
        if (in == null) {
            throw new IllegalArgumentException("Input stream is required");
        }
        this.in = in instanceof BufferedInputStream || in instanceof ByteArrayInputStream
                ? in
                : new BufferedInputStream(in);
    }

    /**
     * Creates a source over the UTF-8 encoding of the given text.
     */
    public static StreamCharSource of(String content) {
        return of(content.getBytes(StandardCharsets.UTF_8));
    }

    public static StreamCharSource of(byte[] content) {
        return new StreamCharSource(new ByteArrayInputStream(content));
    }

    @Override
    public int getChar() throws IOException {
        return in.read();
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
