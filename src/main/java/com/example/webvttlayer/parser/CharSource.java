package com.example.webvttlayer.parser;

import java.io.IOException;

/**
 * Supplies the scanner with one character at a time.
 * <p>
 * Characters are the raw bytes of the document ({@code 0..255}). A source
 * failure is reported by throwing {@link IOException}; end of stream is
 * reported by returning {@link #EOF}. Implementations may buffer internally,
 * the scanner itself never reads ahead by more than one character.
 */
public interface CharSource {

    /**
     * Returned by {@link #getChar()} when the stream has no more data.
     */
    int EOF = -1;

    /**
     * Reads the next character.
     *
     * @return the next byte value, or {@link #EOF}
     * @throws IOException if the underlying source fails
     */
    int getChar() throws IOException;
}
