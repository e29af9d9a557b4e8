package com.example.webvttlayer.parser;

import java.io.BufferedInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Character source reading a WebVTT file from disk.
 */
public class FileCharSource implements CharSource, Closeable {

    private final Path path;
    private InputStream in;

    private FileCharSource(Path path, InputStream in) {
        this.path = path;
        this.in = in;
    }

    /**
     * Opens the file for reading.
     *
     * @throws IOException if the file cannot be opened
     */
    public static FileCharSource open(Path path) throws IOException {
        return new FileCharSource(path, new BufferedInputStream(Files.newInputStream(path)));
    }

    public Path getPath() {
        return path;
    }

    public boolean isOpen() {
        return in != null;
    }

    @Override
    public int getChar() throws IOException {
        if (in == null) {
            throw new IOException("File source is closed: " + path);
        }
        return in.read();
    }

    @Override
    public void close() throws IOException {
        if (in != null) {
            try {
                in.close();
            } finally {
                in = null;
            }
        }
    }
}
