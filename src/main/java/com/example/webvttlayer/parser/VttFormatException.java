package com.example.webvttlayer.parser;

import java.io.IOException;

/**
 * Thrown when the input violates the WebVTT grammar.
 * Scanning stops at the first violation; the scanner is not usable afterwards.
 */
public class VttFormatException extends IOException {

    private static final long serialVersionUID = 1L;

    public VttFormatException(String message) {
        super(message);
    }
}
