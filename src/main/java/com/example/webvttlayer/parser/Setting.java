package com.example.webvttlayer.parser;

/**
 * One {@code NAME:VALUE} cue setting from a timings line.
 */
public record Setting(String name, String value) {

    public Setting {
        requireToken("name", name);
        requireToken("value", value);
    }

    private static void requireToken(String what, String token) {
        if (token == null || token.isEmpty()) {
            throw new IllegalArgumentException("Setting " + what + " must not be empty");
        }
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (c == ':' || c == ' ' || c == '\t') {
                throw new IllegalArgumentException("Setting " + what + " contains '" + c + "': " + token);
            }
        }
    }

    @Override
    public String toString() {
        return name + ":" + value;
    }
}
