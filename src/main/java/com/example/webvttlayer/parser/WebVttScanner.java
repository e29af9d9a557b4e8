package com.example.webvttlayer.parser;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Single-pass WebVTT scanner.
 * <p>
 * Call {@link #init()} once to check the file header, then {@link #parse(Cue)}
 * until it returns {@code false}. Characters are pulled from the
 * {@link CharSource} one at a time; the only lookahead is a single pushed-back
 * character, which is all this grammar needs (telling a BOM byte from
 * content, and a lone CR from CR LF).
 * <p>
 * Any {@link IOException} thrown by the source is passed through unchanged.
 * Grammar violations throw {@link VttFormatException}, as does a line that
 * is not well-formed UTF-8; text is never replaced. After either, the
 * scanner must not be used again. Instances are not thread-safe; the source
 * is never closed here.
 */
public class WebVttScanner {

    static final String ARROW = "-->";

    private static final String SIGNATURE = "WEBVTT";
    private static final int[] BOM = {0xEF, 0xBB, 0xBF};

    private static final int LF = '\n';
    private static final int CR = '\r';

    private final CharSource source;
    private final ByteArrayOutputStream lineBuffer = new ByteArrayOutputStream(128);
    private final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
    private int pushback = CharSource.EOF;

    public WebVttScanner(CharSource source) {
        if (source == null) {
            throw new IllegalArgumentException("Character source is required");
        }
        this.source = source;
    }

    /**
     * Validates the header: optional UTF-8 BOM, the {@code WEBVTT} signature,
     * optional text after a space or tab, then a blank line. A stream that
     * ends after the signature line is accepted as an empty document.
     *
     * @throws VttFormatException if the header is malformed
     * @throws IOException if the source fails
     */
    public void init() throws IOException {
        parseBom();

        // One character at a time, so a binary stream without line breaks is rejected early.
        for (int i = 0; i < SIGNATURE.length(); i++) {
            int c = getChar();
            if (c == CharSource.EOF) {
                throw new VttFormatException("Unexpected end of stream in WEBVTT signature");
            }
            if (c != SIGNATURE.charAt(i)) {
                throw new VttFormatException("Missing WEBVTT signature");
            }
        }

        String line = parseLine();
        if (line == null) {
            return;
        }
        if (!line.isEmpty() && !LineCursor.isWhitespace(line.charAt(0))) {
            throw new VttFormatException("Unexpected character after WEBVTT signature: '" + line.charAt(0) + "'");
        }

        line = parseLine();
        if (line == null) {
            return;
        }
        if (!line.isEmpty()) {
            throw new VttFormatException("WEBVTT header must be followed by a blank line");
        }
    }

    /**
     * Reads the next cue into {@code cue}, replacing all of its contents.
     *
     * @return {@code true} if a cue was read, {@code false} at end of stream
     * @throws VttFormatException if the cue is malformed or truncated
     * @throws IOException if the source fails
     */
    public boolean parse(Cue cue) throws IOException {
        if (cue == null) {
            throw new IllegalArgumentException("Cue is required");
        }

        String line;
        do {
            line = parseLine();
            if (line == null) {
                return false;
            }
        } while (line.isEmpty());

        // The arrow may not appear in an identifier, so its presence marks the timings line.
        int arrowPos = line.indexOf(ARROW);
        if (arrowPos >= 0) {
            cue.setIdentifier("");
        } else {
            cue.setIdentifier(line);
            line = parseLine();
            if (line == null) {
                throw new VttFormatException("Unexpected end of stream after cue identifier");
            }
            arrowPos = line.indexOf(ARROW);
            if (arrowPos < 0) {
                throw new VttFormatException("Expected cue timings line: " + line);
            }
        }

        parseTimingsLine(line, arrowPos, cue);

        List<String> payload = cue.getPayload();
        payload.clear();
        for (;;) {
            line = parseLine();
            if (line == null || line.isEmpty()) {
                break;
            }
            payload.add(line);
        }
        if (payload.isEmpty()) {
            throw new VttFormatException("Cue has no payload");
        }
        return true;
    }

    int getChar() throws IOException {
        if (pushback != CharSource.EOF) {
            int c = pushback;
            pushback = CharSource.EOF;
            return c;
        }
        return source.getChar();
    }

    void ungetChar(int c) {
        if (pushback != CharSource.EOF) {
            throw new IllegalStateException("Pushback buffer already holds a character");
        }
        pushback = c;
    }

    /**
     * Consumes a UTF-8 byte order mark if one is present. Only the first byte
     * can be pushed back, so a BOM that breaks off after it is an error.
     */
    void parseBom() throws IOException {
        for (int i = 0; i < BOM.length; i++) {
            int c = getChar();
            if (c == CharSource.EOF) {
                throw new VttFormatException(i == 0 ? "Empty stream" : "Unexpected end of stream in byte order mark");
            }
            if (c != BOM[i]) {
                if (i == 0) {
                    ungetChar(c);
                    return;
                }
                throw new VttFormatException("Incomplete byte order mark");
            }
        }
    }

    /**
     * Completes a line terminator: LF, CR, or CR LF. {@code c} must be the
     * CR or LF already read.
     */
    void parseLineTerminator(int c) throws IOException {
        if (c == LF) {
            return;
        }
        if (c != CR) {
            throw new IllegalArgumentException("Not a line terminator: " + c);
        }
        int next = getChar();
        if (next == CharSource.EOF || next == LF) {
            return;
        }
        ungetChar(next);
    }

    /**
     * Reads one line without its terminator.
     *
     * @return the line, or {@code null} if the stream ended before any
     *         character was read. A final line without terminator is returned
     *         normally.
     */
    String parseLine() throws IOException {
        lineBuffer.reset();
        for (;;) {
            int c = getChar();
            if (c == CharSource.EOF) {
                return lineBuffer.size() == 0 ? null : decodeLine();
            }
            if (c == LF || c == CR) {
                parseLineTerminator(c);
                return decodeLine();
            }
            lineBuffer.write(c);
        }
    }

    private String decodeLine() throws VttFormatException {
        try {
            return decoder.decode(ByteBuffer.wrap(lineBuffer.toByteArray())).toString();
        } catch (CharacterCodingException e) {
            throw new VttFormatException("Line is not valid UTF-8");
        }
    }

    /**
     * Parses {@code start --> stop [settings]} into the cue.
     * {@code arrowPos} is the index of the arrow token in {@code line}.
     */
    static void parseTimingsLine(String line, int arrowPos, Cue cue) throws VttFormatException {
        if (arrowPos < 0 || arrowPos >= line.length()) {
            throw new VttFormatException("Arrow position " + arrowPos + " outside timings line");
        }

        LineCursor start = new LineCursor(line, 0, arrowPos);
        Time startTime = parseTime(line, start);
        start.skipWhitespace();
        if (!start.atEnd()) {
            throw new VttFormatException("Unexpected text before arrow: " + line);
        }

        LineCursor rest = new LineCursor(line, Math.min(arrowPos + ARROW.length(), line.length()), line.length());
        Time stopTime = parseTime(line, rest);
        parseSettings(line, rest, cue.getSettings());

        cue.setStartTime(startTime);
        cue.setStopTime(stopTime);
    }

    /**
     * Parses a timestamp in one of the forms {@code SS[.sss]},
     * {@code MM:SS[.sss]} or {@code HH:MM:SS[.sss]}, skipping leading
     * whitespace. The seconds-only form has no upper bound and is carried
     * into minutes and hours.
     */
    static Time parseTime(String line, LineCursor cursor) throws VttFormatException {
        cursor.skipWhitespace();
        if (cursor.atEnd()) {
            throw new VttFormatException("Missing timestamp: " + line);
        }

        int hours;
        int minutes;
        int seconds;
        boolean secondsOnly = false;

        int first = parseNumber(line, cursor);
        if (cursor.peek() == ':') {
            cursor.advance();
            int second = parseNumber(line, cursor);
            if (second >= 60) {
                throw new VttFormatException("Timestamp component out of range: " + second);
            }
            if (cursor.peek() == ':') {
                cursor.advance();
                int third = parseNumber(line, cursor);
                if (third >= 60) {
                    throw new VttFormatException("Seconds out of range: " + third);
                }
                hours = first;
                minutes = second;
                seconds = third;
            } else {
                if (first >= 60) {
                    throw new VttFormatException("Minutes out of range: " + first);
                }
                hours = 0;
                minutes = first;
                seconds = second;
            }
        } else {
            hours = 0;
            minutes = 0;
            seconds = first;
            secondsOnly = true;
        }

        int milliseconds = 0;
        if (cursor.peek() == '.') {
            cursor.advance();
            int digitsStart = cursor.position();
            int fraction = parseNumber(line, cursor);
            int digits = cursor.position() - digitsStart;
            if (digits > 3) {
                throw new VttFormatException("Too many fractional digits in timestamp: " + line);
            }
            if (digits == 1) {
                milliseconds = fraction * 100;
            } else if (digits == 2) {
                milliseconds = fraction * 10;
            } else {
                milliseconds = fraction;
            }
        }

        int c = cursor.peek();
        if (c != -1 && !LineCursor.isWhitespace(c)) {
            throw new VttFormatException("Unexpected character '" + (char) c + "' after timestamp: " + line);
        }

        return secondsOnly
                ? Time.ofSeconds(seconds, milliseconds)
                : new Time(hours, minutes, seconds, milliseconds);
    }

    /**
     * Parses whitespace-separated {@code NAME:VALUE} pairs up to the end of
     * the cursor's segment. The list is cleared first.
     */
    static void parseSettings(String line, LineCursor cursor, List<Setting> settings) throws VttFormatException {
        settings.clear();
        StringBuilder name = new StringBuilder();
        StringBuilder value = new StringBuilder();

        for (;;) {
            cursor.skipWhitespace();
            if (cursor.atEnd()) {
                return;
            }

            name.setLength(0);
            for (;;) {
                int c = cursor.peek();
                if (c == ':') {
                    break;
                }
                if (c == -1 || LineCursor.isWhitespace(c)) {
                    throw new VttFormatException("Setting without ':' separator: " + line);
                }
                name.append((char) c);
                cursor.advance();
            }
            if (name.length() == 0) {
                throw new VttFormatException("Setting with empty name: " + line);
            }
            cursor.advance();

            value.setLength(0);
            for (;;) {
                int c = cursor.peek();
                if (c == -1 || LineCursor.isWhitespace(c)) {
                    break;
                }
                if (c == ':') {
                    throw new VttFormatException("Setting value contains ':': " + line);
                }
                value.append((char) c);
                cursor.advance();
            }
            if (value.length() == 0) {
                throw new VttFormatException("Setting '" + name + "' has empty value");
            }

            settings.add(new Setting(name.toString(), value.toString()));
        }
    }

    /**
     * Parses a run of ASCII digits. No sign or decimal point is accepted.
     *
     * @throws VttFormatException if there is no digit at the cursor or the
     *                            value exceeds {@link Integer#MAX_VALUE}
     */
    static int parseNumber(String line, LineCursor cursor) throws VttFormatException {
        if (!isDigit(cursor.peek())) {
            throw new VttFormatException("Expected digit at position " + cursor.position() + ": " + line);
        }
        long value = 0;
        while (isDigit(cursor.peek())) {
            value = value * 10 + (cursor.peek() - '0');
            if (value > Integer.MAX_VALUE) {
                throw new VttFormatException("Number too large: " + line);
            }
            cursor.advance();
        }
        return (int) value;
    }

    private static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }
}
