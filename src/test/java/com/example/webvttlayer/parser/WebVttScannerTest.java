package com.example.webvttlayer.parser;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class WebVttScannerTest {

    private static final byte[] BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

    private static WebVttScanner scanner(String content) {
        return new WebVttScanner(StreamCharSource.of(content));
    }

    private static WebVttScanner scanner(byte[] prefix, String content) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(prefix);
        out.writeBytes(content.getBytes(StandardCharsets.UTF_8));
        return new WebVttScanner(StreamCharSource.of(out.toByteArray()));
    }

    /**
     * Fails with a source error once the given bytes are exhausted.
     */
    private static CharSource failingAfter(String content) {
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        return new CharSource() {
            private int next;

            @Override
            public int getChar() throws IOException {
                if (next < bytes.length) {
                    return bytes[next++] & 0xFF;
                }
                throw new IOException("connection reset");
            }
        };
    }

    @Test
    public void singleCueWithoutIdentifier() throws Exception {
        WebVttScanner scanner = scanner("WEBVTT\n\n00:00:01.000 --> 00:00:02.000\nHello\n\n");
        scanner.init();

        Cue cue = new Cue();
        assertTrue(scanner.parse(cue));
        assertEquals("", cue.getIdentifier());
        assertFalse(cue.hasIdentifier());
        assertEquals(new Time(0, 0, 1, 0), cue.getStartTime());
        assertEquals(new Time(0, 0, 2, 0), cue.getStopTime());
        assertTrue(cue.getSettings().isEmpty());
        assertEquals(List.of("Hello"), cue.getPayload());

        assertFalse(scanner.parse(cue));
    }

    @Test
    public void cueWithIdentifierAndSetting() throws Exception {
        WebVttScanner scanner = scanner("WEBVTT\n\n1\n00:00:01.000 --> 00:00:02.000 align:middle\nHi\n\n");
        scanner.init();

        Cue cue = new Cue();
        assertTrue(scanner.parse(cue));
        assertEquals("1", cue.getIdentifier());
        assertEquals(List.of(new Setting("align", "middle")), cue.getSettings());
        assertEquals(List.of("Hi"), cue.getPayload());
        assertFalse(scanner.parse(cue));
    }

    @Test
    public void minutesOutOfRangeFails() throws Exception {
        WebVttScanner scanner = scanner("WEBVTT\n\n00:60:00.000 --> 00:00:01.000\nText\n");
        scanner.init();
        assertThrows(VttFormatException.class, () -> scanner.parse(new Cue()));
    }

    @Test
    public void bomFollowedByOtherTextFails() {
        WebVttScanner scanner = scanner(BOM, "WEBVTX\n\n");
        assertThrows(VttFormatException.class, scanner::init);
    }

    @Test
    public void bomIsSkipped() throws Exception {
        WebVttScanner scanner = scanner(BOM, "WEBVTT\n\n00:01.000 --> 00:02.000\nText\n");
        scanner.init();
        Cue cue = new Cue();
        assertTrue(scanner.parse(cue));
        assertEquals(List.of("Text"), cue.getPayload());
    }

    @Test
    public void partialBomFails() {
        assertThrows(VttFormatException.class,
                () -> scanner(new byte[] {(byte) 0xEF, (byte) 0xBB}, "WEBVTT\n\n").init());
        assertThrows(VttFormatException.class,
                () -> scanner(new byte[] {(byte) 0xEF}, "WEBVTT\n\n").init());
        assertThrows(VttFormatException.class,
                () -> new WebVttScanner(StreamCharSource.of(new byte[] {(byte) 0xEF, (byte) 0xBB})).init());
    }

    @Test
    public void crlfReadsLikeLf() throws Exception {
        String lf = "WEBVTT\n\n1\n00:01.000 --> 00:02.000\nfirst\nsecond\n\n00:03.000 --> 00:04.000\nthird\n";
        String crlf = lf.replace("\n", "\r\n");
        String cr = lf.replace("\n", "\r");

        List<Cue> expected = readAll(scanner(lf));
        assertEquals(2, expected.size());
        assertEquals(List.of("first", "second"), expected.get(0).getPayload());
        assertEquals(expected, readAll(scanner(crlf)));
        assertEquals(expected, readAll(scanner(cr)));
    }

    @Test
    public void mixedTerminators() throws Exception {
        List<Cue> cues = readAll(scanner("WEBVTT\r\n\rid\n00:01.000 --> 00:02.000\r\na\rb\r\n\n\r\n"));
        assertEquals(1, cues.size());
        assertEquals("id", cues.get(0).getIdentifier());
        assertEquals(List.of("a", "b"), cues.get(0).getPayload());
    }

    @Test
    public void trailingLineWithoutTerminator() throws Exception {
        List<Cue> cues = readAll(scanner("WEBVTT\n\n00:01.000 --> 00:02.000\nlast line"));
        assertEquals(List.of("last line"), cues.get(0).getPayload());
    }

    @Test
    public void crAtEndOfStream() throws Exception {
        List<Cue> cues = readAll(scanner("WEBVTT\n\n00:01.000 --> 00:02.000\ntext\r"));
        assertEquals(List.of("text"), cues.get(0).getPayload());
    }

    @Test
    public void headerMayCarryText() throws Exception {
        scanner("WEBVTT - Some title\n\n").init();
        scanner("WEBVTT\tKind: captions\n\n").init();
    }

    @Test
    public void headerErrors() {
        assertThrows(VttFormatException.class, () -> scanner("").init());
        assertThrows(VttFormatException.class, () -> scanner("WEBVT").init());
        assertThrows(VttFormatException.class, () -> scanner("webvtt\n\n").init());
        assertThrows(VttFormatException.class, () -> scanner("WEBVTTX\n\n").init());
        assertThrows(VttFormatException.class, () -> scanner("WEBVTT\nKind: captions\n\n").init());
        assertThrows(VttFormatException.class, () -> scanner("\u0000\u0001binary").init());
    }

    @Test
    public void emptyDocumentsAreAccepted() throws Exception {
        for (String content : new String[] {"WEBVTT", "WEBVTT\n", "WEBVTT title", "WEBVTT\n\n", "WEBVTT\n\n\n\n"}) {
            WebVttScanner scanner = scanner(content);
            scanner.init();
            assertFalse(scanner.parse(new Cue()), content);
        }
    }

    @Test
    public void blankLinesBetweenCuesAreSkipped() throws Exception {
        List<Cue> cues = readAll(scanner(
                "WEBVTT\n\n\n\n00:01.000 --> 00:02.000\na\n\n\n\n00:02.000 --> 00:03.000\nb\n\n\n"));
        assertEquals(2, cues.size());
        assertEquals(List.of("b"), cues.get(1).getPayload());
    }

    @Test
    public void emptyPayloadFails() throws Exception {
        WebVttScanner scanner = scanner("WEBVTT\n\n00:01.000 --> 00:02.000\n\nText\n");
        scanner.init();
        assertThrows(VttFormatException.class, () -> scanner.parse(new Cue()));

        WebVttScanner atEnd = scanner("WEBVTT\n\n00:01.000 --> 00:02.000\n");
        atEnd.init();
        assertThrows(VttFormatException.class, () -> atEnd.parse(new Cue()));
    }

    @Test
    public void identifierWithoutTimingsFails() throws Exception {
        WebVttScanner scanner = scanner("WEBVTT\n\nintro\nHello there\n\n");
        scanner.init();
        assertThrows(VttFormatException.class, () -> scanner.parse(new Cue()));

        WebVttScanner truncated = scanner("WEBVTT\n\nintro");
        truncated.init();
        assertThrows(VttFormatException.class, () -> truncated.parse(new Cue()));
    }

    @Test
    public void cueIsOverwrittenOnReuse() throws Exception {
        WebVttScanner scanner = scanner("WEBVTT\n\n"
                + "first\n00:01.000 --> 00:02.000 align:start line:0\none\ntwo\n\n"
                + "00:03.000 --> 00:04.000\nthree\n");
        scanner.init();

        Cue cue = new Cue();
        assertTrue(scanner.parse(cue));
        assertEquals("first", cue.getIdentifier());
        assertEquals(2, cue.getSettings().size());

        assertTrue(scanner.parse(cue));
        assertEquals("", cue.getIdentifier());
        assertEquals(new Time(0, 0, 3, 0), cue.getStartTime());
        assertTrue(cue.getSettings().isEmpty());
        assertEquals(List.of("three"), cue.getPayload());
    }

    @Test
    public void utf8PayloadIsDecoded() throws Exception {
        List<Cue> cues = readAll(scanner(BOM, "WEBVTT\n\nשלום\n00:01.000 --> 00:02.000\nCafé, 字幕\n"));
        assertEquals("שלום", cues.get(0).getIdentifier());
        assertEquals(List.of("Café, 字幕"), cues.get(0).getPayload());
    }

    @Test
    public void malformedUtf8IsRejected() throws Exception {
        WebVttScanner bad = new WebVttScanner(StreamCharSource.of(concat(
                "WEBVTT\n\n00:01.000 --> 00:02.000\nab".getBytes(StandardCharsets.UTF_8),
                new byte[] {(byte) 0xFF, 'c', '\n'})));
        bad.init();
        VttFormatException e = assertThrows(VttFormatException.class, () -> bad.parse(new Cue()));
        assertTrue(e.getMessage().contains("UTF-8"));

        WebVttScanner truncated = new WebVttScanner(StreamCharSource.of(concat(
                "WEBVTT\n\n00:01.000 --> 00:02.000\n".getBytes(StandardCharsets.UTF_8),
                new byte[] {'x', (byte) 0xC3})));
        truncated.init();
        assertThrows(VttFormatException.class, () -> truncated.parse(new Cue()));

        WebVttScanner header = new WebVttScanner(StreamCharSource.of(concat(
                "WEBVTT ".getBytes(StandardCharsets.UTF_8), new byte[] {(byte) 0x80, '\n', '\n'})));
        assertThrows(VttFormatException.class, header::init);
    }

    @Test
    public void sourceFailureIsPropagated() throws Exception {
        WebVttScanner scanner = new WebVttScanner(failingAfter("WEBVTT\n\n00:01.000 --> 00:02.000\nte"));
        scanner.init();
        IOException e = assertThrows(IOException.class, () -> scanner.parse(new Cue()));
        assertFalse(e instanceof VttFormatException);
        assertEquals("connection reset", e.getMessage());
    }

    @Test
    public void pushbackHoldsOneCharacter() throws Exception {
        WebVttScanner scanner = scanner("ab");
        assertEquals('a', scanner.getChar());
        scanner.ungetChar('a');
        assertThrows(IllegalStateException.class, () -> scanner.ungetChar('x'));
        assertEquals('a', scanner.getChar());
        assertEquals('b', scanner.getChar());
        assertEquals(CharSource.EOF, scanner.getChar());
    }

    @Test
    public void parseLineDistinguishesEndOfStream() throws Exception {
        WebVttScanner scanner = scanner("one\r\n\rtwo");
        assertEquals("one", scanner.parseLine());
        assertEquals("", scanner.parseLine());
        assertEquals("two", scanner.parseLine());
        assertNull(scanner.parseLine());
    }

    private static byte[] concat(byte[] head, byte[] tail) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(head);
        out.writeBytes(tail);
        return out.toByteArray();
    }

    private static List<Cue> readAll(WebVttScanner scanner) throws IOException {
        scanner.init();
        List<Cue> cues = new ArrayList<>();
        Cue cue = new Cue();
        while (scanner.parse(cue)) {
            cues.add(cue.copy());
        }
        return cues;
    }
}
