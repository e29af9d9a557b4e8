package com.example.webvttlayer.service;

import com.example.webvttlayer.config.ParserSettings;
import com.example.webvttlayer.parser.Cue;
import com.example.webvttlayer.parser.Setting;
import com.example.webvttlayer.parser.Time;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class WebVttWriterTest {

    private final WebVttWriter writer = new WebVttWriter();
    private final WebVttParser parser = new WebVttParser(new ParserSettings("./subtitles", 100));

    @Test
    public void generatesDocument() {
        List<Cue> cues = List.of(
                new Cue("", new Time(0, 0, 1, 0), new Time(0, 0, 2, 0), List.of(), List.of("Hello")),
                new Cue("2", new Time(1, 2, 3, 4), new Time(1, 2, 5, 0),
                        List.of(new Setting("align", "end")), List.of("a", "b")));

        assertEquals("WEBVTT\n\n"
                + "00:00:01.000 --> 00:00:02.000\nHello\n"
                + "\n"
                + "2\n01:02:03.004 --> 01:02:05.000 align:end\na\nb\n", writer.generateVtt(cues));
    }

    @Test
    public void emptyList() {
        assertEquals("WEBVTT\n\n", writer.generateVtt(List.of()));
    }

    @Test
    public void outputParsesBack() throws Exception {
        String source = "WEBVTT\r\n\r\n"
                + "x\r\n3661 --> 3662.5 line:0 line:1\r\none\r\n\r\n"
                + "05:00.25-->05:01\r\ntwo\r\nthree";
        List<Cue> cues = parser.parse(source);
        assertEquals(cues, parser.parse(writer.generateVtt(cues)));
    }
}
