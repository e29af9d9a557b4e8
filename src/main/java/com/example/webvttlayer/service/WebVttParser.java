package com.example.webvttlayer.service;

import com.example.webvttlayer.config.ParserSettings;
import com.example.webvttlayer.parser.CharSource;
import com.example.webvttlayer.parser.Cue;
import com.example.webvttlayer.parser.StreamCharSource;
import com.example.webvttlayer.parser.VttFormatException;
import com.example.webvttlayer.parser.WebVttScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses whole WebVTT documents into cue lists.
 */
@Service
public class WebVttParser {

    private static final Logger log = LoggerFactory.getLogger(WebVttParser.class);

    private final ParserSettings settings;

    public WebVttParser(ParserSettings settings) {
        this.settings = settings;
    }

    public List<Cue> parse(String content) throws IOException {
        return parse(StreamCharSource.of(content));
    }

    public List<Cue> parse(byte[] content) throws IOException {
        return parse(StreamCharSource.of(content));
    }

    /**
     * Parses from the stream. The stream is left open.
     */
    public List<Cue> parse(InputStream in) throws IOException {
        return parse(new StreamCharSource(in));
    }

    /**
     * Validates the header, then reads cues until the end of the stream.
     *
     * @throws VttFormatException on the first grammar violation, or when the
     *                            document holds more cues than allowed
     */
    public List<Cue> parse(CharSource source) throws IOException {
        WebVttScanner scanner = new WebVttScanner(source);
        List<Cue> cues = new ArrayList<>();
        Cue cue = new Cue();
        try {
            scanner.init();
            while (scanner.parse(cue)) {
                if (cues.size() >= settings.getMaxCues()) {
                    throw new VttFormatException("Document exceeds " + settings.getMaxCues() + " cues");
                }
                cues.add(cue.copy());
            }
        } catch (VttFormatException e) {
            log.warn("Rejected WebVTT document after {} cues: {}", cues.size(), e.getMessage());
            throw e;
        }

        log.info("Parsed {} cues from WebVTT content", cues.size());
        return cues;
    }
}
