package com.example.webvttlayer.service;

import com.example.webvttlayer.config.ParserSettings;
import com.example.webvttlayer.model.FileEntry;
import com.example.webvttlayer.parser.Cue;
import com.example.webvttlayer.parser.FileCharSource;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Reads WebVTT files from the subtitle directory and retimes cues.
 */
@Service
public class CueService {

    private static final Logger log = LoggerFactory.getLogger(CueService.class);

    private final WebVttParser parser;
    private final Path root;

    public CueService(WebVttParser parser, ParserSettings settings) {
        this.parser = parser;
        this.root = settings.getSubtitleDirectory();
    }

    @PostConstruct
    public void init() throws IOException {
        Files.createDirectories(root);
        log.info("CueService using subtitle directory {}", root);
    }

    /**
     * Lists the {@code .vtt} files directly under the subtitle directory,
     * sorted by name.
     */
    public List<FileEntry> listFiles() throws IOException {
        List<FileEntry> entries = new ArrayList<>();
        try (Stream<Path> stream = Files.list(root)) {
            for (Path p : (Iterable<Path>) stream::iterator) {
                String name = p.getFileName().toString();
                if (Files.isRegularFile(p) && name.toLowerCase().endsWith(".vtt")) {
                    entries.add(new FileEntry(name, Files.size(p)));
                }
            }
        }
        entries.sort((a, b) -> a.name().compareToIgnoreCase(b.name()));
        return entries;
    }

    /**
     * Parses a file from the subtitle directory.
     *
     * @throws IllegalArgumentException if the name is blank
     * @throws AccessDeniedException if the name escapes the directory
     * @throws NoSuchFileException if the file is missing
     * @throws IOException if reading fails or the content is malformed
     */
    public List<Cue> parseFile(String name) throws IOException {
        Path file = resolve(name);
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(name);
        }

        log.info("Parsing subtitle file {}", file);
        try (FileCharSource source = FileCharSource.open(file)) {
            return parser.parse(source);
        }
    }

    /**
     * Returns copies of the cues with start and stop times moved by
     * {@code offsetMillis}. Times that would fall before zero clamp to zero.
     */
    public List<Cue> shift(List<Cue> cues, long offsetMillis) {
        List<Cue> shifted = new ArrayList<>(cues.size());
        for (Cue cue : cues) {
            Cue copy = cue.copy();
            copy.setStartTime(cue.getStartTime().plus(offsetMillis));
            copy.setStopTime(cue.getStopTime().plus(offsetMillis));
            shifted.add(copy);
        }
        log.debug("Shifted {} cues by {} ms", shifted.size(), offsetMillis);
        return shifted;
    }

    private Path resolve(String name) throws AccessDeniedException {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("File name is required");
        }
        Path file = root.resolve(name).normalize();
        if (!file.startsWith(root)) {
            throw new AccessDeniedException(name, null, "path outside subtitle directory");
        }
        return file;
    }
}
