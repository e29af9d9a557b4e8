package com.example.webvttlayer.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Settings for parsing and the subtitle directory, read from
 * application.properties.
 */
@Component
public class ParserSettings {

    private static final Logger log = LoggerFactory.getLogger(ParserSettings.class);

    @Value("${webvtt.subtitle-directory:./subtitles}")
    private String subtitleDirectory = "./subtitles";

    @Value("${webvtt.max-cues:100000}")
    private int maxCues = 100000;

    public ParserSettings() {
    }

    public ParserSettings(String subtitleDirectory, int maxCues) {
        this.subtitleDirectory = subtitleDirectory;
        this.maxCues = maxCues;
    }

    @PostConstruct
    private void init() {
        if (maxCues <= 0) {
            log.warn("webvtt.max-cues must be positive, got {}; using 100000", maxCues);
            maxCues = 100000;
        }
        log.info("Subtitle directory: {}, max cues per document: {}", getSubtitleDirectory(), maxCues);
    }

    public Path getSubtitleDirectory() {
        return Path.of(subtitleDirectory).toAbsolutePath().normalize();
    }

    public int getMaxCues() {
        return maxCues;
    }
}
