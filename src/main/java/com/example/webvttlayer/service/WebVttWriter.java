package com.example.webvttlayer.service;

import com.example.webvttlayer.parser.Cue;
import com.example.webvttlayer.parser.Setting;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Generates WebVTT text from cues.
 */
@Service
public class WebVttWriter {

    /**
     * Renders the header followed by each cue, separated by blank lines.
     * Cues read back through the scanner compare equal to the input.
     */
    public String generateVtt(List<Cue> cues) {
        StringBuilder sb = new StringBuilder();
        sb.append("WEBVTT\n\n");

        for (int i = 0; i < cues.size(); i++) {
            appendCue(sb, cues.get(i));
            if (i < cues.size() - 1) {
                sb.append("\n");
            }
        }

        return sb.toString();
    }

    private void appendCue(StringBuilder sb, Cue cue) {
        if (cue.hasIdentifier()) {
            sb.append(cue.getIdentifier()).append("\n");
        }
        sb.append(cue.getStartTime()).append(" --> ").append(cue.getStopTime());
        for (Setting setting : cue.getSettings()) {
            sb.append(' ').append(setting);
        }
        sb.append("\n");
        for (String line : cue.getPayload()) {
            sb.append(line).append("\n");
        }
    }
}
