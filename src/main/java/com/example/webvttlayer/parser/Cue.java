package com.example.webvttlayer.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A parsed cue.
 * <p>
 * Instances are owned by the caller and filled in by
 * {@link WebVttScanner#parse(Cue)}, which overwrites every field on success,
 * so one instance can be reused across calls. Use {@link #copy()} to keep a
 * cue after the next call.
 */
public class Cue {

    private String identifier = "";
    private Time startTime = Time.ZERO;
    private Time stopTime = Time.ZERO;
    private final List<Setting> settings = new ArrayList<>();
    private final List<String> payload = new ArrayList<>();

    public Cue() {
    }

    public Cue(String identifier, Time startTime, Time stopTime, List<Setting> settings, List<String> payload) {
        setIdentifier(identifier);
        setStartTime(startTime);
        setStopTime(stopTime);
        this.settings.addAll(settings);
        this.payload.addAll(payload);
    }

    /**
     * Empty when the cue had no identifier line.
     */
    public String getIdentifier() {
        return identifier;
    }

    public void setIdentifier(String identifier) {
        this.identifier = identifier == null ? "" : identifier;
    }

    public boolean hasIdentifier() {
        return !identifier.isEmpty();
    }

    public Time getStartTime() {
        return startTime;
    }

    public void setStartTime(Time startTime) {
        this.startTime = Objects.requireNonNull(startTime, "startTime");
    }

    public Time getStopTime() {
        return stopTime;
    }

    public void setStopTime(Time stopTime) {
        this.stopTime = Objects.requireNonNull(stopTime, "stopTime");
    }

    /**
     * Settings in order of appearance, duplicates included. Live list.
     */
    public List<Setting> getSettings() {
        return settings;
    }

    /**
     * Payload lines. Live list.
     */
    public List<String> getPayload() {
        return payload;
    }

    public Cue copy() {
        return new Cue(identifier, startTime, stopTime, settings, payload);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Cue)) {
            return false;
        }
        Cue other = (Cue) o;
        return identifier.equals(other.identifier)
                && startTime.equals(other.startTime)
                && stopTime.equals(other.stopTime)
                && settings.equals(other.settings)
                && payload.equals(other.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identifier, startTime, stopTime, settings, payload);
    }

    @Override
    public String toString() {
        return "Cue[identifier=" + identifier + ", start=" + startTime + ", stop=" + stopTime
                + ", settings=" + settings + ", payload=" + payload + "]";
    }
}
