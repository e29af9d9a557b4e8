package com.example.webvttlayer.model;

import com.example.webvttlayer.parser.Cue;
import com.example.webvttlayer.parser.Setting;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * JSON view of a parsed cue.
 */
public record CueData(
        @JsonProperty("identifier") String identifier,
        @JsonProperty("start_time") String startTime,
        @JsonProperty("stop_time") String stopTime,
        @JsonProperty("start_ms") long startMs,
        @JsonProperty("stop_ms") long stopMs,
        @JsonProperty("settings") List<SettingData> settings,
        @JsonProperty("payload") List<String> payload) {

    public static CueData from(Cue cue) {
        return new CueData(
                cue.getIdentifier(),
                cue.getStartTime().toString(),
                cue.getStopTime().toString(),
                cue.getStartTime().presentation(),
                cue.getStopTime().presentation(),
                cue.getSettings().stream().map(SettingData::from).toList(),
                List.copyOf(cue.getPayload()));
    }

    public record SettingData(
            @JsonProperty("name") String name,
            @JsonProperty("value") String value) {

        static SettingData from(Setting setting) {
            return new SettingData(setting.name(), setting.value());
        }
    }
}
