package com.example.webvttlayer.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Parse result returned by the cue endpoints.
 */
public record ParseResponse(
        @JsonProperty("file_name") String fileName,
        @JsonProperty("total_count") int totalCount,
        @JsonProperty("data") List<CueData> data) {
}
