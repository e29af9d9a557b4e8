package com.example.webvttlayer.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A WebVTT file in the subtitle directory.
 */
public record FileEntry(
        @JsonProperty("name") String name,
        @JsonProperty("size") long size) {
}
