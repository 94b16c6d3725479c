package com.mediaplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Media kind passed to the scorer so it can apply movie or TV size heuristics.
 */
public enum MediaType {
    @JsonProperty("movie") MOVIE,
    @JsonProperty("tv")    TV
}
