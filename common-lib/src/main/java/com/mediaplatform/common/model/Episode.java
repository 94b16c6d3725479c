package com.mediaplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Episode(
    @JsonProperty("id") String id,
    @JsonProperty("seriesId") String seriesId,
    @JsonProperty("seasonNumber") int seasonNumber,
    @JsonProperty("episodeNumber") int episodeNumber
) {}
