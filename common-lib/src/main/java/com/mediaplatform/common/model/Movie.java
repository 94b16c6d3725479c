package com.mediaplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param scoringProfileId assigned profile; may be null or point at a deleted profile
 */
public record Movie(
    @JsonProperty("id") String id,
    @JsonProperty("title") String title,
    @JsonProperty("scoringProfileId") String scoringProfileId
) {}
