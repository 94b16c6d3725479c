package com.mediaplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * The release being offered by an indexer. Ephemeral: lives for one evaluation call.
 */
public record ReleaseCandidate(
    @JsonProperty("title") String title,
    @JsonProperty("size") Long size,
    @JsonProperty("infoHash") String infoHash,
    @JsonProperty("indexerId") String indexerId,
    @JsonProperty("downloadUrl") String downloadUrl,
    @JsonProperty("magnetUrl") String magnetUrl
) {
    public ReleaseCandidate {
        Objects.requireNonNull(title, "release title");
    }

    public static ReleaseCandidate of(String title) {
        return new ReleaseCandidate(title, null, null, null, null, null);
    }

    public static ReleaseCandidate of(String title, Long size, String infoHash) {
        return new ReleaseCandidate(title, size, infoHash, null, null, null);
    }
}
