package com.mediaplatform.decision.blocklist;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.mediaplatform.common.model.ReleaseCandidate;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * A release that must not be grabbed again for the associated movie or series.
 *
 * <h3>Matching</h3>
 * <ul>
 *   <li>infoHash: equal ignoring case, when both sides carry one</li>
 *   <li>title: equal ignoring case, and the entry's indexer is unset or equals the
 *                  candidate's indexer</li>
 * </ul>
 *
 * @param createdAt required; the store orders lookups by it
 * @param expiresAt null means the entry never expires
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BlocklistEntry(
    @JsonProperty("id") String id,
    @JsonProperty("title") String title,
    @JsonProperty("infoHash") String infoHash,
    @JsonProperty("indexerId") String indexerId,
    @JsonProperty("movieId") String movieId,
    @JsonProperty("seriesId") String seriesId,
    @JsonProperty("episodeIds") Set<String> episodeIds,
    @JsonProperty("reason") BlocklistReason reason,
    @JsonProperty("message") String message,
    @JsonProperty("size") Long size,
    @JsonProperty("protocol") String protocol,
    @JsonProperty("createdAt") Instant createdAt,
    @JsonProperty("expiresAt") Instant expiresAt
) {
    public BlocklistEntry {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(createdAt, "createdAt");
        if (movieId == null && seriesId == null) {
            throw new IllegalArgumentException("BlocklistEntry needs a movieId or a seriesId");
        }
        episodeIds = episodeIds == null ? Set.of() : Set.copyOf(episodeIds);
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    public boolean matches(ReleaseCandidate candidate) {
        if (infoHash != null && candidate.infoHash() != null
                && infoHash.equalsIgnoreCase(candidate.infoHash())) {
            return true;
        }
        if (!title.equalsIgnoreCase(candidate.title())) {
            return false;
        }
        return indexerId == null || indexerId.equals(candidate.indexerId());
    }
}
