package com.mediaplatform.common.decision;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-episode outcome counts for a season, series or multi-episode evaluation.
 *
 * <p>Invariant, enforced at construction:
 * <pre>
 *   improved + unchanged + downgraded + newEpisodes == total
 * </pre>
 */
public record UpgradeStats(
    @JsonProperty("improved") int improved,
    @JsonProperty("unchanged") int unchanged,
    @JsonProperty("downgraded") int downgraded,
    @JsonProperty("newEpisodes") int newEpisodes,
    @JsonProperty("total") int total
) {
    public UpgradeStats {
        if (improved < 0 || unchanged < 0 || downgraded < 0 || newEpisodes < 0) {
            throw new IllegalArgumentException("UpgradeStats counts must be non-negative");
        }
        if (improved + unchanged + downgraded + newEpisodes != total) {
            throw new IllegalArgumentException(String.format(
                "UpgradeStats do not sum to total: %d+%d+%d+%d != %d",
                improved, unchanged, downgraded, newEpisodes, total));
        }
    }
}
