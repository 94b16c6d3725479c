package com.mediaplatform.common.scoring;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Scorer comparison of an existing file against a candidate.
 *
 * @param improvement candidate score minus existing score (signed)
 * @param isUpgrade   the scorer's own verdict, already folding in the minimum increment
 *                    and sidegrade policy it was given
 */
public record UpgradeComparison(
    @JsonProperty("existing") ScoreResult existing,
    @JsonProperty("candidate") ScoreResult candidate,
    @JsonProperty("improvement") int improvement,
    @JsonProperty("isUpgrade") boolean isUpgrade
) {}
