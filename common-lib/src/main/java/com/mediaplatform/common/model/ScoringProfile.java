package com.mediaplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Read-only snapshot of a user-configured scoring profile.
 *
 * <p>The engine passes the whole profile to the scorer and never reads {@code minScore}
 * itself; the minimum gate it applies is the scorer's {@code meetsMinimum} verdict.
 *
 * <p>{@code upgradeUntilScore} is a search-stopping threshold. The release decision
 * engine never reads it; only the cutoff-unmet search eligibility checks may.
 *
 * @param id                 profile identifier
 * @param name               display name
 * @param isDefault          true when this profile is flagged as the global default
 * @param upgradesAllowed    false disables replacing existing files
 * @param minScoreIncrement  minimum score delta for a candidate to count as an upgrade
 * @param upgradeUntilScore  score at which searching for further upgrades stops
 * @param minScore           minimum score a release must reach; read by the {@link
 *                           com.mediaplatform.common.scoring.ScoringOracle}, which reports it
 *                           as {@code ScoreResult.meetsMinimum}
 */
public record ScoringProfile(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("isDefault") boolean isDefault,
    @JsonProperty("upgradesAllowed") boolean upgradesAllowed,
    @JsonProperty("minScoreIncrement") int minScoreIncrement,
    @JsonProperty("upgradeUntilScore") int upgradeUntilScore,
    @JsonProperty("minScore") int minScore
) {
    public ScoringProfile {
        Objects.requireNonNull(id, "profile id");
        if (minScoreIncrement < 0) {
            throw new IllegalArgumentException("minScoreIncrement must be >= 0, got " + minScoreIncrement);
        }
    }

    /** Profile with upgrades enabled and no cutoff. */
    public static ScoringProfile of(String id, boolean upgradesAllowed, int minScoreIncrement) {
        return new ScoringProfile(id, id, false, upgradesAllowed, minScoreIncrement, Integer.MAX_VALUE, 0);
    }

    public ScoringProfile asDefault() {
        return new ScoringProfile(id, name, true, upgradesAllowed, minScoreIncrement, upgradeUntilScore, minScore);
    }
}
