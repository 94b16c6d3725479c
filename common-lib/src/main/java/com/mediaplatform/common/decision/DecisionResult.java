package com.mediaplatform.common.decision;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Immutable output of one release decision evaluation.
 *
 * <p>Construct only through {@link #accepted} and {@link #rejected}. Optional fields
 * are {@code null} when not applicable:
 * <ul>
 *   <li>{@code rejectionType}: set only on rejections</li>
 *   <li>{@code upgradeStats}: set for aggregate scopes (season, series, episode set)</li>
 *   <li>{@code candidateScore}, {@code existingScore}, {@code scoreImprovement}: set when a
 *       score was computed for the outcome being reported</li>
 * </ul>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DecisionResult(
    @JsonProperty("accepted") boolean accepted,
    @JsonProperty("reason") String reason,
    @JsonProperty("rejectionType") RejectionType rejectionType,
    @JsonProperty("isUpgrade") boolean isUpgrade,
    @JsonProperty("upgradeStatus") UpgradeStatus upgradeStatus,
    @JsonProperty("upgradeStats") UpgradeStats upgradeStats,
    @JsonProperty("candidateScore") Integer candidateScore,
    @JsonProperty("existingScore") Integer existingScore,
    @JsonProperty("scoreImprovement") Integer scoreImprovement
) {
    public DecisionResult {
        Objects.requireNonNull(upgradeStatus, "upgradeStatus");
        if (accepted && rejectionType != null) {
            throw new IllegalArgumentException("accepted result cannot carry a rejection type");
        }
        if (!accepted && rejectionType == null) {
            throw new IllegalArgumentException("rejected result requires a rejection type");
        }
    }

    // ── Factories ────────────────────────────────────────────────────────────

    public static DecisionResult accepted(UpgradeStatus status, String reason, boolean isUpgrade) {
        return new DecisionResult(true, reason, null, isUpgrade, status, null, null, null, null);
    }

    public static DecisionResult accepted(UpgradeStatus status, String reason, boolean isUpgrade,
                                          UpgradeStats stats, Integer candidateScore) {
        return new DecisionResult(true, reason, null, isUpgrade, status, stats, candidateScore, null, null);
    }

    /** Accepted single-file upgrade with the full score breakdown. */
    public static DecisionResult acceptedUpgrade(UpgradeStatus status, String reason,
                                                 int candidateScore, int existingScore, int improvement) {
        return new DecisionResult(true, reason, null, true, status, null,
            candidateScore, existingScore, improvement);
    }

    public static DecisionResult rejected(String reason, RejectionType type) {
        return rejected(reason, type, UpgradeStatus.REJECTED, null);
    }

    public static DecisionResult rejected(String reason, RejectionType type, UpgradeStatus status) {
        return rejected(reason, type, status, null);
    }

    public static DecisionResult rejected(String reason, RejectionType type, UpgradeStatus status,
                                          UpgradeStats stats) {
        return new DecisionResult(false, reason, type, false, status, stats, null, null, null);
    }
}
