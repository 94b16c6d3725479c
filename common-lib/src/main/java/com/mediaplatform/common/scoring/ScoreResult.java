package com.mediaplatform.common.scoring;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Scorer verdict for one release title against one profile.
 *
 * @param sizeRejectionReason scorer-supplied explanation; may be null even when
 *                            {@code sizeRejected} is true
 */
public record ScoreResult(
    @JsonProperty("totalScore") int totalScore,
    @JsonProperty("isBanned") boolean isBanned,
    @JsonProperty("bannedReasons") List<String> bannedReasons,
    @JsonProperty("sizeRejected") boolean sizeRejected,
    @JsonProperty("sizeRejectionReason") String sizeRejectionReason,
    @JsonProperty("meetsMinimum") boolean meetsMinimum
) {
    public ScoreResult {
        bannedReasons = bannedReasons == null ? List.of() : List.copyOf(bannedReasons);
    }

    /** A clean result: not banned, size accepted, minimum met. */
    public static ScoreResult passing(int totalScore) {
        return new ScoreResult(totalScore, false, List.of(), false, null, true);
    }

    public static ScoreResult belowMinimum(int totalScore) {
        return new ScoreResult(totalScore, false, List.of(), false, null, false);
    }

    public static ScoreResult banned(int totalScore, List<String> reasons) {
        return new ScoreResult(totalScore, true, reasons, false, null, false);
    }

    public static ScoreResult sizeRejected(int totalScore, String reason) {
        return new ScoreResult(totalScore, false, List.of(), true, reason, true);
    }
}
