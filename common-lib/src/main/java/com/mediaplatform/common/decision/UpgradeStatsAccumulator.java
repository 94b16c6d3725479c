package com.mediaplatform.common.decision;

import com.mediaplatform.common.scoring.UpgradeComparison;

/**
 * Per-call counter for aggregate evaluations. Not thread-safe; create one per evaluation.
 *
 * <p>Classification of an episode with an existing file:
 * <pre>
 *   comparison.isUpgrade          → improved
 *   comparison.improvement == 0   → unchanged
 *   otherwise                     → downgraded
 * </pre>
 */
public final class UpgradeStatsAccumulator {

    private int improved;
    private int unchanged;
    private int downgraded;
    private int newEpisodes;

    public void recordNew() {
        newEpisodes++;
    }

    public void recordComparison(UpgradeComparison comparison) {
        if (comparison.isUpgrade()) {
            improved++;
        } else if (comparison.improvement() == 0) {
            unchanged++;
        } else {
            downgraded++;
        }
    }

    /** Forced grabs count every replaced file as improved without scoring it. */
    public void recordForcedReplacement() {
        improved++;
    }

    public UpgradeStats toStats() {
        return new UpgradeStats(improved, unchanged, downgraded, newEpisodes,
            improved + unchanged + downgraded + newEpisodes);
    }
}
