package com.mediaplatform.common.decision;

/**
 * Stateless interpreter of a single existing-vs-candidate score comparison.
 *
 * <h3>Status from the sign of the improvement</h3>
 * <pre>
 *   improvement &gt; 0  → UPGRADE
 *   improvement == 0 → SIDEGRADE
 *   improvement &lt; 0  → DOWNGRADE
 * </pre>
 *
 * <h3>Sub-reason when the scorer says "not an upgrade"</h3>
 * <pre>
 *   improvement ≤ 0                       → QUALITY_NOT_BETTER
 *   0 &lt; improvement &lt; minScoreIncrement   → IMPROVEMENT_TOO_SMALL
 *   otherwise                             → NOT_UPGRADE
 * </pre>
 * {@code QUALITY_NOT_BETTER} is checked first, so a zero increment never yields
 * {@code IMPROVEMENT_TOO_SMALL}.
 */
public final class UpgradeClassifier {

    private UpgradeClassifier() {}

    public static UpgradeStatus statusFor(int improvement) {
        if (improvement > 0) return UpgradeStatus.UPGRADE;
        if (improvement == 0) return UpgradeStatus.SIDEGRADE;
        return UpgradeStatus.DOWNGRADE;
    }

    /**
     * Builds the rejection for a comparison the scorer did not accept as an upgrade.
     * The rejection carries the comparison status so callers can tell a downgrade from
     * a blocked sidegrade.
     */
    public static DecisionResult rejectNonUpgrade(int improvement, int minScoreIncrement) {
        UpgradeStatus status = statusFor(improvement);
        if (improvement <= 0) {
            return DecisionResult.rejected("Release is not better quality",
                RejectionType.QUALITY_NOT_BETTER, status);
        }
        if (improvement < minScoreIncrement) {
            return DecisionResult.rejected(
                String.format("Score improvement (%d) below minimum increment (%d)",
                    improvement, minScoreIncrement),
                RejectionType.IMPROVEMENT_TOO_SMALL, status);
        }
        return DecisionResult.rejected("Release does not qualify as upgrade",
            RejectionType.NOT_UPGRADE, status);
    }
}
