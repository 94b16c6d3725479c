package com.mediaplatform.common.decision;

/**
 * Majority-benefit rule for releases covering several episodes.
 *
 * <pre>
 *   netBenefit = improved + newEpisodes − downgraded
 *
 *   no existing file in scope           → ALL_NEW (only the minimum-score gate applies)
 *   upgrades disabled and improved &gt; 0  → UPGRADES_NOT_ALLOWED
 *   netBenefit ≤ 0                      → NO_NET_BENEFIT
 *   otherwise                           → ACCEPT
 * </pre>
 *
 * <p>A pack that downgrades a minority of episodes is accepted when the benefit to the
 * rest outweighs it. This is the intended policy, matching Sonarr.
 *
 * <p>This class is stateless, pure, and thread-safe.
 */
public final class MajorityBenefitRule {

    public enum Verdict {
        ALL_NEW,
        UPGRADES_NOT_ALLOWED,
        NO_NET_BENEFIT,
        ACCEPT
    }

    private MajorityBenefitRule() {}

    public static int netBenefit(UpgradeStats stats) {
        return stats.improved() + stats.newEpisodes() - stats.downgraded();
    }

    /** At least one episode in scope already has a file. */
    public static boolean hasExistingFiles(UpgradeStats stats) {
        return stats.total() > stats.newEpisodes();
    }

    /** Episodes that gain something: upgraded or newly provided. */
    public static int benefited(UpgradeStats stats) {
        return stats.improved() + stats.newEpisodes();
    }

    public static Verdict evaluate(UpgradeStats stats, boolean upgradesAllowed) {
        if (!hasExistingFiles(stats)) {
            return Verdict.ALL_NEW;
        }
        if (!upgradesAllowed && stats.improved() > 0) {
            return Verdict.UPGRADES_NOT_ALLOWED;
        }
        if (netBenefit(stats) <= 0) {
            return Verdict.NO_NET_BENEFIT;
        }
        return Verdict.ACCEPT;
    }

    /**
     * Status of an accepted pack: mixed results are reported as a sidegrade rather than
     * a clean upgrade.
     */
    public static UpgradeStatus acceptedStatus(UpgradeStats stats) {
        if (stats.downgraded() > 0) return UpgradeStatus.SIDEGRADE;
        if (stats.improved() > 0) return UpgradeStatus.UPGRADE;
        return UpgradeStatus.NEW;
    }
}
