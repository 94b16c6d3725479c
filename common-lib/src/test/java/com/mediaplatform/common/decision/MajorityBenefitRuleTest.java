package com.mediaplatform.common.decision;

import com.mediaplatform.common.decision.MajorityBenefitRule.Verdict;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link MajorityBenefitRule}.
 */
class MajorityBenefitRuleTest {

    private static UpgradeStats stats(int improved, int unchanged, int downgraded, int newEpisodes) {
        return new UpgradeStats(improved, unchanged, downgraded, newEpisodes,
            improved + unchanged + downgraded + newEpisodes);
    }

    // ── evaluate() ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("evaluate()")
    class EvaluateTests {

        @Test
        @DisplayName("no existing file in scope → ALL_NEW even when upgrades are disabled")
        void allNew() {
            assertEquals(Verdict.ALL_NEW, MajorityBenefitRule.evaluate(stats(0, 0, 0, 5), false));
            assertEquals(Verdict.ALL_NEW, MajorityBenefitRule.evaluate(stats(0, 0, 0, 5), true));
        }

        @Test
        @DisplayName("upgrades disabled and one improvement → UPGRADES_NOT_ALLOWED")
        void upgradesDisabled() {
            assertEquals(Verdict.UPGRADES_NOT_ALLOWED,
                MajorityBenefitRule.evaluate(stats(1, 0, 0, 4), false));
        }

        @Test
        @DisplayName("upgrades disabled but nothing improved → majority rule still applies")
        void upgradesDisabledNothingImproved() {
            assertEquals(Verdict.ACCEPT, MajorityBenefitRule.evaluate(stats(0, 2, 0, 3), false));
            assertEquals(Verdict.NO_NET_BENEFIT, MajorityBenefitRule.evaluate(stats(0, 0, 2, 1), false));
        }

        @Test
        @DisplayName("4 improved + 4 new − 2 downgraded = 6 → ACCEPT")
        void majorityBenefit() {
            assertEquals(Verdict.ACCEPT, MajorityBenefitRule.evaluate(stats(4, 0, 2, 4), true));
        }

        @Test
        @DisplayName("1 improved − 3 downgraded = −2 → NO_NET_BENEFIT")
        void netHarm() {
            assertEquals(Verdict.NO_NET_BENEFIT, MajorityBenefitRule.evaluate(stats(1, 0, 3, 0), true));
        }

        @Test
        @DisplayName("benefit equal to harm (net 0) → NO_NET_BENEFIT")
        void tie() {
            assertEquals(Verdict.NO_NET_BENEFIT, MajorityBenefitRule.evaluate(stats(2, 0, 2, 0), true));
        }

        @Test
        @DisplayName("all unchanged → NO_NET_BENEFIT")
        void allUnchanged() {
            assertEquals(Verdict.NO_NET_BENEFIT, MajorityBenefitRule.evaluate(stats(0, 6, 0, 0), true));
        }

        @Test
        @DisplayName("accept iff improved + new > downgraded, over a grid of small counts")
        void lawHoldsOnGrid() {
            for (int improved = 0; improved <= 3; improved++) {
                for (int downgraded = 0; downgraded <= 3; downgraded++) {
                    for (int fresh = 0; fresh <= 3; fresh++) {
                        UpgradeStats s = stats(improved, 1, downgraded, fresh);
                        boolean expected = improved + fresh > downgraded;
                        assertEquals(expected, MajorityBenefitRule.evaluate(s, true) == Verdict.ACCEPT,
                            "improved=" + improved + " downgraded=" + downgraded + " new=" + fresh);
                    }
                }
            }
        }
    }

    // ── acceptedStatus() ──────────────────────────────────────────────────

    @Nested
    @DisplayName("acceptedStatus()")
    class AcceptedStatusTests {

        @Test
        @DisplayName("any downgrade → SIDEGRADE")
        void mixed() {
            assertEquals(UpgradeStatus.SIDEGRADE, MajorityBenefitRule.acceptedStatus(stats(4, 0, 2, 4)));
        }

        @Test
        @DisplayName("improvements, no downgrades → UPGRADE")
        void clean() {
            assertEquals(UpgradeStatus.UPGRADE, MajorityBenefitRule.acceptedStatus(stats(3, 1, 0, 2)));
        }

        @Test
        @DisplayName("only new episodes → NEW")
        void onlyNew() {
            assertEquals(UpgradeStatus.NEW, MajorityBenefitRule.acceptedStatus(stats(0, 2, 0, 2)));
        }
    }

    @Test
    @DisplayName("netBenefit, benefited and hasExistingFiles")
    void helpers() {
        UpgradeStats s = stats(4, 0, 2, 4);
        assertEquals(6, MajorityBenefitRule.netBenefit(s));
        assertEquals(8, MajorityBenefitRule.benefited(s));
        assertTrue(MajorityBenefitRule.hasExistingFiles(s));
        assertFalse(MajorityBenefitRule.hasExistingFiles(stats(0, 0, 0, 3)));
    }
}
