package com.mediaplatform.common.scoring;

import com.mediaplatform.common.model.ScoringProfile;

/**
 * Black-box release scorer. Implementations must be pure, synchronous and thread-safe;
 * the decision engine calls them from any thread and relies on identical inputs
 * producing identical outputs.
 */
public interface ScoringOracle {

    /**
     * Scores a release title on its own. {@code meetsMinimum} reflects the profile's
     * {@code minScore}.
     *
     * @param existingIdentity identity of an existing file for context, or null
     * @param sizeBytes        release size, or null when unknown
     */
    ScoreResult scoreRelease(String title, ScoringProfile profile, String existingIdentity,
                             Long sizeBytes, ScoringContext context);

    /**
     * Compares a candidate against an existing file.
     */
    UpgradeComparison isUpgrade(String existingIdentity, String candidateTitle,
                                ScoringProfile profile, UpgradeOptions options);
}
