package com.mediaplatform.decision.monitoring;

import com.mediaplatform.common.model.ExistingFile;
import com.mediaplatform.common.model.ScoringProfile;

import java.util.Optional;

/**
 * Shared rule behind the movie and episode cutoff-unmet specifications.
 *
 * <pre>
 *   no existing file           → NO_EXISTING_FILE (missing, not an upgrade target)
 *   no profile                 → NO_PROFILE
 *   profile disables upgrades  → UPGRADES_NOT_ALLOWED
 *   otherwise                  → accept
 * </pre>
 *
 * <p>There is no hard cutoff: {@code upgradeUntilScore} is not enforced, so better releases
 * keep being searched for. The decision engine's {@code minScoreIncrement} check stops
 * frivolous upgrades once a candidate is found.
 */
final class CutoffUnmetRule {

    private CutoffUnmetRule() {}

    static SpecificationResult evaluate(Optional<ExistingFile> existingFile, Optional<ScoringProfile> profile) {
        if (existingFile.isEmpty()) {
            return SpecificationResult.reject(SearchRejection.NO_EXISTING_FILE);
        }
        if (profile.isEmpty()) {
            return SpecificationResult.reject(SearchRejection.NO_PROFILE);
        }
        if (!profile.get().upgradesAllowed()) {
            return SpecificationResult.reject(SearchRejection.UPGRADES_NOT_ALLOWED);
        }
        return SpecificationResult.accept();
    }
}
