package com.mediaplatform.decision.support;

import com.mediaplatform.common.model.ScoringProfile;
import com.mediaplatform.common.scoring.ScoreResult;
import com.mediaplatform.common.scoring.ScoringContext;
import com.mediaplatform.common.scoring.ScoringOracle;
import com.mediaplatform.common.scoring.UpgradeComparison;
import com.mediaplatform.common.scoring.UpgradeOptions;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Table-driven scorer. Unknown titles score 0. A title scoring below the profile's
 * {@code minScore} fails the minimum gate.
 *
 * <p>Upgrade verdict:
 * <pre>
 *   improvement &gt; 0  → improvement ≥ minimumImprovement
 *   improvement == 0 → allowSidegrade
 *   improvement &lt; 0  → false
 * </pre>
 */
public class FakeScoringOracle implements ScoringOracle {

    private final Map<String, Integer> scores = new HashMap<>();
    private final Map<String, List<String>> banned = new HashMap<>();
    private final Map<String, String> sizeRejected = new HashMap<>();
    private final Set<String> belowMinimum = new HashSet<>();

    private final List<ScoringContext> scoreContexts = new ArrayList<>();
    private final List<UpgradeOptions> upgradeOptions = new ArrayList<>();
    private int compareCalls;

    public FakeScoringOracle score(String title, int score) {
        scores.put(title, score);
        return this;
    }

    public FakeScoringOracle ban(String title, String... reasons) {
        banned.put(title, List.of(reasons));
        return this;
    }

    public FakeScoringOracle rejectSize(String title, String reason) {
        sizeRejected.put(title, reason);
        return this;
    }

    public FakeScoringOracle belowMinimum(String title) {
        belowMinimum.add(title);
        return this;
    }

    public int scoreCalls() {
        return scoreContexts.size();
    }

    public List<ScoringContext> scoreContexts() {
        return scoreContexts;
    }

    public int compareCalls() {
        return compareCalls;
    }

    public List<UpgradeOptions> upgradeOptions() {
        return upgradeOptions;
    }

    @Override
    public ScoreResult scoreRelease(String title, ScoringProfile profile, String existingIdentity,
                                    Long sizeBytes, ScoringContext context) {
        scoreContexts.add(context);
        return resultFor(title, profile);
    }

    @Override
    public UpgradeComparison isUpgrade(String existingIdentity, String candidateTitle,
                                       ScoringProfile profile, UpgradeOptions options) {
        compareCalls++;
        upgradeOptions.add(options);
        ScoreResult existing = resultFor(existingIdentity, profile);
        ScoreResult candidate = resultFor(candidateTitle, profile);
        int improvement = candidate.totalScore() - existing.totalScore();
        boolean upgrade;
        if (improvement > 0) {
            upgrade = improvement >= options.minimumImprovement();
        } else if (improvement == 0) {
            upgrade = options.allowSidegrade();
        } else {
            upgrade = false;
        }
        if (candidate.isBanned() || candidate.sizeRejected()) {
            upgrade = false;
        }
        return new UpgradeComparison(existing, candidate, improvement, upgrade);
    }

    private ScoreResult resultFor(String title, ScoringProfile profile) {
        int score = scores.getOrDefault(title, 0);
        if (banned.containsKey(title)) {
            return ScoreResult.banned(score, banned.get(title));
        }
        if (sizeRejected.containsKey(title)) {
            return ScoreResult.sizeRejected(score, sizeRejected.get(title));
        }
        return belowMinimum.contains(title) || score < profile.minScore()
            ? ScoreResult.belowMinimum(score)
            : ScoreResult.passing(score);
    }
}
