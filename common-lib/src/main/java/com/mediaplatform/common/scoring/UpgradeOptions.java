package com.mediaplatform.common.scoring;

/**
 * Policy passed to {@link ScoringOracle#isUpgrade}.
 *
 * @param candidateSizeBytes may be null when the size is unknown
 */
public record UpgradeOptions(int minimumImprovement, boolean allowSidegrade, Long candidateSizeBytes) {}
