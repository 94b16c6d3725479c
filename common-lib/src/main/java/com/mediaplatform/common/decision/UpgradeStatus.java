package com.mediaplatform.common.decision;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Comparison outcome attached to every {@link DecisionResult}, accepted or not, so the UI
 * can show why a release was rejected (a downgrade vs a blocked sidegrade).
 *
 * <ul>
 *   <li>{@link #UPGRADE}: candidate scores higher than the existing file(s)</li>
 *   <li>{@link #SIDEGRADE}: zero net change, or a pack with mixed per-episode results</li>
 *   <li>{@link #DOWNGRADE}: candidate scores lower</li>
 *   <li>{@link #NEW}: nothing on disk yet</li>
 *   <li>{@link #BLOCKED}: rejected by the blocklist before any scoring</li>
 *   <li>{@link #REJECTED}: rejected for a reason unrelated to the comparison</li>
 * </ul>
 */
public enum UpgradeStatus {
    @JsonProperty("upgrade")   UPGRADE,
    @JsonProperty("sidegrade") SIDEGRADE,
    @JsonProperty("downgrade") DOWNGRADE,
    @JsonProperty("new")       NEW,
    @JsonProperty("blocked")   BLOCKED,
    @JsonProperty("rejected")  REJECTED
}
