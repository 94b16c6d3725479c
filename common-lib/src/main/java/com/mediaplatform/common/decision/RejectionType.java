package com.mediaplatform.common.decision;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Machine-readable rejection codes. {@link #code()} is the wire value consumed by the UI.
 */
public enum RejectionType {
    MOVIE_NOT_FOUND("movie_not_found"),
    EPISODE_NOT_FOUND("episode_not_found"),
    SERIES_NOT_FOUND("series_not_found"),
    EPISODES_NOT_FOUND("episodes_not_found"),
    NO_EPISODES("no_episodes"),
    NO_PROFILE("no_profile"),
    BLOCKLISTED("blocklisted"),
    SAME_HASH("same_hash"),
    BANNED("banned"),
    SIZE_REJECTED("size_rejected"),
    BELOW_MINIMUM("below_minimum"),
    UPGRADES_NOT_ALLOWED("upgrades_not_allowed"),
    QUALITY_NOT_BETTER("quality_not_better"),
    IMPROVEMENT_TOO_SMALL("improvement_too_small"),
    NOT_UPGRADE("not_upgrade"),
    NO_NET_BENEFIT("no_net_benefit"),
    ERROR("error");

    private final String code;

    RejectionType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
