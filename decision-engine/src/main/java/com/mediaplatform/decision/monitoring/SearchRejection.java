package com.mediaplatform.decision.monitoring;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SearchRejection {
    NOT_FOUND("not_found"),
    NO_EXISTING_FILE("no_existing_file"),
    NO_PROFILE("no_profile"),
    UPGRADES_NOT_ALLOWED("upgrades_not_allowed");

    private final String code;

    SearchRejection(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
