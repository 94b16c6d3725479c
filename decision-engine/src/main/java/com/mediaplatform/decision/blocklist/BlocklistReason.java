package com.mediaplatform.decision.blocklist;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a release was blocklisted.
 */
public enum BlocklistReason {
    DOWNLOAD_FAILED("download_failed"),
    IMPORT_FAILED("import_failed"),
    QUALITY_MISMATCH("quality_mismatch"),
    MANUAL("manual");

    private final String code;

    BlocklistReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
