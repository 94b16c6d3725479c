package com.mediaplatform.common.decision;

/**
 * Per-call switches.
 *
 * @param skipBlocklist  do not consult the blocklist
 * @param allowSidegrade let the scorer treat an equal score as an upgrade; {@code null}
 *                       means "use the configured default" (false unless overridden)
 * @param force          manual override: skip every scoring and upgrade check
 *                       (the blocklist is skipped as well)
 */
public record DecisionOptions(boolean skipBlocklist, Boolean allowSidegrade, boolean force) {

    public static final DecisionOptions DEFAULTS = new DecisionOptions(false, null, false);

    public static DecisionOptions defaults() {
        return DEFAULTS;
    }

    public static DecisionOptions forced() {
        return new DecisionOptions(false, null, true);
    }

    public DecisionOptions withSkipBlocklist(boolean skip) {
        return new DecisionOptions(skip, allowSidegrade, force);
    }

    public DecisionOptions withAllowSidegrade(Boolean allow) {
        return new DecisionOptions(skipBlocklist, allow, force);
    }

    /** Blocklist runs unless the caller forced the grab or asked to skip it. */
    public boolean shouldCheckBlocklist() {
        return !force && !skipBlocklist;
    }

    public boolean allowSidegradeOr(boolean fallback) {
        return allowSidegrade != null ? allowSidegrade : fallback;
    }
}
