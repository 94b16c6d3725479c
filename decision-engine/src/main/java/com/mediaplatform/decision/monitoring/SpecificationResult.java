package com.mediaplatform.decision.monitoring;

/**
 * Outcome of a search-eligibility specification.
 *
 * @param reason rejection code; null when accepted
 */
public record SpecificationResult(boolean accepted, SearchRejection reason) {

    private static final SpecificationResult ACCEPT = new SpecificationResult(true, null);

    public static SpecificationResult accept() {
        return ACCEPT;
    }

    public static SpecificationResult reject(SearchRejection reason) {
        return new SpecificationResult(false, reason);
    }
}
