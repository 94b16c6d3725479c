package com.mediaplatform.common.blocklist;

import com.mediaplatform.common.model.ReleaseCandidate;

/**
 * Decides whether a release was previously blocklisted for the given media.
 */
public interface BlocklistGate {

    /**
     * @return an accepting verdict, or a rejection with a human-readable reason; never null
     */
    BlocklistVerdict isSatisfied(ReleaseCandidate candidate, BlocklistScope scope);
}
