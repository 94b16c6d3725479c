package com.mediaplatform.common.scoring;

import com.mediaplatform.common.model.MediaType;

/**
 * Hints passed to {@link ScoringOracle#scoreRelease} so it can adapt its size heuristics.
 *
 * @param episodeCount number of episodes a pack is expected to contain; 0 when unknown
 */
public record ScoringContext(MediaType mediaType, boolean isSeasonPack, int episodeCount) {

    public static ScoringContext movie() {
        return new ScoringContext(MediaType.MOVIE, false, 0);
    }

    public static ScoringContext singleEpisode() {
        return new ScoringContext(MediaType.TV, false, 1);
    }

    public static ScoringContext pack(boolean isSeasonPack, int episodeCount) {
        return new ScoringContext(MediaType.TV, isSeasonPack, episodeCount);
    }
}
