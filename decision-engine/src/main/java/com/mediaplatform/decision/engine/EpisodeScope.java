package com.mediaplatform.decision.engine;

import com.mediaplatform.common.model.Episode;
import com.mediaplatform.common.model.ExistingFile;
import com.mediaplatform.common.model.ScoringProfile;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A resolved set of target episodes with their existing files, as consumed by the
 * aggregate (majority-benefit) evaluation.
 *
 * @param label          human-readable pack kind used in reasons ("Season pack", ...)
 * @param seriesId       series all target episodes belong to
 * @param profile        effective scoring profile
 * @param episodeIds     target episode ids in evaluation order
 * @param filesByEpisode episode id → existing file; a multi-episode file appears under
 *                       every id it covers
 * @param isSeasonPack   scorer hint: the release bundles several episodes
 */
record EpisodeScope(
    String label,
    String seriesId,
    ScoringProfile profile,
    List<String> episodeIds,
    Map<String, ExistingFile> filesByEpisode,
    boolean isSeasonPack
) {
    EpisodeScope {
        episodeIds = List.copyOf(episodeIds);
        filesByEpisode = Map.copyOf(filesByEpisode);
    }

    /**
     * Builds the scope from one batched read of the series' files. Files that cover none
     * of the target episodes are ignored.
     */
    static EpisodeScope of(String label, String seriesId, ScoringProfile profile,
                           List<Episode> episodes, Collection<ExistingFile> seriesFiles,
                           boolean isSeasonPack) {
        List<String> ids = episodes.stream().map(Episode::id).distinct().toList();
        Set<String> targets = new HashSet<>(ids);
        Map<String, ExistingFile> byEpisode = new HashMap<>();
        for (ExistingFile file : seriesFiles) {
            for (String episodeId : file.episodeIds()) {
                if (targets.contains(episodeId)) {
                    byEpisode.put(episodeId, file);
                }
            }
        }
        return new EpisodeScope(label, seriesId, profile, ids, byEpisode, isSeasonPack);
    }

    Optional<ExistingFile> fileFor(String episodeId) {
        return Optional.ofNullable(filesByEpisode.get(episodeId));
    }

    int episodeCount() {
        return episodeIds.size();
    }
}
