package com.mediaplatform.decision.monitoring;

import com.mediaplatform.common.model.Episode;
import com.mediaplatform.common.model.ExistingFile;
import com.mediaplatform.common.model.Series;
import com.mediaplatform.common.repository.MediaRepository;
import com.mediaplatform.decision.profile.ProfileResolver;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Decides whether the upgrade scheduler should keep searching for an episode.
 */
@Component
public class EpisodeCutoffUnmetSpecification {

    private final MediaRepository repository;
    private final ProfileResolver profileResolver;

    public EpisodeCutoffUnmetSpecification(MediaRepository repository, ProfileResolver profileResolver) {
        this.repository = repository;
        this.profileResolver = profileResolver;
    }

    public SpecificationResult isSatisfied(String episodeId) {
        Optional<Episode> episode = repository.getEpisodeWithSeriesAndProfile(episodeId);
        if (episode.isEmpty()) {
            return SpecificationResult.reject(SearchRejection.NOT_FOUND);
        }
        Optional<Series> series = repository.getSeriesWithProfile(episode.get().seriesId());
        if (series.isEmpty()) {
            return SpecificationResult.reject(SearchRejection.NOT_FOUND);
        }
        Optional<ExistingFile> file = repository.getEpisodeFilesBySeries(episode.get().seriesId()).stream()
            .filter(f -> f.covers(episodeId))
            .findFirst();
        return CutoffUnmetRule.evaluate(file, profileResolver.resolve(series.get().scoringProfileId()));
    }
}
