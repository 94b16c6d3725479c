package com.mediaplatform.decision.monitoring;

import com.mediaplatform.common.model.Movie;
import com.mediaplatform.common.repository.MediaRepository;
import com.mediaplatform.decision.profile.ProfileResolver;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Decides whether the upgrade scheduler should keep searching for a movie.
 */
@Component
public class MovieCutoffUnmetSpecification {

    private final MediaRepository repository;
    private final ProfileResolver profileResolver;

    public MovieCutoffUnmetSpecification(MediaRepository repository, ProfileResolver profileResolver) {
        this.repository = repository;
        this.profileResolver = profileResolver;
    }

    public SpecificationResult isSatisfied(String movieId) {
        Optional<Movie> movie = repository.getMovieWithProfile(movieId);
        if (movie.isEmpty()) {
            return SpecificationResult.reject(SearchRejection.NOT_FOUND);
        }
        return CutoffUnmetRule.evaluate(
            repository.getMovieFile(movieId),
            profileResolver.resolve(movie.get().scoringProfileId()));
    }
}
