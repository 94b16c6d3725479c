package com.mediaplatform.common.blocklist;

/**
 * The media a blocklist lookup is restricted to. Exactly one id is set.
 */
public record BlocklistScope(String movieId, String seriesId) {

    public BlocklistScope {
        if ((movieId == null) == (seriesId == null)) {
            throw new IllegalArgumentException("BlocklistScope needs exactly one of movieId / seriesId");
        }
    }

    public static BlocklistScope movie(String movieId) {
        return new BlocklistScope(movieId, null);
    }

    public static BlocklistScope series(String seriesId) {
        return new BlocklistScope(null, seriesId);
    }

    public boolean isMovie() {
        return movieId != null;
    }
}
