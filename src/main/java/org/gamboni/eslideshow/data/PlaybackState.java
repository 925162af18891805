package org.gamboni.eslideshow.data;

import java.util.Optional;

/**
 * Playback state as seen by the rest of the application, whichever backend is playing.
 *
 * @param trackUri Spotify URI of the current track, {@code null} if none
 * @param trackName display name of the current track, if known
 * @param artistName display name of the current artist, if known
 * @param positionMs position in the current track
 * @param durationMs duration of the current track, zero if unknown
 * @param isPlaying true if audio is playing (not paused)
 * @param isBuffering true while a requested track has not started yet
 */
public record PlaybackState(
        String trackUri,
        String trackName,
        String artistName,
        long positionMs,
        long durationMs,
        boolean isPlaying,
        boolean isBuffering) {

    public static final PlaybackState IDLE = new PlaybackState(
            null,
            null,
            null,
            0,
            0,
            false,
            false);

    public static PlaybackState buffering(String trackUri, long positionMs) {
        return new PlaybackState(trackUri, null, null, positionMs, 0, false, true);
    }

    public Optional<String> track() {
        return Optional.ofNullable(trackUri);
    }
}
