package org.gamboni.eslideshow.playback;

import org.gamboni.eslideshow.data.BackendReadiness;
import org.gamboni.eslideshow.data.PlaybackError;
import org.gamboni.eslideshow.data.PlaybackState;
import org.gamboni.eslideshow.spotify.RepeatMode;

import java.util.concurrent.CompletableFuture;

/**
 * Something that can play music for a slideshow. The rest of the application talks only to this interface,
 * never to the Web API or to the player process directly.
 *
 * <p>Commands return at once. The returned future completes when the backend has carried the command out (or
 * handed it to the player), and fails if it could not: with {@link BackendNotReadyException} straight away if
 * the backend is not ready. Failures are also reported to the listener.
 */
public interface PlaybackBackend {

    interface Listener {
        Listener NOOP = new Listener() {
            @Override
            public void stateChanged(PlaybackState state) {}

            @Override
            public void error(PlaybackError error) {}

            @Override
            public void readinessChanged(BackendReadiness readiness) {}
        };

        void stateChanged(PlaybackState state);

        void error(PlaybackError error);

        void readinessChanged(BackendReadiness readiness);
    }

    void setListener(Listener listener);

    BackendMode getMode();

    BackendReadiness getReadiness();

    default boolean isReady() {
        return getReadiness().isReady();
    }

    /** Latest known playback state. */
    PlaybackState getState();

    /** Prepare the backend. Safe to call again: does nothing while already ready or starting. */
    void initialize();

    /** Release whatever the backend holds (processes, polls). It can be initialized again afterwards. */
    void stop();

    /** @param startPositionMs where to start in the track, or {@code null} for the beginning */
    CompletableFuture<Void> playTrack(String trackUri, Long startPositionMs);

    CompletableFuture<Void> pause();

    CompletableFuture<Void> resume();

    CompletableFuture<Void> nextTrack();

    CompletableFuture<Void> previousTrack();

    CompletableFuture<Void> seek(long positionMs);

    /** @param volume between 0 and 1, clamped */
    CompletableFuture<Void> setVolume(double volume);

    CompletableFuture<Void> setShuffle(boolean on);

    CompletableFuture<Void> setRepeat(RepeatMode mode);
}
