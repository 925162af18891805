package org.gamboni.eslideshow.playback;

import lombok.Setter;
import org.gamboni.eslideshow.data.BackendReadiness;
import org.gamboni.eslideshow.data.PlaybackState;
import org.gamboni.eslideshow.spotify.RepeatMode;

import java.util.concurrent.CompletableFuture;

/** Backend that plays nothing. Stands in until a real backend is selected. */
public class NoopPlaybackBackend implements PlaybackBackend {

    @Setter
    private Listener listener = Listener.NOOP;

    @Override
    public BackendMode getMode() {
        return BackendMode.NOOP;
    }

    @Override
    public BackendReadiness getReadiness() {
        return BackendReadiness.READY;
    }

    @Override
    public PlaybackState getState() {
        return PlaybackState.IDLE;
    }

    @Override
    public void initialize() {
        listener.stateChanged(PlaybackState.IDLE);
    }

    @Override
    public void stop() {}

    @Override
    public CompletableFuture<Void> playTrack(String trackUri, Long startPositionMs) {
        listener.stateChanged(PlaybackState.IDLE);
        return done();
    }

    @Override
    public CompletableFuture<Void> pause() {
        return done();
    }

    @Override
    public CompletableFuture<Void> resume() {
        return done();
    }

    @Override
    public CompletableFuture<Void> nextTrack() {
        return done();
    }

    @Override
    public CompletableFuture<Void> previousTrack() {
        return done();
    }

    @Override
    public CompletableFuture<Void> seek(long positionMs) {
        return done();
    }

    @Override
    public CompletableFuture<Void> setVolume(double volume) {
        return done();
    }

    @Override
    public CompletableFuture<Void> setShuffle(boolean on) {
        return done();
    }

    @Override
    public CompletableFuture<Void> setRepeat(RepeatMode mode) {
        return done();
    }

    private static CompletableFuture<Void> done() {
        return CompletableFuture.completedFuture(null);
    }
}
