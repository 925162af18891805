package org.gamboni.eslideshow.playback;

import org.gamboni.eslideshow.data.BackendReadiness;
import org.gamboni.eslideshow.data.PlaybackError;
import org.gamboni.eslideshow.data.PlaybackState;
import org.gamboni.eslideshow.spotify.RepeatMode;
import org.gamboni.eslideshow.spotify.SpotifyWebApi;
import org.gamboni.eslideshow.tech.DiagnosticLog;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/** Controls the Spotify device the user already has running (desktop app, phone…) through the Web API. */
public class ExternalDevicePlaybackBackend extends AbstractPlaybackBackend {
    private final SpotifyWebApi api;

    private volatile BackendReadiness readiness = BackendReadiness.UNINITIALIZED;
    private volatile PlaybackState state = PlaybackState.IDLE;

    public ExternalDevicePlaybackBackend(SpotifyWebApi api, Executor io, DiagnosticLog diagnostics) {
        super(io, diagnostics.forComponent(ExternalDevicePlaybackBackend.class));
        this.api = api;
    }

    @Override
    public BackendMode getMode() {
        return BackendMode.EXTERNAL_DEVICE;
    }

    @Override
    public BackendReadiness getReadiness() {
        return readiness;
    }

    @Override
    public PlaybackState getState() {
        return state;
    }

    @Override
    public void initialize() {
        // Nothing to set up: commands go to whatever device is active
        readiness = BackendReadiness.READY;
        listener.readinessChanged(readiness);
    }

    @Override
    public void stop() {
        readiness = BackendReadiness.UNINITIALIZED;
        listener.readinessChanged(readiness);
    }

    @Override
    public CompletableFuture<Void> playTrack(String trackUri, Long startPositionMs) {
        return ifReady().orElseGet(() -> {
            log.info("playTrack({}, {})", trackUri, startPositionMs);
            publish(PlaybackState.buffering(trackUri, startPositionMs == null ? 0 : startPositionMs));
            return callApi("start playback", () -> api.startPlayback(trackUri, null, startPositionMs));
        });
    }

    @Override
    public CompletableFuture<Void> pause() {
        return ifReady().orElseGet(() -> callApi("pause playback", () -> api.pause(null)));
    }

    @Override
    public CompletableFuture<Void> resume() {
        return ifReady().orElseGet(() -> callApi("resume playback", () -> api.resume(null)));
    }

    @Override
    public CompletableFuture<Void> nextTrack() {
        return ifReady().orElseGet(() -> callApi("skip to next track", () -> api.skipNext(null)));
    }

    @Override
    public CompletableFuture<Void> previousTrack() {
        return ifReady().orElseGet(() -> callApi("skip to previous track", () -> api.skipPrevious(null)));
    }

    @Override
    public CompletableFuture<Void> seek(long positionMs) {
        return ifReady().orElseGet(() -> callApi("seek", () -> api.seek(Math.max(0, positionMs), null)));
    }

    @Override
    public CompletableFuture<Void> setVolume(double volume) {
        int percent = (int) Math.round(Math.max(0.0, Math.min(1.0, volume)) * 100);
        return ifReady().orElseGet(() -> callApi("set volume", () -> api.setVolume(percent, null)));
    }

    @Override
    public CompletableFuture<Void> setShuffle(boolean on) {
        return ifReady().orElseGet(() -> callApi("set shuffle", () -> api.setShuffle(on)));
    }

    @Override
    public CompletableFuture<Void> setRepeat(RepeatMode mode) {
        return ifReady().orElseGet(() -> callApi("set repeat mode", () -> api.setRepeat(mode)));
    }

    private Optional<CompletableFuture<Void>> ifReady() {
        BackendReadiness current = readiness;
        if (current.isReady()) {
            return Optional.empty();
        }
        listener.error(PlaybackError.notReady());
        return Optional.of(CompletableFuture.failedFuture(new BackendNotReadyException(current)));
    }

    private void publish(PlaybackState newState) {
        this.state = newState;
        listener.stateChanged(newState);
    }
}
