package org.gamboni.eslideshow.playback;

import org.gamboni.eslideshow.spotify.TokenProvider;
import org.gamboni.eslideshow.tech.DiagnosticLog;

import java.util.Optional;
import java.util.function.Function;

/**
 * Hands out playback backends. There is one instance per application, created at start-up and passed to whoever
 * needs a backend; it keeps the internal backend so that only one player process and one state machine ever exist.
 */
public class PlaybackBackendFactory {
    private final BackendMode defaultMode;
    private final Function<TokenProvider, ? extends PlaybackBackend> internalBackends;
    private final Function<TokenProvider, PlaybackBackend> externalBackends;
    private final DiagnosticLog.Component log;

    private PlaybackBackend internal = null;

    /**
     * @param internalBackends creates the internal backend. Called at most once.
     * @param externalBackends creates an external device backend. Called on each request.
     */
    public PlaybackBackendFactory(BackendMode defaultMode,
                                  Function<TokenProvider, ? extends PlaybackBackend> internalBackends,
                                  Function<TokenProvider, PlaybackBackend> externalBackends,
                                  DiagnosticLog diagnostics) {
        this.defaultMode = defaultMode;
        this.internalBackends = internalBackends;
        this.externalBackends = externalBackends;
        this.log = diagnostics.forComponent(PlaybackBackendFactory.class);
    }

    public Optional<PlaybackBackend> makeBackend(TokenProvider tokens) {
        return makeBackend(defaultMode, tokens);
    }

    /** @return empty if there is no token provider, meaning the user is not signed in */
    public synchronized Optional<PlaybackBackend> makeBackend(BackendMode mode, TokenProvider tokens) {
        if (tokens == null) {
            return Optional.empty();
        }
        switch (mode) {
            case NOOP:
                return Optional.of(new NoopPlaybackBackend());
            case EXTERNAL_DEVICE:
                return Optional.of(externalBackends.apply(tokens));
            case INTERNAL:
                return Optional.of(internal(tokens));
            default:
                throw new IllegalArgumentException(mode.toString());
        }
    }

    /**
     * Get the internal backend going so it is ready by the time the user wants music. Call as soon as an access
     * token is available. Repeated calls return the cached backend, restarting it only if it gave up.
     */
    public synchronized Optional<PlaybackBackend> prewarmBackend(TokenProvider tokens) {
        if (tokens == null) {
            return Optional.empty();
        }
        if (internal != null) {
            log.info("Reusing cached internal backend instance");
            if (!internal.getReadiness().isStartingOrReady()) {
                log.info("Cached internal backend not ready ({}), re-initializing", internal.getReadiness());
                internal.initialize();
            }
            return Optional.of(internal);
        }
        PlaybackBackend backend = internal(tokens);
        backend.initialize();
        return Optional.of(backend);
    }

    /** Stop the internal player, if any. For application shutdown. */
    public synchronized void stopAll() {
        if (internal != null) {
            log.info("Stopping internal backend");
            internal.stop();
        }
    }

    private PlaybackBackend internal(TokenProvider tokens) {
        if (internal == null) {
            log.info("Creating new internal backend instance");
            internal = internalBackends.apply(tokens);
        }
        return internal;
    }
}
