package org.gamboni.eslideshow;

import com.google.common.collect.ImmutableMap;
import lombok.extern.slf4j.Slf4j;
import org.gamboni.eslideshow.data.BackendReadiness;
import org.gamboni.eslideshow.data.BackendStatus;
import org.gamboni.eslideshow.data.PlaybackError;
import org.gamboni.eslideshow.data.PlaybackState;
import org.gamboni.eslideshow.playback.BackendMode;
import org.gamboni.eslideshow.playback.NoopPlaybackBackend;
import org.gamboni.eslideshow.playback.PlaybackBackend;
import org.gamboni.eslideshow.playback.PlaybackBackendFactory;
import org.gamboni.eslideshow.tech.AbstractController;
import org.gamboni.eslideshow.tech.DiagnosticLog;
import org.gamboni.eslideshow.tech.Mapping;
import spark.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/** HTTP services through which the front end drives music playback. */
@Slf4j
public class PlaybackController extends AbstractController {
    private final PlaybackBackendFactory factory;
    private final BackendMode mode;
    private final SessionTokenProvider tokens;

    /** Replaced by a real backend once the user is signed in. */
    private PlaybackBackend backend = new NoopPlaybackBackend();

    private volatile Optional<PlaybackError> lastError = Optional.empty();

    public PlaybackController(Service http, Mapping mapping, PlaybackBackendFactory factory, BackendMode mode,
                              SessionTokenProvider tokens, DiagnosticLog diagnostics) {
        super(http, mapping);
        this.factory = factory;
        this.mode = mode;
        this.tokens = tokens;

        service("token", token -> {
            tokens.update(token);
            log.info("Received access token {}", DiagnosticLog.redact(token));
            // listener first, so that start-up failures are seen
            backend();
            if (mode == BackendMode.INTERNAL) {
                factory.prewarmBackend(signedIn());
            }
            return "ok";
        });
        service("play", trackUri -> command(backend().playTrack(trackUri, null)));
        service("pause", () -> command(backend().pause()));
        service("resume", () -> command(backend().resume()));
        service("next", () -> command(backend().nextTrack()));
        service("previous", () -> command(backend().previousTrack()));
        service("seek", positionMs -> parse(positionMs, Long::valueOf)
                .map(position -> command(backend().seek(position)))
                .orElseGet(() -> refused("Invalid position: " + positionMs)));
        service("volume", volume -> parse(volume, Double::valueOf)
                .map(level -> command(backend().setVolume(level)))
                .orElseGet(() -> refused("Invalid volume: " + volume)));
        service("stop", () -> {
            factory.stopAll();
            return "ok";
        });

        getService("status", this::status);
        getText("diagnostics", diagnostics::formatted);
        service("diagnostics/clear", () -> {
            diagnostics.clear();
            return "ok";
        });
    }

    public BackendStatus status() {
        PlaybackBackend current = backend();
        return new BackendStatus(current.getMode().name(), current.getReadiness(), current.isReady(),
                current.getState(), lastError.orElse(null));
    }

    /** The backend for the configured mode, or the no-op one while signed out. */
    synchronized PlaybackBackend backend() {
        if (backend.getMode() != mode) {
            factory.makeBackend(mode, signedIn()).ifPresent(created -> {
                log.info("Using {} backend", created.getMode());
                created.setListener(new PlaybackBackend.Listener() {
                    @Override
                    public void stateChanged(PlaybackState state) {
                        log.debug("Playback state: {}", state);
                    }

                    @Override
                    public void error(PlaybackError error) {
                        log.warn("Playback error {}: {}", error.kind(), error.message());
                        lastError = Optional.of(error);
                    }

                    @Override
                    public void readinessChanged(BackendReadiness readiness) {
                        log.info("Backend readiness: {}", readiness);
                    }
                });
                if (created.getMode() != BackendMode.INTERNAL) {
                    created.initialize();
                }
                this.backend = created;
            });
        }
        return backend;
    }

    private SessionTokenProvider signedIn() {
        return tokens.hasToken() ? tokens : null;
    }

    private Map<String, Object> command(CompletableFuture<Void> result) {
        if (result.isCompletedExceptionally()) {
            return refused(PlaybackError.notReady().message());
        }
        return ImmutableMap.of("accepted", true);
    }

    private static Map<String, Object> refused(String error) {
        return ImmutableMap.of("accepted", false, "error", error);
    }

    private static <T> Optional<T> parse(String text, Function<String, T> parser) {
        try {
            return Optional.of(parser.apply(text));
        } catch (NumberFormatException e) {
            log.warn("Rejecting request: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
