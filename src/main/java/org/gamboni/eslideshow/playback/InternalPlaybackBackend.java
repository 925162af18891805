package org.gamboni.eslideshow.playback;

import com.google.common.annotations.VisibleForTesting;
import org.gamboni.eslideshow.data.BackendReadiness;
import org.gamboni.eslideshow.data.PlaybackError;
import org.gamboni.eslideshow.data.PlaybackState;
import org.gamboni.eslideshow.data.RemoteDevice;
import org.gamboni.eslideshow.spotify.CredentialException;
import org.gamboni.eslideshow.spotify.RemoteApiException;
import org.gamboni.eslideshow.spotify.RepeatMode;
import org.gamboni.eslideshow.spotify.SpotifyWebApi;
import org.gamboni.eslideshow.spotify.TokenProvider;
import org.gamboni.eslideshow.tech.DiagnosticLog;
import org.gamboni.eslideshow.tech.channel.ControlChannel;
import org.gamboni.eslideshow.tech.channel.ControlEvent;
import org.gamboni.eslideshow.tech.process.PlayerProcess;
import org.gamboni.eslideshow.tech.process.PlayerProcessException;
import org.gamboni.eslideshow.tech.process.PlayerProcessSupervisor;

import java.io.IOException;
import java.net.URI;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Plays music through a headless player process that registers itself as a Spotify Connect device.
 *
 * <p>Readiness goes through these stages: {@code PROCESS_STARTING} (launching the process),
 * {@code CONTENT_LOADING} (waiting for the player page), {@code CREDENTIAL_PENDING} (handing over the access
 * token), {@code CONNECTING_DEVICE} (waiting for the device to come up) and finally {@code READY}. A device
 * discovery poll on the Web API runs alongside the last stage and declares the backend ready if the device shows
 * up there first.
 */
public class InternalPlaybackBackend extends AbstractPlaybackBackend {

    /* Design notes:
     * Events come from the player process (through the channel), from the supervisor (process exit), from the
     * discovery poll and from callers. As in a browser, all of them are turned into tasks on one sequential
     * executor, and only those tasks touch the fields marked "executor-confined" below. Anything blocking (token
     * fetch, process launch, Web API) runs on the I/O executor and posts its result back to the sequential one.
     * Every asynchronous continuation checks 'session' so that results arriving after stop() are dropped.
     */

    /** What the I/O executor hands back once the player process is up. */
    private record Started(String token, PlayerProcess process) {}

    /** A Web API request addressed to a specific device. */
    private interface DeviceCall {
        void run(String deviceId) throws IOException, CredentialException;
    }

    private final PlayerProcessSupervisor supervisor;
    private final ControlChannel channel;
    private final SpotifyWebApi api;
    private final TokenProvider tokens;
    private final DeviceDiscoveryPoll discovery;
    private final String deviceName;
    private final Optional<URI> backendBaseUrl;
    private final Executor executor;

    private volatile BackendReadiness readiness = BackendReadiness.UNINITIALIZED;
    private volatile PlaybackState state = PlaybackState.IDLE;
    private volatile Optional<String> deviceId = Optional.empty();

    /** The process the channel is attached to. Exits of any other process are stale. */
    private volatile PlayerProcess playerProcess = null;

    /** Incremented to make a running discovery poll give up. */
    private final AtomicInteger pollGeneration = new AtomicInteger();

    // executor-confined
    private int session = 0;
    private CompletableFuture<Optional<RemoteDevice>> runningPoll = null;

    /**
     * @param executor sequential executor running the state machine
     * @param io executor for blocking work
     */
    public InternalPlaybackBackend(
            PlayerProcessSupervisor supervisor,
            ControlChannel channel,
            SpotifyWebApi api,
            TokenProvider tokens,
            DeviceDiscoveryPoll discovery,
            String deviceName,
            Optional<URI> backendBaseUrl,
            Executor executor,
            Executor io,
            DiagnosticLog diagnostics) {
        super(io, diagnostics.forComponent(InternalPlaybackBackend.class));
        this.supervisor = supervisor;
        this.channel = channel;
        this.api = api;
        this.tokens = tokens;
        this.discovery = discovery;
        this.deviceName = deviceName;
        this.backendBaseUrl = backendBaseUrl;
        this.executor = executor;

        supervisor.setProcessListener(new PlayerProcessSupervisor.ProcessListener() {
            @Override
            public void started(PlayerProcess process) {
                playerProcess = process;
                channel.attach(process);
            }

            @Override
            public void exited(PlayerProcess process, int exitCode) {
                executor.execute(() -> processExited(process, exitCode));
            }
        });
        channel.setEventListener(event -> executor.execute(() -> handle(event)));
    }

    @Override
    public BackendMode getMode() {
        return BackendMode.INTERNAL;
    }

    @Override
    public BackendReadiness getReadiness() {
        return readiness;
    }

    @Override
    public PlaybackState getState() {
        return state;
    }

    /** Identifier of the player's Spotify Connect device, once known. */
    public Optional<String> getDeviceId() {
        return deviceId;
    }

    @Override
    public void initialize() {
        executor.execute(() -> {
            if (readiness.isStartingOrReady()) {
                log.info("initialize() ignored: already {}", readiness);
                return;
            }
            int current = session;
            transition(BackendReadiness.PROCESS_STARTING);
            CompletableFuture.supplyAsync(this::startProcess, io)
                    .whenCompleteAsync((started, error) -> {
                        if (current != session) {
                            log.info("Player start finished after stop(), ignoring");
                        } else if (error != null) {
                            startFailed(unwrap(error));
                        } else {
                            processStarted(started);
                        }
                    }, executor);
        });
    }

    /** Runs on the I/O executor. */
    private Started startProcess() {
        try {
            String token = tokens.getValidAccessCredential();
            log.info("Got access token {}", DiagnosticLog.redact(token));
            return new Started(token, supervisor.ensureRunning(token, backendBaseUrl));
        } catch (CredentialException | PlayerProcessException e) {
            throw new CompletionException(e);
        }
    }

    private void startFailed(Throwable error) {
        PlaybackError playbackError = toPlaybackError("Failed to start internal player", error);
        log.error(playbackError.message());
        transition(BackendReadiness.DEGRADED);
        listener.error(playbackError);
    }

    private void processStarted(Started started) {
        if (playerProcess != started.process()) {
            // already running, so the supervisor did not announce it
            log.info("Reusing internal player (pid {})", started.process().pid());
            playerProcess = started.process();
            channel.attach(started.process());
        }
        transition(BackendReadiness.CONTENT_LOADING);
        channel.loadContent();
        // kept by the channel until the content is loaded
        channel.sendCredential(started.token());
    }

    @Override
    public void stop() {
        executor.execute(() -> {
            log.info("Stopping internal player backend (was {})", readiness);
            session++;
            cancelPoll();
            transition(BackendReadiness.UNINITIALIZED);
            channel.pause();
            supervisor.stop();
            channel.detach();
            playerProcess = null;
            deviceId = Optional.empty();
            publish(PlaybackState.IDLE);
        });
    }

    private void processExited(PlayerProcess process, int exitCode) {
        if (process != playerProcess) {
            log.info("Previous internal player (pid {}) exited with status {}", process.pid(), exitCode);
            return;
        }
        channel.detach();
        playerProcess = null;
        if (readiness == BackendReadiness.UNINITIALIZED) {
            log.info("Internal player (pid {}) exited with status {}", process.pid(), exitCode);
            return;
        }
        log.error("Internal player (pid {}) exited unexpectedly with status {}", process.pid(), exitCode);
        session++;
        cancelPoll();
        deviceId = Optional.empty();
        transition(BackendReadiness.DEGRADED);
        listener.error(new PlaybackError(PlaybackError.Kind.PROCESS,
                "Internal player exited unexpectedly (status " + exitCode + ")"));
    }

    private void handle(ControlEvent event) {
        if (readiness == BackendReadiness.UNINITIALIZED) {
            log.debug("Ignoring {} while stopped", event);
            return;
        }
        if (event instanceof ControlEvent.ContentLoaded) {
            contentLoaded();
        } else if (event instanceof ControlEvent.CredentialAck) {
            credentialAccepted();
        } else if (event instanceof ControlEvent.Ready ready) {
            deviceReady(ready.deviceId());
        } else if (event instanceof ControlEvent.NotReady notReady) {
            deviceNotReady(notReady.deviceId());
        } else if (event instanceof ControlEvent.ConnectResult result) {
            connectResult(result.ok());
        } else if (event instanceof ControlEvent.StateChanged changed) {
            publish(changed.toPlaybackState());
        } else if (event instanceof ControlEvent.PlayerError error) {
            playerError(error);
        } else if (event instanceof ControlEvent.Unknown unknown) {
            log.debug("Unhandled event {}", unknown.raw());
        }
    }

    private void contentLoaded() {
        if (readiness != BackendReadiness.CONTENT_LOADING) {
            log.info("Content loaded while {}, nothing to do", readiness);
            return;
        }
        transition(BackendReadiness.CREDENTIAL_PENDING);
        if (channel.isCredentialDelivered()) {
            connectDevice();
            return;
        }
        int current = session;
        CompletableFuture.supplyAsync(() -> {
            try {
                return tokens.getValidAccessCredential();
            } catch (CredentialException e) {
                throw new CompletionException(e);
            }
        }, io).whenCompleteAsync((token, error) -> {
            if (current != session) {
                return;
            }
            if (error != null) {
                PlaybackError playbackError = toPlaybackError("Failed to get access token", unwrap(error));
                log.error(playbackError.message());
                listener.error(playbackError);
                transition(BackendReadiness.DEGRADED);
            } else {
                channel.sendCredential(token);
                connectDevice();
            }
        }, executor);
    }

    private void connectDevice() {
        transition(BackendReadiness.CONNECTING_DEVICE);
        channel.connect();
        startPoll();
    }

    private void credentialAccepted() {
        if (readiness == BackendReadiness.PROCESS_STARTING) {
            return;
        }
        if (readiness == BackendReadiness.DEGRADED && supervisor.isRunning()) {
            // the player is still around: see if its device comes back
            transition(BackendReadiness.DISCOVERING_DEVICE);
        }
        startPoll();
    }

    private void deviceReady(String id) {
        if (id == null || id.isEmpty()) {
            log.warn("Ready event without a device id");
            return;
        }
        deviceId = Optional.of(id);
        // the player told us itself: no need to keep polling
        cancelPoll();
        transition(BackendReadiness.READY);
    }

    private void deviceNotReady(String id) {
        if (readiness == BackendReadiness.READY && deviceId.filter(known -> known.equals(id)).isPresent()) {
            transition(BackendReadiness.DEGRADED);
        } else {
            log.info("Device {} not ready (current device {}, {})", id, deviceId.orElse("unknown"), readiness);
        }
    }

    private void connectResult(boolean ok) {
        if (!ok) {
            log.warn("Player could not connect, still waiting for device discovery");
            listener.error(PlaybackError.backend("Internal player failed to connect"));
            return;
        }
        transition(BackendReadiness.READY);
        if (deviceId.isEmpty()) {
            startPoll();
        }
    }

    private void playerError(ControlEvent.PlayerError error) {
        listener.error(PlaybackError.backend("Internal player error " + error.code() + ": " + error.message()));
        if (readiness == BackendReadiness.READY) {
            transition(BackendReadiness.DEGRADED);
        }
    }

    private CompletableFuture<Optional<RemoteDevice>> startPoll() {
        if (runningPoll != null) {
            log.info("Device discovery already running");
            return runningPoll;
        }
        int pollId = pollGeneration.get();
        CompletableFuture<Optional<RemoteDevice>> poll = discovery.start(() -> pollGeneration.get() != pollId);
        runningPoll = poll;
        poll.whenCompleteAsync((found, error) -> pollFinished(poll, pollId, found), executor);
        return poll;
    }

    private void cancelPoll() {
        pollGeneration.incrementAndGet();
        runningPoll = null;
    }

    private void pollFinished(CompletableFuture<Optional<RemoteDevice>> poll, int pollId,
                              Optional<RemoteDevice> found) {
        if (runningPoll == poll) {
            runningPoll = null;
        }
        if (pollId != pollGeneration.get() || readiness == BackendReadiness.UNINITIALIZED) {
            return;
        }
        if (found != null && found.isPresent()) {
            deviceId = Optional.of(found.get().id());
            if (!supervisor.isRunning()) {
                log.warn("Device {} listed but the player is not running", found.get().id());
            } else if (readiness != BackendReadiness.READY) {
                log.info("Device {} found by discovery", found.get().id());
                transition(BackendReadiness.READY);
            }
        } else if (readiness == BackendReadiness.DISCOVERING_DEVICE) {
            transition(BackendReadiness.DEGRADED);
        }
    }

    /** Look the device up again. Completes with the device id, if any is known afterwards. */
    private CompletableFuture<Optional<String>> rediscover() {
        CompletableFuture<Optional<RemoteDevice>> poll = new CompletableFuture<>();
        executor.execute(() -> {
            deviceId = Optional.empty();
            startPoll().whenComplete((found, error) -> poll.complete(found == null ? Optional.empty() : found));
        });
        // a Ready event may have told us the id while the poll was running
        return poll.thenApply(found -> found.map(RemoteDevice::id).or(() -> deviceId));
    }

    private CompletableFuture<Void> callDevice(String description, DeviceCall call) {
        CompletableFuture<Void> firstTry = deviceId
                .map(id -> onIo(() -> call.run(id)))
                .orElseGet(() -> CompletableFuture.failedFuture(new DeviceNotFoundException(deviceName)));
        return reportFailure(description, firstTry.exceptionallyCompose(error -> {
            Throwable cause = unwrap(error);
            if (!isStaleDevice(cause)) {
                return CompletableFuture.failedFuture(cause);
            }
            log.warn("Device unknown to Spotify ({}), looking it up again", cause.getMessage());
            return rediscover().thenCompose(id -> id
                    .map(found -> onIo(() -> call.run(found)))
                    .orElseGet(() -> CompletableFuture.failedFuture(new DeviceNotFoundException(deviceName))));
        }));
    }

    private static boolean isStaleDevice(Throwable error) {
        return error instanceof DeviceNotFoundException
                || (error instanceof RemoteApiException remote && remote.isDeviceNotFound());
    }

    @Override
    public CompletableFuture<Void> playTrack(String trackUri, Long startPositionMs) {
        return ifReady().orElseGet(() -> {
            log.info("startPlayback({}) on internal device {}", trackUri, deviceId.orElse("(unknown)"));
            PlaybackState buffering = PlaybackState.buffering(trackUri,
                    startPositionMs == null ? 0 : startPositionMs);
            executor.execute(() -> publish(buffering));
            return callDevice("start playback on internal player",
                    id -> api.startPlayback(trackUri, id, startPositionMs));
        });
    }

    @Override
    public CompletableFuture<Void> resume() {
        return ifReady().orElseGet(() -> callDevice("resume internal player", api::resume));
    }

    @Override
    public CompletableFuture<Void> pause() {
        return ifReady().orElseGet(() -> sent(channel::pause));
    }

    @Override
    public CompletableFuture<Void> nextTrack() {
        return ifReady().orElseGet(() -> sent(channel::next));
    }

    @Override
    public CompletableFuture<Void> previousTrack() {
        return ifReady().orElseGet(() -> sent(channel::previous));
    }

    @Override
    public CompletableFuture<Void> seek(long positionMs) {
        return ifReady().orElseGet(() -> sent(() -> channel.seek(positionMs)));
    }

    @Override
    public CompletableFuture<Void> setVolume(double volume) {
        return ifReady().orElseGet(() -> sent(() -> channel.setVolume(volume)));
    }

    @Override
    public CompletableFuture<Void> setShuffle(boolean on) {
        log.info("Shuffle not supported by the internal player (requested {})", on);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> setRepeat(RepeatMode mode) {
        log.info("Repeat not supported by the internal player (requested {})", mode);
        return CompletableFuture.completedFuture(null);
    }

    private static CompletableFuture<Void> sent(Runnable command) {
        command.run();
        return CompletableFuture.completedFuture(null);
    }

    /** Empty if ready, otherwise the failed future to return. Commands are never queued. */
    private Optional<CompletableFuture<Void>> ifReady() {
        BackendReadiness current = readiness;
        if (current.isReady()) {
            return Optional.empty();
        }
        log.warn("Command refused: player not ready ({})", current);
        listener.error(PlaybackError.notReady());
        return Optional.of(CompletableFuture.failedFuture(new BackendNotReadyException(current)));
    }

    private void transition(BackendReadiness next) {
        BackendReadiness previous = readiness;
        if (previous == next) {
            return;
        }
        readiness = next;
        log.info("{} -> {}", previous, next);
        listener.readinessChanged(next);
    }

    private void publish(PlaybackState newState) {
        this.state = newState;
        listener.stateChanged(newState);
    }

    @VisibleForTesting
    boolean isPolling() {
        return runningPoll != null;
    }
}
