package org.gamboni.eslideshow.playback;

import org.gamboni.eslideshow.data.RemoteDevice;
import org.gamboni.eslideshow.spotify.CredentialException;
import org.gamboni.eslideshow.spotify.SpotifyWebApi;
import org.gamboni.eslideshow.tech.DiagnosticLog;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * Looks for the internal player among the user's Spotify Connect devices. The player takes a moment to show
 * up in the Web API after it connected, so the device list is fetched a few times before giving up.
 */
public class DeviceDiscoveryPoll {
    public static final int DEFAULT_ATTEMPTS = 6;
    public static final Duration DEFAULT_INTERVAL = Duration.ofMillis(500);

    private final SpotifyWebApi api;
    private final String deviceName;
    private final ScheduledExecutorService timer;
    private final Executor io;
    private final int maxAttempts;
    private final Duration interval;
    private final DiagnosticLog.Component log;

    public DeviceDiscoveryPoll(SpotifyWebApi api, String deviceName, ScheduledExecutorService timer, Executor io,
                               DiagnosticLog diagnostics) {
        this(api, deviceName, timer, io, DEFAULT_ATTEMPTS, DEFAULT_INTERVAL, diagnostics);
    }

    public DeviceDiscoveryPoll(SpotifyWebApi api, String deviceName, ScheduledExecutorService timer, Executor io,
                               int maxAttempts, Duration interval, DiagnosticLog diagnostics) {
        this.api = api;
        this.deviceName = deviceName;
        this.timer = timer;
        this.io = io;
        this.maxAttempts = maxAttempts;
        this.interval = interval;
        this.log = diagnostics.forComponent(DeviceDiscoveryPoll.class);
    }

    /**
     * Start polling. The first attempt is made straight away.
     *
     * @param cancelled checked before each attempt; once it returns true the poll completes empty
     * @return the device, or empty if it did not show up (or the poll was cancelled)
     */
    public CompletableFuture<Optional<RemoteDevice>> start(BooleanSupplier cancelled) {
        log.info("Looking for device '{}' ({} attempts, every {} ms)", deviceName, maxAttempts, interval.toMillis());
        CompletableFuture<Optional<RemoteDevice>> result = new CompletableFuture<>();
        attempt(1, cancelled, result);
        return result;
    }

    private void attempt(int attempt, BooleanSupplier cancelled, CompletableFuture<Optional<RemoteDevice>> result) {
        io.execute(() -> {
            if (cancelled.getAsBoolean()) {
                log.info("Device discovery cancelled");
                result.complete(Optional.empty());
                return;
            }
            Optional<RemoteDevice> found;
            try {
                found = find(api.listDevices());
            } catch (IOException | CredentialException | RuntimeException e) {
                log.warn("Attempt {}: could not list devices: {}", attempt, e.getMessage());
                found = Optional.empty();
            }
            if (found.isPresent()) {
                log.info("Attempt {}: found device '{}' with id {}", attempt, deviceName, found.get().id());
                result.complete(found);
            } else if (attempt >= maxAttempts) {
                log.warn("Device '{}' not found after {} attempts", deviceName, attempt);
                result.complete(Optional.empty());
            } else {
                log.info("Attempt {}: device not visible yet", attempt);
                timer.schedule(() -> attempt(attempt + 1, cancelled, result),
                        interval.toMillis(), TimeUnit.MILLISECONDS);
            }
        });
    }

    private Optional<RemoteDevice> find(List<RemoteDevice> devices) {
        log.debug("Devices: {}", devices);
        return devices.stream()
                .filter(device -> deviceName.equals(device.name()) && device.id() != null)
                .findFirst();
    }
}
