package org.gamboni.eslideshow.playback;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.MoreExecutors;
import org.gamboni.eslideshow.data.RemoteDevice;
import org.gamboni.eslideshow.tech.DiagnosticLog;
import org.junit.After;
import org.junit.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.gamboni.eslideshow.playback.FakeWebApi.DEVICE_NAME;
import static org.gamboni.eslideshow.playback.FakeWebApi.device;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class DeviceDiscoveryPollTest {
    private final ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor();
    private final FakeWebApi api = new FakeWebApi();
    private final DiagnosticLog diagnostics = new DiagnosticLog();

    @After
    public void stopTimer() {
        timer.shutdownNow();
    }

    private DeviceDiscoveryPoll poll(Duration interval) {
        return new DeviceDiscoveryPoll(api, DEVICE_NAME, timer, MoreExecutors.directExecutor(), 6, interval,
                diagnostics);
    }

    @Test
    public void findsDeviceOnThirdAttempt() throws Exception {
        api.answer(ImmutableList.of());
        api.answer(ImmutableList.of(device("phone-1", "My Phone")));
        api.answer(ImmutableList.of(device("phone-1", "My Phone"), device("remote-7", DEVICE_NAME)));

        Optional<RemoteDevice> found = poll(Duration.ofMillis(10)).start(() -> false).get(5, TimeUnit.SECONDS);

        assertEquals(Optional.of("remote-7"), found.map(RemoteDevice::id));
        assertEquals(3, api.listCalls.get());
    }

    @Test
    public void namesMustMatchExactly() throws Exception {
        api.defaultDevices = ImmutableList.of(device("x", DEVICE_NAME + " 2"), device("y", "electric slideshow internal player"));

        Optional<RemoteDevice> found = poll(Duration.ofMillis(1)).start(() -> false).get(5, TimeUnit.SECONDS);

        assertEquals(Optional.empty(), found);
    }

    @Test
    public void givesUpAfterSixAttemptsHalfASecondApart() throws Exception {
        long start = System.nanoTime();

        Optional<RemoteDevice> found = new DeviceDiscoveryPoll(api, DEVICE_NAME, timer,
                MoreExecutors.directExecutor(), diagnostics)
                .start(() -> false)
                .get(10, TimeUnit.SECONDS);

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        assertEquals(Optional.empty(), found);
        assertEquals(6, api.listCalls.get());
        // five waits between six attempts
        assertTrue("took " + elapsedMs + " ms", elapsedMs >= 2400 && elapsedMs < 4500);
    }

    @Test
    public void networkErrorsUseUpAttempts() throws Exception {
        for (int i = 0; i < 5; i++) {
            api.answer(null);
        }
        api.answer(ImmutableList.of(device("remote-7", DEVICE_NAME)));

        Optional<RemoteDevice> found = poll(Duration.ofMillis(1)).start(() -> false).get(5, TimeUnit.SECONDS);

        assertEquals(Optional.of("remote-7"), found.map(RemoteDevice::id));
        assertEquals(6, api.listCalls.get());
    }

    @Test
    public void cancelledPollStopsAtNextAttempt() throws Exception {
        CompletableFuture<Optional<RemoteDevice>> result = poll(Duration.ofMillis(10))
                .start(() -> api.listCalls.get() >= 2);

        assertEquals(Optional.empty(), result.get(5, TimeUnit.SECONDS));
        assertEquals(2, api.listCalls.get());
    }
}
