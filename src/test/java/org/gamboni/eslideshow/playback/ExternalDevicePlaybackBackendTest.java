package org.gamboni.eslideshow.playback;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.MoreExecutors;
import org.gamboni.eslideshow.data.BackendReadiness;
import org.gamboni.eslideshow.data.PlaybackError;
import org.gamboni.eslideshow.data.PlaybackState;
import org.gamboni.eslideshow.spotify.RepeatMode;
import org.gamboni.eslideshow.tech.DiagnosticLog;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ExternalDevicePlaybackBackendTest {
    private final FakeWebApi api = new FakeWebApi();
    private final ExternalDevicePlaybackBackend backend = new ExternalDevicePlaybackBackend(api,
            MoreExecutors.directExecutor(), new DiagnosticLog());
    private final List<PlaybackError> errors = new ArrayList<>();

    {
        backend.setListener(new PlaybackBackend.Listener() {
            @Override
            public void stateChanged(PlaybackState state) {}

            @Override
            public void error(PlaybackError error) {
                errors.add(error);
            }

            @Override
            public void readinessChanged(BackendReadiness readiness) {}
        });
    }

    @Test
    public void commandsGoToActiveDevice() throws Exception {
        backend.initialize();

        backend.playTrack("spotify:track:1", 200L).get();
        backend.pause().get();
        backend.resume().get();
        backend.nextTrack().get();
        backend.previousTrack().get();
        backend.seek(-5).get();
        backend.setShuffle(true).get();
        backend.setRepeat(RepeatMode.CONTEXT).get();

        assertEquals(ImmutableList.of(
                "play spotify:track:1@null",
                "pause@null",
                "resume@null",
                "next@null",
                "previous@null",
                "seek 0@null",
                "shuffle true@null",
                "repeat context@null"), api.requests());
        assertEquals(BackendMode.EXTERNAL_DEVICE, backend.getMode());
    }

    @Test
    public void volumeIsConvertedToClampedPercent() throws Exception {
        backend.initialize();

        backend.setVolume(0.456).get();
        backend.setVolume(1.5).get();
        backend.setVolume(-1).get();

        assertEquals(ImmutableList.of("volume 46@null", "volume 100@null", "volume 0@null"), api.requests());
    }

    @Test
    public void commandsBeforeInitializeAreRefused() throws Exception {
        CompletableFuture<Void> result = backend.pause();

        try {
            result.get();
            fail("Expected failure");
        } catch (ExecutionException e) {
            assertTrue(e.getCause() instanceof BackendNotReadyException);
        }
        assertEquals(ImmutableList.of(), api.requests());
        assertEquals(PlaybackError.Kind.NOT_READY, errors.get(0).kind());
    }
}
