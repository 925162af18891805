package org.gamboni.eslideshow;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import org.gamboni.eslideshow.data.BackendReadiness;
import org.gamboni.eslideshow.data.PlaybackError;
import org.gamboni.eslideshow.data.RemoteDevice;
import org.gamboni.eslideshow.playback.BackendMode;
import org.gamboni.eslideshow.playback.ExternalDevicePlaybackBackend;
import org.gamboni.eslideshow.playback.NoopPlaybackBackend;
import org.gamboni.eslideshow.playback.PlaybackBackendFactory;
import org.gamboni.eslideshow.spotify.RepeatMode;
import org.gamboni.eslideshow.spotify.SpotifyWebApi;
import org.gamboni.eslideshow.tech.DiagnosticLog;
import org.gamboni.eslideshow.tech.Mapping;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import spark.Service;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class PlaybackControllerTest {
    private final Mapping mapping = new Mapping();
    private final DiagnosticLog diagnostics = new DiagnosticLog();
    private final SessionTokenProvider tokens = new SessionTokenProvider();
    private final List<String> calls = new ArrayList<>();
    private final HttpClient client = HttpClient.newHttpClient();

    private Service http;
    private String base;

    /** Records player requests, as seen by the Web API. */
    private class RecordingWebApi implements SpotifyWebApi {
        private synchronized void record(String call) {
            calls.add(call);
        }

        @Override
        public List<RemoteDevice> listDevices() {
            return ImmutableList.of();
        }

        @Override
        public void startPlayback(String trackUri, String deviceId, Long startPositionMs) {
            record("play " + trackUri);
        }

        @Override
        public void pause(String deviceId) {
            record("pause");
        }

        @Override
        public void resume(String deviceId) {
            record("resume");
        }

        @Override
        public void seek(long positionMs, String deviceId) {
            record("seek " + positionMs);
        }

        @Override
        public void setVolume(int percent, String deviceId) {
            record("volume " + percent);
        }

        @Override
        public void skipNext(String deviceId) {
            record("next");
        }

        @Override
        public void skipPrevious(String deviceId) {
            record("previous");
        }

        @Override
        public void setShuffle(boolean on) {
            record("shuffle " + on);
        }

        @Override
        public void setRepeat(RepeatMode mode) {
            record("repeat " + mode);
        }
    }

    /** Internal backend whose player cannot be started. */
    private static class UnstartableBackend extends NoopPlaybackBackend {
        private Listener listener = Listener.NOOP;
        int initialized = 0;

        @Override
        public void setListener(Listener listener) {
            this.listener = listener;
        }

        @Override
        public BackendMode getMode() {
            return BackendMode.INTERNAL;
        }

        @Override
        public BackendReadiness getReadiness() {
            return BackendReadiness.DEGRADED;
        }

        @Override
        public void initialize() {
            initialized++;
            listener.error(new PlaybackError(PlaybackError.Kind.PROCESS, "Invalid path: /nowhere"));
        }
    }

    @Before
    public void start() {
        serve(BackendMode.EXTERNAL_DEVICE, new PlaybackBackendFactory(
                BackendMode.EXTERNAL_DEVICE,
                providedTokens -> {
                    throw new AssertionError("internal backend not expected");
                },
                providedTokens -> new ExternalDevicePlaybackBackend(new RecordingWebApi(), Runnable::run,
                        diagnostics),
                diagnostics));
    }

    private void serve(BackendMode mode, PlaybackBackendFactory factory) {
        http = Service.ignite().port(0);
        new PlaybackController(http, mapping, factory, mode, tokens, diagnostics);
        http.awaitInitialization();
        base = "http://localhost:" + http.port();
    }

    @After
    public void stop() {
        http.stop();
        http.awaitStop();
    }

    private String post(String path, String body) throws Exception {
        return client.send(HttpRequest.newBuilder(URI.create(base + path))
                        .POST(HttpRequest.BodyPublishers.ofString(body))
                        .build(),
                HttpResponse.BodyHandlers.ofString()).body();
    }

    private String get(String path) throws Exception {
        return client.send(HttpRequest.newBuilder(URI.create(base + path)).GET().build(),
                HttpResponse.BodyHandlers.ofString()).body();
    }

    @Test
    public void signedOutUsesNoopBackend() throws Exception {
        JsonNode status = mapping.get().readTree(get("/status"));

        assertEquals("NOOP", status.get("mode").asText());
        assertTrue(status.get("ready").asBoolean());
        assertEquals("{\"accepted\":true}", post("/play", "spotify:track:1"));
        assertEquals(ImmutableList.of(), calls);
    }

    @Test
    public void commandsReachBackendOnceSignedIn() throws Exception {
        assertEquals("\"ok\"", post("/token", "BQDtoken"));

        post("/play", "spotify:track:1\n");
        post("/pause", "");
        post("/seek", "1500");
        post("/volume", "0.5");
        post("/next", "");

        assertEquals(ImmutableList.of("play spotify:track:1", "pause", "seek 1500", "volume 50", "next"), calls);
        JsonNode status = mapping.get().readTree(get("/status"));
        assertEquals("EXTERNAL_DEVICE", status.get("mode").asText());
        assertEquals("READY", status.get("readiness").asText());
        assertEquals("spotify:track:1", status.get("state").get("trackUri").asText());
    }

    @Test
    public void diagnosticsCanBeReadAndCleared() throws Exception {
        post("/token", "BQDtoken");
        post("/play", "spotify:track:1");

        assertTrue(get("/diagnostics").contains("[ExternalDevicePlaybackBackend] playTrack(spotify:track:1, null)"));

        post("/diagnostics/clear", "");
        assertEquals("No logs available", get("/diagnostics"));
        assertFalse(tokens.getValidAccessCredential().isEmpty());
    }

    @Test
    public void malformedNumbersAreRefused() throws Exception {
        post("/token", "BQDtoken");

        JsonNode seek = mapping.get().readTree(post("/seek", "soon"));
        JsonNode volume = mapping.get().readTree(post("/volume", "loud"));

        assertFalse(seek.get("accepted").asBoolean());
        assertEquals("Invalid position: soon", seek.get("error").asText());
        assertFalse(volume.get("accepted").asBoolean());
        assertEquals("Invalid volume: loud", volume.get("error").asText());
        assertEquals(ImmutableList.of(), calls);
    }

    @Test
    public void startupFailureOfInternalPlayerIsReportedInStatus() throws Exception {
        stop();
        UnstartableBackend internal = new UnstartableBackend();
        serve(BackendMode.INTERNAL, new PlaybackBackendFactory(
                BackendMode.INTERNAL,
                providedTokens -> internal,
                providedTokens -> {
                    throw new AssertionError("external backend not expected");
                },
                diagnostics));

        assertTrue(mapping.get().readTree(get("/status")).get("lastError").isNull());
        assertEquals("\"ok\"", post("/token", "BQDtoken"));

        assertEquals(1, internal.initialized);
        JsonNode status = mapping.get().readTree(get("/status"));
        assertEquals("INTERNAL", status.get("mode").asText());
        assertEquals("DEGRADED", status.get("readiness").asText());
        assertEquals("PROCESS", status.get("lastError").get("kind").asText());
        assertEquals("Invalid path: /nowhere", status.get("lastError").get("message").asText());
    }
}
