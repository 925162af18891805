package org.gamboni.eslideshow;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import lombok.extern.slf4j.Slf4j;
import org.gamboni.eslideshow.playback.DeviceDiscoveryPoll;
import org.gamboni.eslideshow.playback.ExternalDevicePlaybackBackend;
import org.gamboni.eslideshow.playback.InternalPlaybackBackend;
import org.gamboni.eslideshow.playback.PlaybackBackendFactory;
import org.gamboni.eslideshow.spotify.HttpSpotifyWebApi;
import org.gamboni.eslideshow.spotify.SpotifyWebApi;
import org.gamboni.eslideshow.spotify.TokenProvider;
import org.gamboni.eslideshow.tech.DiagnosticLog;
import org.gamboni.eslideshow.tech.Mapping;
import org.gamboni.eslideshow.tech.channel.SocketControlChannel;
import org.gamboni.eslideshow.tech.process.BundledHelperResolver;
import org.gamboni.eslideshow.tech.process.PlayerProcessSupervisor;
import org.gamboni.eslideshow.tech.process.ProcessLauncher;
import spark.Service;

import java.io.File;
import java.net.URI;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Music playback service of Electric Slideshow. The front end pushes the user's Spotify access token and drives
 * playback over HTTP.
 */
@Slf4j
public class ElectricSlideshow {

    public static void main(String[] args) {
        if (args.length > 1) {
            System.err.println("Usage: ElectricSlideshow [config.properties]");
            System.exit(255);
        }
        PlayerConfig config = PlayerConfig.load(args.length == 0 ? Optional.empty() : Optional.of(new File(args[0])));
        new ElectricSlideshow(config).run();
    }

    private final PlayerConfig config;
    private final Mapping mapping = new Mapping();
    private final DiagnosticLog diagnostics = new DiagnosticLog();
    private final SessionTokenProvider tokens = new SessionTokenProvider();

    private final ExecutorService stateMachine = new ThreadPoolExecutor(
            1,
            1, // important: to make this a *sequential* executor
            Long.MAX_VALUE,
            TimeUnit.SECONDS,
            new LinkedBlockingDeque<>(),
            new ThreadFactoryBuilder().setNameFormat("playback-state").setDaemon(true).build());
    private final ExecutorService io = Executors.newCachedThreadPool(
            new ThreadFactoryBuilder().setNameFormat("playback-io-%d").setDaemon(true).build());
    private final ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder().setNameFormat("playback-timer").setDaemon(true).build());

    private final PlaybackBackendFactory factory;
    private final Service http;

    public ElectricSlideshow(PlayerConfig config) {
        this.config = config;
        this.factory = new PlaybackBackendFactory(
                config.backendMode(),
                this::createInternalBackend,
                providedTokens -> new ExternalDevicePlaybackBackend(webApi(providedTokens), io, diagnostics),
                diagnostics);

        this.http = Service.ignite().port(config.httpPort());
        http.exception(Exception.class, (ex, req, res) -> log.error("Uncaught Exception", ex));
        new PlaybackController(http, mapping, factory, config.backendMode(), tokens, diagnostics);
    }

    private void run() {
        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "shutdown"));
        http.awaitInitialization();
        log.info("Electric Slideshow player listening on port {} ({} backend, {} launch)",
                config.httpPort(), config.backendMode(), config.launchMode());
    }

    private void shutdown() {
        log.info("Shutting down");
        factory.stopAll();
        stateMachine.shutdown();
        try {
            // let stop() reach the player process
            stateMachine.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        http.stop();
    }

    private InternalPlaybackBackend createInternalBackend(TokenProvider providedTokens) {
        SpotifyWebApi api = webApi(providedTokens);
        PlayerProcessSupervisor supervisor = new PlayerProcessSupervisor(
                config.launchMode(),
                config.devRepoPath(),
                config.devCommand(),
                new BundledHelperResolver(config.bundleDir()),
                config.helperName(),
                config.ipcSocket(),
                ProcessLauncher.SYSTEM,
                diagnostics);
        return new InternalPlaybackBackend(
                supervisor,
                new SocketControlChannel(config.ipcSocket(), config.contentUrl(), mapping, diagnostics),
                api,
                providedTokens,
                new DeviceDiscoveryPoll(api, config.deviceName(), timer, io, diagnostics),
                config.deviceName(),
                config.backendBaseUrl(),
                stateMachine,
                io,
                diagnostics);
    }

    private SpotifyWebApi webApi(TokenProvider providedTokens) {
        // device listing goes through the Electric Slideshow server when there is one
        URI devicesUrl = config.backendBaseUrl()
                .map(base -> URI.create(base.toString().replaceAll("/+$", "") + "/api/spotify/devices"))
                .orElseGet(() -> URI.create(
                        config.spotifyApiBaseUrl().toString().replaceAll("/+$", "") + "/me/player/devices"));
        return new HttpSpotifyWebApi(config.spotifyApiBaseUrl(), devicesUrl, providedTokens, mapping, diagnostics);
    }
}
