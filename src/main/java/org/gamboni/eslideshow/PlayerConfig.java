package org.gamboni.eslideshow;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import org.gamboni.eslideshow.playback.BackendMode;
import org.gamboni.eslideshow.tech.process.LaunchMode;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Properties;

/**
 * Start-up configuration.
 *
 * <p>Values come from {@code electric-slideshow.properties} on the class path, then from an optional
 * properties file given on the command line, then from system properties of the same name.
 */
public record PlayerConfig(
        BackendMode backendMode,
        LaunchMode launchMode,
        File devRepoPath,
        List<String> devCommand,
        File bundleDir,
        String helperName,
        Path ipcSocket,
        URI contentUrl,
        String deviceName,
        Optional<URI> backendBaseUrl,
        URI spotifyApiBaseUrl,
        int httpPort) {

    public static final String RESOURCE = "/electric-slideshow.properties";

    public static PlayerConfig load(Optional<File> overrides) {
        Properties properties = new Properties();
        try (InputStream in = PlayerConfig.class.getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + RESOURCE, e);
        }
        if (overrides.isPresent()) {
            try (InputStream in = new FileInputStream(overrides.get())) {
                properties.load(in);
            } catch (IOException e) {
                throw new UncheckedIOException("Could not read " + overrides.get(), e);
            }
        }
        for (String key : properties.stringPropertyNames()) {
            String system = System.getProperty(key);
            if (system != null) {
                properties.setProperty(key, system);
            }
        }
        return fromProperties(properties);
    }

    public static PlayerConfig fromProperties(Properties properties) {
        String backendBaseUrl = properties.getProperty("backend.baseUrl", "").trim();
        return new PlayerConfig(
                BackendMode.valueOf(enumName(properties.getProperty("backend.mode", "internal"))),
                LaunchMode.valueOf(enumName(properties.getProperty("player.launchMode", "packaged"))),
                new File(properties.getProperty("player.devRepoPath", "../electric-slideshow-internal-player")),
                ImmutableList.copyOf(Splitter.on(' ')
                        .omitEmptyStrings()
                        .split(properties.getProperty("player.devCommand", "/usr/bin/env npm run dev"))),
                new File(properties.getProperty("player.bundleDir", ".")),
                properties.getProperty("player.helperName", "ElectricSlideshowInternalPlayer"),
                Path.of(properties.getProperty("player.ipcSocket", "/tmp/electric-slideshow-player")),
                URI.create(properties.getProperty("player.contentUrl",
                        "https://electric-slideshow-server.onrender.com/internal-player")),
                properties.getProperty("player.deviceName", "Electric Slideshow Internal Player"),
                backendBaseUrl.isEmpty() ? Optional.empty() : Optional.of(URI.create(backendBaseUrl)),
                URI.create(properties.getProperty("spotify.apiBaseUrl", "https://api.spotify.com/v1")),
                Integer.parseInt(properties.getProperty("http.port", "4569")));
    }

    /** Accept {@code internal-web-player}, {@code internalWebPlayer} or {@code INTERNAL_WEB_PLAYER} alike. */
    private static String enumName(String value) {
        return value.trim()
                .replaceAll("([a-z])([A-Z])", "$1_$2")
                .replace('-', '_')
                .toUpperCase(Locale.ROOT);
    }
}
