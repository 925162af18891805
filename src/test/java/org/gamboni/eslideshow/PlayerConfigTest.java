package org.gamboni.eslideshow;

import com.google.common.collect.ImmutableList;
import org.gamboni.eslideshow.playback.BackendMode;
import org.gamboni.eslideshow.tech.process.LaunchMode;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.FileWriter;
import java.io.Writer;
import java.net.URI;
import java.util.Optional;
import java.util.Properties;

import static org.junit.Assert.assertEquals;

public class PlayerConfigTest {
    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    @Test
    public void defaultsMatchPackagedApplication() {
        PlayerConfig config = PlayerConfig.fromProperties(new Properties());

        assertEquals(BackendMode.INTERNAL, config.backendMode());
        assertEquals(LaunchMode.PACKAGED, config.launchMode());
        assertEquals(ImmutableList.of("/usr/bin/env", "npm", "run", "dev"), config.devCommand());
        assertEquals("Electric Slideshow Internal Player", config.deviceName());
        assertEquals(Optional.empty(), config.backendBaseUrl());
        assertEquals(URI.create("https://api.spotify.com/v1"), config.spotifyApiBaseUrl());
        assertEquals(4569, config.httpPort());
    }

    @Test
    public void enumValuesAcceptSeveralSpellings() {
        Properties properties = new Properties();
        properties.setProperty("backend.mode", "externalDevice");
        properties.setProperty("player.launchMode", "dev");
        assertEquals(BackendMode.EXTERNAL_DEVICE, PlayerConfig.fromProperties(properties).backendMode());
        assertEquals(LaunchMode.DEV, PlayerConfig.fromProperties(properties).launchMode());

        properties.setProperty("backend.mode", "external-device");
        assertEquals(BackendMode.EXTERNAL_DEVICE, PlayerConfig.fromProperties(properties).backendMode());
    }

    @Test
    public void overrideFileTakesPrecedenceOverBundledResource() throws Exception {
        File overrides = tmp.newFile("player.properties");
        try (Writer out = new FileWriter(overrides)) {
            out.write("player.launchMode=dev\n");
            out.write("player.devRepoPath=/home/me/player\n");
            out.write("backend.baseUrl=http://localhost:3000\n");
        }

        PlayerConfig config = PlayerConfig.load(Optional.of(overrides));

        assertEquals(LaunchMode.DEV, config.launchMode());
        assertEquals(new File("/home/me/player"), config.devRepoPath());
        assertEquals(Optional.of(URI.create("http://localhost:3000")), config.backendBaseUrl());
        // from the bundled resource
        assertEquals(URI.create("https://electric-slideshow-server.onrender.com/internal-player"),
                config.contentUrl());
    }

    @Test
    public void systemPropertiesWin() {
        System.setProperty("http.port", "5000");
        try {
            assertEquals(5000, PlayerConfig.load(Optional.empty()).httpPort());
        } finally {
            System.clearProperty("http.port");
        }
    }
}
