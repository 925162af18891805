package org.gamboni.eslideshow.tech.process;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import lombok.Getter;
import lombok.Setter;
import org.gamboni.eslideshow.tech.DiagnosticLog;

import java.io.File;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/** Owns the internal player process: at most one is alive per supervisor. */
public class PlayerProcessSupervisor {
    /* Design notes:
     * All methods touching 'process' are synchronized, including the termination callback. So a process
     * exiting concurrently with an ensureRunning() call either clears the handle before ensureRunning() looks
     * at it, or after it has been replaced, in which case the callback notices the handle is no longer its own
     * and leaves it alone.
     */
    public static final String ENV_ACCESS_TOKEN = "SPOTIFY_ACCESS_TOKEN";
    public static final String ENV_MODE = "ELECTRIC_SLIDESHOW_MODE";
    public static final String ENV_BACKEND_BASE_URL = "ELECTRIC_BACKEND_BASE_URL";
    public static final String ENV_IPC_SOCKET = "ELECTRIC_PLAYER_IPC_SOCKET";
    public static final String MODE_INTERNAL_PLAYER = "internal-player";

    /** How long ensureRunning() waits for a process we asked to stop before killing it. */
    private static final long TERMINATION_GRACE_SECONDS = 5;

    public interface ProcessListener {
        ProcessListener NOOP = new ProcessListener() {
            @Override
            public void started(PlayerProcess process) {}

            @Override
            public void exited(PlayerProcess process, int exitCode) {}
        };

        void started(PlayerProcess process);

        /** Called once when the current process exits, whether we stopped it or not. */
        void exited(PlayerProcess process, int exitCode);
    }

    private final LaunchMode launchMode;
    private final File devRepoPath;
    private final List<String> devCommand;
    private final HelperResolver helperResolver;
    private final String helperName;
    private final Path ipcSocket;
    private final ProcessLauncher launcher;
    private final DiagnosticLog.Component log;

    @Setter
    private volatile ProcessListener processListener = ProcessListener.NOOP;

    private PlayerProcess process;
    private PlayerProcess terminating;

    @Getter
    private volatile boolean running = false;

    @Getter
    private volatile Optional<String> lastError = Optional.empty();

    public PlayerProcessSupervisor(
            LaunchMode launchMode,
            File devRepoPath,
            List<String> devCommand,
            HelperResolver helperResolver,
            String helperName,
            Path ipcSocket,
            ProcessLauncher launcher,
            DiagnosticLog diagnostics) {
        this.launchMode = launchMode;
        this.devRepoPath = devRepoPath;
        this.devCommand = ImmutableList.copyOf(devCommand);
        this.helperResolver = helperResolver;
        this.helperName = helperName;
        this.ipcSocket = ipcSocket;
        this.launcher = launcher;
        this.log = diagnostics.forComponent(PlayerProcessSupervisor.class);
    }

    /**
     * Start the player unless it is already running.
     *
     * @param credential Spotify access token handed to the player
     * @param backendBaseUrl Electric Slideshow server the player should talk to, if any
     * @return the running process
     */
    public synchronized PlayerProcess ensureRunning(String credential, Optional<URI> backendBaseUrl)
            throws PlayerProcessException {
        if (process != null && process.isAlive() && process != terminating) {
            running = true;
            log.info("Internal player already running (pid {}), reusing existing process", process.pid());
            return process;
        }
        if (credential == null || credential.isBlank()) {
            throw fail(PlayerProcessException.noAccessCredential());
        }
        if (process != null) {
            // exited or exiting, but its termination callback has not run yet
            log.info("Clearing handle of stopped process (pid {})", process.pid());
            process = null;
            running = false;
        }
        awaitTermination();

        Map<String, String> environment = buildEnvironment(credential, backendBaseUrl);
        PlayerProcess started = switch (launchMode) {
            case DEV -> launchDev(environment);
            case PACKAGED -> launchPackaged(environment);
        };

        this.process = started;
        this.running = true;
        this.lastError = Optional.empty();
        started.onExit().whenComplete((p, error) -> exited(started));
        processListener.started(started);
        return started;
    }

    /** Ask the player to terminate. Returns without waiting for it to exit. */
    public synchronized void stop() {
        if (process == null) {
            log.info("No running process to stop");
            running = false;
            return;
        }
        if (!process.isAlive()) {
            log.info("Process already stopped");
            process = null;
            running = false;
            return;
        }
        log.info("Stopping internal player (pid {})", process.pid());
        terminating = process;
        process.terminate();
        // 'process' is cleared by the termination callback
    }

    public synchronized Optional<PlayerProcess> currentProcess() {
        return Optional.ofNullable(process);
    }

    private synchronized void exited(PlayerProcess exited) {
        if (terminating == exited) {
            terminating = null;
        }
        if (process != exited) {
            log.info("Previous process (pid {}) exited", exited.pid());
            return;
        }
        int exitCode = exited.exitValue();
        log.info("Process terminated with status: {}", exitCode);
        process = null;
        running = false;
        processListener.exited(exited, exitCode);
    }

    /** If a stop() is still in progress, wait for it so we never have two live players. */
    private void awaitTermination() {
        PlayerProcess previous = terminating;
        if (previous == null || !previous.isAlive()) {
            terminating = null;
            return;
        }
        log.info("Waiting for previous process (pid {}) to exit", previous.pid());
        try {
            if (!previous.awaitExit(TERMINATION_GRACE_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Previous process (pid {}) did not exit, killing it", previous.pid());
                previous.kill();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            previous.kill();
        }
        terminating = null;
    }

    private Map<String, String> buildEnvironment(String credential, Optional<URI> backendBaseUrl) {
        ImmutableMap.Builder<String, String> environment = ImmutableMap.<String, String>builder()
                .put(ENV_ACCESS_TOKEN, credential)
                .put(ENV_MODE, MODE_INTERNAL_PLAYER)
                .put(ENV_IPC_SOCKET, ipcSocket.toString());
        backendBaseUrl.ifPresent(url -> environment.put(ENV_BACKEND_BASE_URL, url.toString()));
        log.info("Environment set (token prefix {}, backend url set: {})",
                DiagnosticLog.redact(credential), backendBaseUrl.isPresent());
        return environment.build();
    }

    private PlayerProcess launchDev(Map<String, String> environment) throws PlayerProcessException {
        if (!devRepoPath.isDirectory()) {
            log.error("Invalid path: {}", devRepoPath);
            throw fail(PlayerProcessException.invalidPath(devRepoPath.getPath()));
        }
        log.info("Starting internal player in dev mode at {}", devRepoPath.getAbsolutePath());
        return launch(LaunchMode.DEV, devCommand, devRepoPath, environment);
    }

    private PlayerProcess launchPackaged(Map<String, String> environment) throws PlayerProcessException {
        File helper = helperResolver.resolve(helperName).orElse(null);
        if (helper == null) {
            log.error("Embedded helper {} not found", helperName);
            throw fail(PlayerProcessException.helperNotFound(helperName));
        }
        log.info("Starting bundled internal player at {}", helper.getPath());
        return launch(LaunchMode.PACKAGED, ImmutableList.of(helper.getPath()), helper.getParentFile(), environment);
    }

    private PlayerProcess launch(LaunchMode mode, List<String> command, File directory,
                                 Map<String, String> environment) throws PlayerProcessException {
        log.info("$ {}", String.join(" ", command));
        try {
            PlayerProcess launched = new PlayerProcess(mode, launcher.launch(command, directory, environment),
                    environment);
            log.info("Process launched with PID {}", launched.pid());
            return launched;
        } catch (IOException | RuntimeException e) {
            log.error("Process launch failed: {}", e.getMessage());
            throw fail(PlayerProcessException.launchFailed(e.getMessage(), e));
        }
    }

    private PlayerProcessException fail(PlayerProcessException error) {
        this.lastError = Optional.of(error.getMessage());
        return error;
    }
}
