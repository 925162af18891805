package org.gamboni.eslideshow.tech.process;

import com.google.common.collect.ImmutableList;
import org.gamboni.eslideshow.tech.DiagnosticLog;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class PlayerProcessSupervisorTest {
    private static final String TOKEN = "BQD1234567890";
    private static final Path SOCKET = Path.of("/tmp/test-player.sock");

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private final FakeLauncher launcher = new FakeLauncher();
    private final DiagnosticLog diagnostics = new DiagnosticLog();

    private PlayerProcessSupervisor devSupervisor(File repo) {
        return new PlayerProcessSupervisor(LaunchMode.DEV, repo, ImmutableList.of("/usr/bin/env", "npm", "run", "dev"),
                name -> Optional.empty(), "Helper", SOCKET, launcher, diagnostics);
    }

    @Test
    public void ensureRunningSpawnsOnlyOnceWhileAlive() throws Exception {
        PlayerProcessSupervisor supervisor = devSupervisor(tmp.getRoot());

        PlayerProcess first = supervisor.ensureRunning(TOKEN, Optional.empty());
        PlayerProcess second = supervisor.ensureRunning(TOKEN, Optional.empty());
        PlayerProcess third = supervisor.ensureRunning("another-token", Optional.empty());

        assertEquals(1, launcher.count());
        assertSame(first, second);
        assertSame(first, third);
        assertTrue(supervisor.isRunning());
    }

    @Test
    public void exitedProcessIsReplacedByExactlyOneNewProcess() throws Exception {
        PlayerProcessSupervisor supervisor = devSupervisor(tmp.getRoot());
        supervisor.ensureRunning(TOKEN, Optional.empty());

        launcher.last().exit(1);

        assertFalse(supervisor.isRunning());
        assertEquals(Optional.empty(), supervisor.currentProcess());

        supervisor.ensureRunning(TOKEN, Optional.empty());
        supervisor.ensureRunning(TOKEN, Optional.empty());
        assertEquals(2, launcher.count());
        assertTrue(supervisor.isRunning());
    }

    @Test
    public void devModeRunsCommandInRepositoryWithInjectedEnvironment() throws Exception {
        File repo = tmp.newFolder("player");
        PlayerProcessSupervisor supervisor = devSupervisor(repo);

        PlayerProcess process = supervisor.ensureRunning(TOKEN, Optional.of(URI.create("https://example.org")));

        FakeLauncher.Launch launch = launcher.launches.get(0);
        assertEquals(ImmutableList.of("/usr/bin/env", "npm", "run", "dev"), launch.command());
        assertEquals(repo, launch.workingDirectory());
        assertEquals(TOKEN, launch.environment().get(PlayerProcessSupervisor.ENV_ACCESS_TOKEN));
        assertEquals("internal-player", launch.environment().get(PlayerProcessSupervisor.ENV_MODE));
        assertEquals("https://example.org", launch.environment().get(PlayerProcessSupervisor.ENV_BACKEND_BASE_URL));
        assertEquals(SOCKET.toString(), launch.environment().get(PlayerProcessSupervisor.ENV_IPC_SOCKET));

        assertEquals(LaunchMode.DEV, process.getLaunchMode());
        assertEquals("BQD123…", process.environment().get(PlayerProcessSupervisor.ENV_ACCESS_TOKEN));
        assertFalse(diagnostics.formatted().contains(TOKEN));
    }

    @Test
    public void backendUrlIsOnlyInjectedWhenConfigured() throws Exception {
        devSupervisor(tmp.getRoot()).ensureRunning(TOKEN, Optional.empty());

        assertFalse(launcher.launches.get(0).environment().containsKey(PlayerProcessSupervisor.ENV_BACKEND_BASE_URL));
    }

    @Test
    public void devModeWithMissingDirectoryFailsWithInvalidPath() {
        PlayerProcessSupervisor supervisor = devSupervisor(new File(tmp.getRoot(), "does-not-exist"));

        try {
            supervisor.ensureRunning(TOKEN, Optional.empty());
            fail("Expected InvalidPath");
        } catch (PlayerProcessException e) {
            assertEquals(PlayerProcessException.Kind.INVALID_PATH, e.getKind());
        }
        assertFalse(supervisor.isRunning());
        assertEquals(Optional.empty(), supervisor.currentProcess());
        assertEquals(0, launcher.count());
        assertTrue(supervisor.getLastError().isPresent());
    }

    @Test
    public void packagedModeWithoutHelperFailsWithHelperNotFound() {
        PlayerProcessSupervisor supervisor = new PlayerProcessSupervisor(LaunchMode.PACKAGED, tmp.getRoot(),
                ImmutableList.of(), new BundledHelperResolver(tmp.getRoot()), "ElectricSlideshowInternalPlayer",
                SOCKET, launcher, diagnostics);

        try {
            supervisor.ensureRunning(TOKEN, Optional.empty());
            fail("Expected HelperNotFound");
        } catch (PlayerProcessException e) {
            assertEquals(PlayerProcessException.Kind.HELPER_NOT_FOUND, e.getKind());
        }
        assertEquals(0, launcher.count());
    }

    @Test
    public void packagedModeRunsResolvedHelper() throws Exception {
        File helper = tmp.newFile("ElectricSlideshowInternalPlayer");
        assertTrue(helper.setExecutable(true));
        PlayerProcessSupervisor supervisor = new PlayerProcessSupervisor(LaunchMode.PACKAGED, tmp.getRoot(),
                ImmutableList.of(), new BundledHelperResolver(tmp.getRoot()), "ElectricSlideshowInternalPlayer",
                SOCKET, launcher, diagnostics);

        supervisor.ensureRunning(TOKEN, Optional.empty());

        assertEquals(ImmutableList.of(helper.getPath()), launcher.launches.get(0).command());
    }

    @Test
    public void blankCredentialIsRejectedBeforeLaunching() {
        PlayerProcessSupervisor supervisor = devSupervisor(tmp.getRoot());

        try {
            supervisor.ensureRunning(" ", Optional.empty());
            fail("Expected NoAccessCredential");
        } catch (PlayerProcessException e) {
            assertEquals(PlayerProcessException.Kind.NO_ACCESS_CREDENTIAL, e.getKind());
        }
        assertEquals(0, launcher.count());
    }

    @Test
    public void launchFailureIsReported() {
        launcher.failure = "No such file or directory";
        PlayerProcessSupervisor supervisor = devSupervisor(tmp.getRoot());

        try {
            supervisor.ensureRunning(TOKEN, Optional.empty());
            fail("Expected LaunchFailed");
        } catch (PlayerProcessException e) {
            assertEquals(PlayerProcessException.Kind.LAUNCH_FAILED, e.getKind());
            assertTrue(e.getMessage().contains("No such file or directory"));
        }
        assertFalse(supervisor.isRunning());
    }

    @Test
    public void stopReturnsBeforeProcessExits() throws Exception {
        PlayerProcessSupervisor supervisor = devSupervisor(tmp.getRoot());
        supervisor.ensureRunning(TOKEN, Optional.empty());
        FakeProcess process = launcher.last();
        process.exitOnDestroy = false;

        supervisor.stop();
        assertTrue(process.isAlive());

        process.exit(143);
        assertFalse(supervisor.isRunning());
        assertEquals(Optional.empty(), supervisor.currentProcess());
    }

    @Test
    public void stopWithoutProcessDoesNothing() {
        PlayerProcessSupervisor supervisor = devSupervisor(tmp.getRoot());

        supervisor.stop();

        assertFalse(supervisor.isRunning());
    }

    @Test
    public void exitOfStoppedProcessDoesNotClearItsReplacement() throws Exception {
        PlayerProcessSupervisor supervisor = devSupervisor(tmp.getRoot());
        supervisor.ensureRunning(TOKEN, Optional.empty());
        FakeProcess old = launcher.last();
        old.exitOnDestroy = false;
        supervisor.stop();

        Thread exiter = new Thread(() -> {
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            old.exit(143);
        });
        exiter.start();
        PlayerProcess replacement = supervisor.ensureRunning(TOKEN, Optional.empty());
        exiter.join();

        assertFalse(old.isAlive());
        assertEquals(2, launcher.count());
        assertEquals(Optional.of(replacement), supervisor.currentProcess());
        assertTrue(supervisor.isRunning());
    }

    @Test
    public void listenerIsToldAboutStartAndExit() throws Exception {
        List<String> calls = new ArrayList<>();
        PlayerProcessSupervisor supervisor = devSupervisor(tmp.getRoot());
        supervisor.setProcessListener(new PlayerProcessSupervisor.ProcessListener() {
            @Override
            public void started(PlayerProcess process) {
                calls.add("started " + process.pid());
            }

            @Override
            public void exited(PlayerProcess process, int exitCode) {
                calls.add("exited " + process.pid() + " " + exitCode);
            }
        });

        supervisor.ensureRunning(TOKEN, Optional.empty());
        supervisor.stop();

        assertEquals(ImmutableList.of("started 1000", "exited 1000 143"), calls);
    }
}
