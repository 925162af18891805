package org.gamboni.eslideshow.tech.process;

import com.google.common.collect.ImmutableMap;
import lombok.Getter;
import org.gamboni.eslideshow.tech.DiagnosticLog;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/** Handle on a running (or exited) internal player process. */
public class PlayerProcess {
    @Getter
    private final LaunchMode launchMode;
    private final Process process;
    private final ImmutableMap<String, String> environment;

    PlayerProcess(LaunchMode launchMode, Process process, Map<String, String> environment) {
        this.launchMode = launchMode;
        this.process = process;
        this.environment = ImmutableMap.copyOf(environment);
    }

    public long pid() {
        try {
            return process.pid();
        } catch (UnsupportedOperationException e) {
            return -1;
        }
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    /** The variables injected into the process environment, with the access token redacted. */
    public Map<String, String> environment() {
        ImmutableMap.Builder<String, String> builder = ImmutableMap.builder();
        environment.forEach((key, value) -> builder.put(key,
                key.equals(PlayerProcessSupervisor.ENV_ACCESS_TOKEN) ? DiagnosticLog.redact(value) : value));
        return builder.build();
    }

    /** Ask the process to terminate (SIGTERM on Unix). */
    void terminate() {
        process.destroy();
    }

    /** Kill the process without giving it a chance to clean up. */
    void kill() {
        process.destroyForcibly();
    }

    boolean awaitExit(long timeout, TimeUnit unit) throws InterruptedException {
        return process.waitFor(timeout, unit);
    }

    CompletableFuture<Process> onExit() {
        return process.onExit();
    }

    int exitValue() {
        try {
            return process.exitValue();
        } catch (IllegalThreadStateException e) {
            return -1;
        }
    }

    @Override
    public String toString() {
        return "PlayerProcess[pid=" + pid() + ", mode=" + launchMode + "]";
    }
}
