package org.gamboni.eslideshow.tech.process;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.Map;

/** Creates operating system processes. Lets tests substitute fake processes. */
public interface ProcessLauncher {
    /**
     * Start a process.
     *
     * @param command executable followed by its arguments
     * @param workingDirectory working directory, or {@code null} to inherit ours
     * @param environment variables to add to (or override in) our own environment
     */
    Process launch(List<String> command, File workingDirectory, Map<String, String> environment) throws IOException;

    ProcessLauncher SYSTEM = (command, workingDirectory, environment) -> {
        ProcessBuilder builder = new ProcessBuilder(command)
                .directory(workingDirectory)
                .redirectErrorStream(true)
                .redirectOutput(ProcessBuilder.Redirect.INHERIT);
        builder.environment().putAll(environment);
        return builder.start();
    };
}
