package org.gamboni.eslideshow.tech.channel;

import com.google.common.util.concurrent.Uninterruptibles;
import org.gamboni.eslideshow.tech.DiagnosticLog;
import org.gamboni.eslideshow.tech.Mapping;
import org.gamboni.eslideshow.tech.process.PlayerProcess;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.net.UnixDomainSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/** Control channel over the Unix domain socket the player process listens on. */
public class SocketControlChannel extends AbstractControlChannel {
    /* Design notes:
     * We treat the player like a remote system. It creates the socket some time after it starts, so
     * after attach() a status thread keeps trying to connect, then reads one JSON event per line until the
     * connection drops, then tries connecting again, for as long as the process is alive.
     * Writes come from whichever thread sends a command, and are serialised on the client.
     */
    private static final Duration RETRY_DELAY = Duration.ofMillis(500);

    private final Path socket;
    private final Mapping mapping;

    private volatile Optional<SocketClient> client = Optional.empty();

    public SocketControlChannel(Path socket, URI contentUrl, Mapping mapping, DiagnosticLog diagnostics) {
        super(contentUrl,
                new ControlEventDecoder(mapping, diagnostics),
                diagnostics.forComponent(SocketControlChannel.class));
        this.socket = socket;
        this.mapping = mapping;
    }

    @Override
    public void attach(PlayerProcess process) {
        detach();
        var newClient = new SocketClient(process);
        this.client = Optional.of(newClient);
        Thread thread = new Thread(newClient::run, "player-channel-" + process.pid());
        thread.setDaemon(true);
        thread.start();
    }

    @Override
    public void detach() {
        Optional<SocketClient> previous = this.client;
        this.client = Optional.empty();
        previous.ifPresent(SocketClient::close);
        reset();
    }

    @Override
    protected boolean transmit(PlayerCommand command) {
        Optional<SocketClient> copy = this.client;
        if (copy.isEmpty()) {
            return false;
        }
        try {
            return copy.get().write(command.toJson(mapping));
        } catch (IOException e) {
            log.warn("Send failed: {}", e.getMessage());
            return false;
        }
    }

    private class SocketClient {
        final PlayerProcess process;

        SocketChannel playerSocket;
        BufferedReader reader;
        volatile boolean closed = false;

        private SocketClient(PlayerProcess process) {
            this.process = process;
        }

        void run() {
            try {
                while (!closed && process.isAlive()) {
                    boolean ok = isConnected() ? poll() : tryConnecting();
                    if (!ok) {
                        // either lost connection (probably the player is shutting down)
                        // or could not connect (probably the player is starting up): wait a bit and try again
                        Uninterruptibles.sleepUninterruptibly(RETRY_DELAY);
                    }
                }
            } finally {
                disconnect();
                log.info("Channel to pid {} closed", process.pid());
            }
        }

        private synchronized boolean isConnected() {
            return reader != null;
        }

        /** Try connecting to the player socket. This may only be used when we're not connected. */
        private boolean tryConnecting() {
            try {
                SocketChannel channel = SocketChannel.open(UnixDomainSocketAddress.of(socket));
                synchronized (this) {
                    this.playerSocket = channel;
                    this.reader = new BufferedReader(Channels.newReader(channel, StandardCharsets.UTF_8));
                }
            } catch (IOException e) {
                return false;
            }
            log.info("Connected to player at {}", socket);
            connected();
            return true;
        }

        /** Wait for the next event from the player. This may only be used when connected. */
        private boolean poll() {
            String line = null;
            try {
                line = reader.readLine(); // blocking
            } catch (IOException e) {
                if (!closed) {
                    log.warn("Read failed: {}", e.getMessage());
                }
            }
            if (line == null) {
                disconnect();
                return false;
            }
            if (!line.isBlank()) {
                received(line);
            }
            return true;
        }

        synchronized boolean write(String message) throws IOException {
            SocketChannel copy = playerSocket;
            if (copy == null) {
                return false;
            }
            ByteBuffer buffer = ByteBuffer.wrap((message + "\n").getBytes(StandardCharsets.UTF_8));
            while (buffer.hasRemaining()) {
                copy.write(buffer);
            }
            return true;
        }

        void close() {
            closed = true;
            disconnect();
        }

        private synchronized void disconnect() {
            playerSocket = tryClose(playerSocket);
            reader = tryClose(reader);
        }
    }

    private <T extends Closeable> T tryClose(T resource) {
        try {
            if (resource != null) {
                resource.close();
            } // else: resource was already closed, so do nothing
        } catch (IOException e) {
            log.debug("Error closing {}: {}", resource, e.getMessage());
        }
        return null;
    }
}
