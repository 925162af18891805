package org.gamboni.eslideshow.tech.channel;

import lombok.Setter;
import org.gamboni.eslideshow.tech.DiagnosticLog;

import java.net.URI;
import java.util.Optional;

/** Command encoding, event decoding and credential buffering, independent of the transport. */
public abstract class AbstractControlChannel implements ControlChannel {
    private final URI contentUrl;
    private final ControlEventDecoder decoder;
    protected final DiagnosticLog.Component log;

    @Setter
    private volatile EventListener eventListener = EventListener.NOOP;

    private boolean loadRequested = false;
    private boolean contentLoaded = false;
    private boolean credentialDelivered = false;
    private Optional<String> pendingCredential = Optional.empty();

    protected AbstractControlChannel(URI contentUrl, ControlEventDecoder decoder, DiagnosticLog.Component log) {
        this.contentUrl = contentUrl;
        this.decoder = decoder;
        this.log = log;
    }

    /**
     * Send the given command to the player.
     *
     * @return false if the command could not be sent
     */
    protected abstract boolean transmit(PlayerCommand command);

    /** To be called by the transport when it (re)connects to the player. */
    protected void connected() {
        boolean reload;
        synchronized (this) {
            reload = loadRequested && !contentLoaded;
        }
        if (reload) {
            send(PlayerCommand.load(contentUrl));
        }
    }

    /** To be called by the transport for each message received from the player. */
    protected void received(String raw) {
        ControlEvent event = decoder.decode(raw);
        if (event instanceof ControlEvent.StateChanged) {
            log.debug("< {}", event);
        } else {
            log.info("< {}", event);
        }
        if (event instanceof ControlEvent.ContentLoaded) {
            contentLoaded();
        }
        eventListener.received(event);
    }

    private void contentLoaded() {
        Optional<String> flush;
        synchronized (this) {
            contentLoaded = true;
            flush = pendingCredential;
            pendingCredential = Optional.empty();
            if (flush.isPresent()) {
                credentialDelivered = true;
            }
        }
        flush.ifPresent(token -> {
            log.info("Flushing buffered token");
            send(PlayerCommand.setAccessToken(token));
        });
    }

    /** Reset the content and credential state, for when the player goes away. */
    protected synchronized void reset() {
        loadRequested = false;
        contentLoaded = false;
        credentialDelivered = false;
        pendingCredential = Optional.empty();
    }

    @Override
    public void loadContent() {
        synchronized (this) {
            loadRequested = true;
            contentLoaded = false;
            credentialDelivered = false;
        }
        log.info("Loading internal player from {}", contentUrl);
        send(PlayerCommand.load(contentUrl));
    }

    @Override
    public synchronized boolean isContentLoaded() {
        return contentLoaded;
    }

    @Override
    public boolean sendCredential(String token) {
        synchronized (this) {
            if (!contentLoaded) {
                log.info("Content not loaded yet, buffering token {}", DiagnosticLog.redact(token));
                pendingCredential = Optional.of(token);
                return false;
            }
            credentialDelivered = true;
        }
        send(PlayerCommand.setAccessToken(token));
        return true;
    }

    @Override
    public synchronized boolean isCredentialDelivered() {
        return credentialDelivered;
    }

    @Override
    public void connect() {
        send(PlayerCommand.connect());
    }

    @Override
    public void play(String trackUri, long startPositionMs) {
        send(PlayerCommand.play(trackUri, Math.max(0, startPositionMs)));
    }

    @Override
    public void pause() {
        send(PlayerCommand.pause());
    }

    @Override
    public void resume() {
        send(PlayerCommand.resume());
    }

    @Override
    public void next() {
        send(PlayerCommand.next());
    }

    @Override
    public void previous() {
        send(PlayerCommand.previous());
    }

    @Override
    public void seek(long positionMs) {
        send(PlayerCommand.seek(Math.max(0, positionMs)));
    }

    @Override
    public void setVolume(double volume) {
        send(PlayerCommand.setVolume(Math.max(0.0, Math.min(1.0, volume))));
    }

    private void send(PlayerCommand command) {
        log.info("> {}", command);
        if (!transmit(command)) {
            log.warn("Could not send {}: player not connected", command.name());
        }
    }
}
