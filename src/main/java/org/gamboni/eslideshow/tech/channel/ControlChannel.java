package org.gamboni.eslideshow.tech.channel;

import org.gamboni.eslideshow.tech.process.PlayerProcess;

/** Two-way message channel with the internal player process.
 *
 * <p>Commands are best-effort: they return without waiting for the player, which reports what it did
 * through events.
 */
public interface ControlChannel {

    interface EventListener {
        EventListener NOOP = event -> {};

        void received(ControlEvent event);
    }

    void setEventListener(EventListener listener);

    /** Start talking to a freshly started player process. */
    void attach(PlayerProcess process);

    /** Forget the current player process, along with its content and credential state. */
    void detach();

    /** Ask the player to load its playback page. Completion is signalled by {@link ControlEvent.ContentLoaded}. */
    void loadContent();

    boolean isContentLoaded();

    /**
     * Hand the access token to the player. Before the content is loaded the token is kept (replacing any
     * token kept earlier) and sent as soon as {@link ControlEvent.ContentLoaded} arrives.
     *
     * @return true if the token was sent right away, false if it was kept for later
     */
    boolean sendCredential(String token);

    /** True once a token has been sent to the currently loaded content. */
    boolean isCredentialDelivered();

    /** Ask the player to register itself as a Spotify Connect device. */
    void connect();

    void play(String trackUri, long startPositionMs);

    void pause();

    void resume();

    void next();

    void previous();

    void seek(long positionMs);

    /** Set the volume, between 0 and 1. Out-of-range values are clamped. */
    void setVolume(double volume);
}
