package org.gamboni.eslideshow.playback;

/** Which playback backend to use. */
public enum BackendMode {
    /** Plays nothing. */
    NOOP,
    /** Control whichever Spotify device is already active, through the Web API. */
    EXTERNAL_DEVICE,
    /** Play through the player process we start ourselves. */
    INTERNAL
}
