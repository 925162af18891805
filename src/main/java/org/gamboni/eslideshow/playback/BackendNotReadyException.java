package org.gamboni.eslideshow.playback;

import org.gamboni.eslideshow.data.BackendReadiness;

/** A playback command was refused because the backend is not ready. */
public class BackendNotReadyException extends IllegalStateException {
    public BackendNotReadyException(BackendReadiness readiness) {
        super("Player not ready (" + readiness + ")");
    }
}
