package org.gamboni.eslideshow.spotify;

import java.util.Locale;

public enum RepeatMode {
    OFF,
    /** Repeat the current playlist or queue. */
    CONTEXT,
    TRACK;

    /** Value of the Web API {@code state} parameter. */
    public String apiValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
