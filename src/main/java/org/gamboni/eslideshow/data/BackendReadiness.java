package org.gamboni.eslideshow.data;

/** Start-up progress of a playback backend. Only {@link #READY} accepts playback commands. */
public enum BackendReadiness {
    UNINITIALIZED,
    PROCESS_STARTING,
    CONTENT_LOADING,
    CREDENTIAL_PENDING,
    CONNECTING_DEVICE,
    DISCOVERING_DEVICE,
    READY,
    /** Was ready, or failed to start. Can recover without a restart. */
    DEGRADED;

    public boolean isReady() {
        return this == READY;
    }

    /** True while a start-up is under way, or done. */
    public boolean isStartingOrReady() {
        return this != UNINITIALIZED && this != DEGRADED;
    }
}
