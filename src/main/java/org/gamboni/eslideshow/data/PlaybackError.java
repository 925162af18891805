package org.gamboni.eslideshow.data;

/** Error reported by a playback backend to its listener. */
public record PlaybackError(Kind kind, String message) {

    public enum Kind {
        /** The backend is not initialized yet. */
        NOT_READY,
        /** The backend's device could not be found on the Web API. */
        DEVICE_NOT_FOUND,
        /** Missing or invalid access token. */
        UNAUTHORIZED,
        NETWORK,
        /** The player process could not be started. */
        PROCESS,
        /** Any other backend-specific failure. */
        BACKEND
    }

    public static PlaybackError notReady() {
        return new PlaybackError(Kind.NOT_READY, "Player starting up…");
    }

    public static PlaybackError backend(String message) {
        return new PlaybackError(Kind.BACKEND, message);
    }
}
