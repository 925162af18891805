package org.gamboni.eslideshow.tech.process;

import lombok.Getter;

/** Failure to get the internal player process running. */
@Getter
public class PlayerProcessException extends Exception {

    public enum Kind {
        INVALID_PATH,
        LAUNCH_FAILED,
        HELPER_NOT_FOUND,
        NO_ACCESS_CREDENTIAL
    }

    private final Kind kind;

    private PlayerProcessException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static PlayerProcessException invalidPath(String path) {
        return new PlayerProcessException(Kind.INVALID_PATH, "Invalid internal player path: " + path, null);
    }

    public static PlayerProcessException launchFailed(String reason, Throwable cause) {
        return new PlayerProcessException(Kind.LAUNCH_FAILED, "Failed to launch internal player: " + reason, cause);
    }

    public static PlayerProcessException helperNotFound(String helperName) {
        return new PlayerProcessException(Kind.HELPER_NOT_FOUND,
                "Embedded internal player helper " + helperName + " not found", null);
    }

    public static PlayerProcessException noAccessCredential() {
        return new PlayerProcessException(Kind.NO_ACCESS_CREDENTIAL, "No Spotify access token available", null);
    }
}
