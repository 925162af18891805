package org.gamboni.eslideshow.spotify;

import lombok.Getter;

import java.io.IOException;
import java.util.Optional;

/** The Web API answered with a non-success status. */
@Getter
public class RemoteApiException extends IOException {
    public static final String NO_ACTIVE_DEVICE = "NO_ACTIVE_DEVICE";

    private final int statusCode;
    private final Optional<String> reason;

    public RemoteApiException(int statusCode, String message, Optional<String> reason) {
        super(message);
        this.statusCode = statusCode;
        this.reason = reason;
    }

    /** True if the request named a device Spotify does not know (any more). */
    public boolean isDeviceNotFound() {
        return statusCode == 404 || reason.filter(NO_ACTIVE_DEVICE::equals).isPresent();
    }

    @Override
    public String toString() {
        return "HTTP " + statusCode + ": " + getMessage();
    }
}
