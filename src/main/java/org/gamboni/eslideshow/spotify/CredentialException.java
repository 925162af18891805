package org.gamboni.eslideshow.spotify;

import lombok.Getter;

/** Could not obtain an access token. */
@Getter
public class CredentialException extends Exception {

    public enum Kind {
        NOT_AUTHENTICATED,
        NETWORK_FAILURE
    }

    private final Kind kind;

    public CredentialException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CredentialException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
