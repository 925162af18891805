package org.gamboni.eslideshow.spotify;

/** Source of Spotify access tokens. */
public interface TokenProvider {
    /** Return an access token that is not expired, refreshing it if needed. */
    String getValidAccessCredential() throws CredentialException;
}
