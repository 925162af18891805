package org.gamboni.eslideshow;

import org.gamboni.eslideshow.spotify.CredentialException;
import org.gamboni.eslideshow.spotify.TokenProvider;

import java.util.Optional;

/** Hands out the access token most recently pushed by the front end, which owns the sign-in flow. */
public class SessionTokenProvider implements TokenProvider {
    private volatile Optional<String> token = Optional.empty();

    public void update(String newToken) {
        this.token = Optional.ofNullable(newToken).filter(t -> !t.isBlank());
    }

    public boolean hasToken() {
        return token.isPresent();
    }

    @Override
    public String getValidAccessCredential() throws CredentialException {
        return token.orElseThrow(() -> new CredentialException(CredentialException.Kind.NOT_AUTHENTICATED,
                "Not signed in to Spotify"));
    }
}
