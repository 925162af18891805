package org.gamboni.eslideshow.spotify;

import org.gamboni.eslideshow.data.RemoteDevice;

import java.io.IOException;
import java.util.List;

/**
 * The part of the Spotify Web API used for playback.
 *
 * <p>Methods taking a {@code deviceId} target the currently active device when it is {@code null}.
 * Calls block for the duration of the HTTP request, and fail with {@link RemoteApiException} on an error status
 * or {@link CredentialException} if no token is available.
 */
public interface SpotifyWebApi {
    List<RemoteDevice> listDevices() throws IOException, CredentialException;

    /** @param startPositionMs where to start in the track, or {@code null} for the beginning */
    void startPlayback(String trackUri, String deviceId, Long startPositionMs) throws IOException, CredentialException;

    void pause(String deviceId) throws IOException, CredentialException;

    void resume(String deviceId) throws IOException, CredentialException;

    void seek(long positionMs, String deviceId) throws IOException, CredentialException;

    void setVolume(int percent, String deviceId) throws IOException, CredentialException;

    void skipNext(String deviceId) throws IOException, CredentialException;

    void skipPrevious(String deviceId) throws IOException, CredentialException;

    void setShuffle(boolean on) throws IOException, CredentialException;

    void setRepeat(RepeatMode mode) throws IOException, CredentialException;
}
