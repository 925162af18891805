package org.gamboni.eslideshow.tech.channel;

import org.gamboni.eslideshow.data.PlaybackState;

/** Event sent by the internal player process. */
public sealed interface ControlEvent {

    /** The player registered itself as a Spotify Connect device. */
    record Ready(String deviceId) implements ControlEvent {}

    /** The player's device went offline. */
    record NotReady(String deviceId) implements ControlEvent {}

    /** Playback progressed, paused, resumed or switched tracks. Track fields may be {@code null}. */
    record StateChanged(
            boolean isPlaying,
            long positionMs,
            long durationMs,
            String trackUri,
            String trackName,
            String artistName) implements ControlEvent {

        public PlaybackState toPlaybackState() {
            return new PlaybackState(trackUri, trackName, artistName, positionMs, durationMs, isPlaying, false);
        }
    }

    record PlayerError(String code, String message) implements ControlEvent {}

    /** The player page finished loading. */
    record ContentLoaded() implements ControlEvent {}

    /** The player took the access token we sent it. */
    record CredentialAck() implements ControlEvent {}

    record ConnectResult(boolean ok) implements ControlEvent {}

    /** Anything we could not make sense of. */
    record Unknown(String raw) implements ControlEvent {}
}
