package org.gamboni.eslideshow.data;

/** Status payload served to the front end.
 *
 * @param lastError most recent playback failure, or null if there was none
 */
public record BackendStatus(
        String mode,
        BackendReadiness readiness,
        boolean ready,
        PlaybackState state,
        PlaybackError lastError) {
}
