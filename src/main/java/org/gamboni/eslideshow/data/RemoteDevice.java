package org.gamboni.eslideshow.data;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Optional;

/**
 * Spotify Connect device, as listed by the Web API.
 *
 * @param volumePercent current volume, if the device reports one
 */
public record RemoteDevice(
        String id,
        String name,
        String type,
        boolean isActive,
        boolean isRestricted,
        Optional<Integer> volumePercent) {

    /** Some responses carry the usable identifier in {@code device_id} rather than {@code id}. */
    @JsonCreator
    public static RemoteDevice fromJson(
            @JsonProperty("id") String id,
            @JsonProperty("device_id") String deviceId,
            @JsonProperty("name") String name,
            @JsonProperty("type") String type,
            @JsonProperty("is_active") boolean isActive,
            @JsonProperty("is_restricted") boolean isRestricted,
            @JsonProperty("volume_percent") Integer volumePercent) {
        return new RemoteDevice(
                (deviceId == null) ? id : deviceId,
                name,
                type,
                isActive,
                isRestricted,
                Optional.ofNullable(volumePercent));
    }
}
