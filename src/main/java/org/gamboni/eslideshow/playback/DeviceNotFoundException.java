package org.gamboni.eslideshow.playback;

/** The internal player's Spotify Connect device could not be found, even after looking it up again. */
public class DeviceNotFoundException extends IllegalStateException {
    public DeviceNotFoundException(String deviceName) {
        super("Device '" + deviceName + "' not found");
    }
}
