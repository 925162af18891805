package org.gamboni.eslideshow.tech.channel;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableMap;
import org.gamboni.eslideshow.tech.DiagnosticLog;
import org.gamboni.eslideshow.tech.Mapping;

import java.net.URI;
import java.util.Map;

/** Command sent to the player process, serialised as {@code {"command": name, ...params}}. */
public record PlayerCommand(String name, Map<String, Object> params) {
    private static final String TOKEN = "token";

    public PlayerCommand {
        params = ImmutableMap.copyOf(params);
    }

    private static PlayerCommand of(String name) {
        return new PlayerCommand(name, ImmutableMap.of());
    }

    public static PlayerCommand load(URI url) {
        return new PlayerCommand("load", ImmutableMap.of("url", url.toString()));
    }

    public static PlayerCommand setAccessToken(String token) {
        return new PlayerCommand("setAccessToken", ImmutableMap.of(TOKEN, token));
    }

    public static PlayerCommand connect() {
        return of("connect");
    }

    public static PlayerCommand play(String trackUri, long positionMs) {
        return new PlayerCommand("play", ImmutableMap.of("trackUri", trackUri, "positionMs", positionMs));
    }

    public static PlayerCommand pause() {
        return of("pause");
    }

    public static PlayerCommand resume() {
        return of("resume");
    }

    public static PlayerCommand next() {
        return of("next");
    }

    public static PlayerCommand previous() {
        return of("previous");
    }

    public static PlayerCommand seek(long positionMs) {
        return new PlayerCommand("seek", ImmutableMap.of("positionMs", positionMs));
    }

    public static PlayerCommand setVolume(double volume) {
        return new PlayerCommand("setVolume", ImmutableMap.of("volume", volume));
    }

    public String toJson(Mapping mapping) {
        ObjectNode node = mapping.newObject();
        node.put("command", name);
        params.forEach((key, value) -> node.set(key, mapping.get().valueToTree(value)));
        return mapping.writeValueAsString(node);
    }

    /** Loggable form: the access token, if any, is shortened. */
    @Override
    public String toString() {
        if (params.containsKey(TOKEN)) {
            return name + "{token=" + DiagnosticLog.redact((String) params.get(TOKEN)) + "}";
        }
        return params.isEmpty() ? name : name + params;
    }
}
