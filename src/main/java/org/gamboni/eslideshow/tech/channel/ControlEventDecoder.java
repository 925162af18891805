package org.gamboni.eslideshow.tech.channel;

import com.fasterxml.jackson.databind.JsonNode;
import org.gamboni.eslideshow.tech.DiagnosticLog;
import org.gamboni.eslideshow.tech.Mapping;

import java.util.Optional;

/** Turns the loosely-typed messages of the player process into {@link ControlEvent}s. Never throws. */
public class ControlEventDecoder {
    /* example messages:

    {"type":"ready","deviceId":"5c0a..."}
    {"type":"stateChanged","isPlaying":true,"positionMs":1234,"durationMs":200000,"trackUri":"spotify:track:..."}
    {"type":"stateChanged","isPlaying":null,"trackUri":null}
    {"type":"error","code":"authentication_error","message":"Invalid token scopes."}
    {"type":"connectResult","message":"connected"}
     */
    private final Mapping mapping;
    private final DiagnosticLog.Component log;

    public ControlEventDecoder(Mapping mapping, DiagnosticLog diagnostics) {
        this.mapping = mapping;
        this.log = diagnostics.forComponent(ControlEventDecoder.class);
    }

    public ControlEvent decode(String raw) {
        Optional<JsonNode> parsed = mapping.tryReadTree(raw);
        if (parsed.isEmpty() || !parsed.get().isObject()) {
            log.warn("Failed to decode event: {}", raw);
            return new ControlEvent.Unknown(raw);
        }
        JsonNode message = parsed.get();
        String type = text(message, "type");
        if (type == null) {
            log.warn("Event without type: {}", raw);
            return new ControlEvent.Unknown(raw);
        }
        return switch (type) {
            case "ready" -> new ControlEvent.Ready(text(message, "deviceId"));
            case "notReady" -> new ControlEvent.NotReady(text(message, "deviceId"));
            case "stateChanged" -> new ControlEvent.StateChanged(
                    message.path("isPlaying").asBoolean(false),
                    message.path("positionMs").asLong(0),
                    message.path("durationMs").asLong(0),
                    text(message, "trackUri"),
                    text(message, "trackName"),
                    text(message, "artistName"));
            case "error" -> new ControlEvent.PlayerError(
                    orDefault(text(message, "code"), "?"),
                    orDefault(text(message, "message"), "Unknown internal player error"));
            case "htmlLoaded", "contentLoaded" -> new ControlEvent.ContentLoaded();
            case "tokenUpdated", "credentialAck" -> new ControlEvent.CredentialAck();
            case "connectResult" -> new ControlEvent.ConnectResult(isConnected(message));
            default -> {
                log.info("Unhandled event type: {}", type);
                yield new ControlEvent.Unknown(raw);
            }
        };
    }

    private static boolean isConnected(JsonNode message) {
        JsonNode ok = message.get("ok");
        if (ok != null && ok.isBoolean()) {
            return ok.booleanValue();
        }
        return "connected".equals(text(message, "message"));
    }

    /** Textual value of the given field, or {@code null} if it is missing, null or not a scalar. */
    private static String text(JsonNode message, String field) {
        JsonNode value = message.get(field);
        return (value == null || !value.isValueNode() || value.isNull()) ? null : value.asText();
    }

    private static String orDefault(String value, String fallback) {
        return (value == null) ? fallback : value;
    }
}
