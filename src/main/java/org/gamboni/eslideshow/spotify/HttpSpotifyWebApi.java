package org.gamboni.eslideshow.spotify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.gamboni.eslideshow.data.RemoteDevice;
import org.gamboni.eslideshow.tech.DiagnosticLog;
import org.gamboni.eslideshow.tech.Mapping;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.util.stream.Collectors.joining;

/** {@link SpotifyWebApi} over HTTP. */
public class HttpSpotifyWebApi implements SpotifyWebApi {
    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private final URI apiBaseUrl;
    private final URI devicesUrl;
    private final TokenProvider tokens;
    private final Mapping mapping;
    private final HttpClient http;
    private final DiagnosticLog.Component log;

    /**
     * @param apiBaseUrl Spotify Web API root, normally {@code https://api.spotify.com/v1}
     * @param devicesUrl where to list devices: either Spotify's own endpoint or the Electric Slideshow server proxy
     */
    public HttpSpotifyWebApi(URI apiBaseUrl, URI devicesUrl, TokenProvider tokens, Mapping mapping,
                             DiagnosticLog diagnostics) {
        this(apiBaseUrl, devicesUrl, tokens, mapping,
                HttpClient.newBuilder().connectTimeout(TIMEOUT).build(),
                diagnostics);
    }

    HttpSpotifyWebApi(URI apiBaseUrl, URI devicesUrl, TokenProvider tokens, Mapping mapping, HttpClient http,
                      DiagnosticLog diagnostics) {
        this.apiBaseUrl = apiBaseUrl;
        this.devicesUrl = devicesUrl;
        this.tokens = tokens;
        this.mapping = mapping;
        this.http = http;
        this.log = diagnostics.forComponent(HttpSpotifyWebApi.class);
    }

    @Override
    public List<RemoteDevice> listDevices() throws IOException, CredentialException {
        log.debug("Fetching available devices from {}", devicesUrl);
        String body = send(request(devicesUrl).GET());

        JsonNode root = mapping.tryReadTree(body)
                .orElseThrow(() -> new IOException("Unreadable devices response: " + body));
        // the Electric Slideshow server wraps Spotify's response as {"success":..,"data":{"devices":[..]}}
        JsonNode devices = root.has("data") ? root.path("data").path("devices") : root.path("devices");
        if (!devices.isArray()) {
            throw new IOException("No device list in response: " + body);
        }
        ImmutableList.Builder<RemoteDevice> result = ImmutableList.builder();
        for (JsonNode device : devices) {
            result.add(mapping.get().treeToValue(device, RemoteDevice.class));
        }
        return result.build();
    }

    @Override
    public void startPlayback(String trackUri, String deviceId, Long startPositionMs)
            throws IOException, CredentialException {
        ObjectNode body = mapping.newObject();
        body.putArray("uris").add(trackUri);
        if (startPositionMs != null) {
            body.put("position_ms", startPositionMs);
        }
        send(request(playerUrl("play", deviceParam(deviceId)))
                .header("Content-Type", "application/json")
                .PUT(HttpRequest.BodyPublishers.ofString(mapping.writeValueAsString(body))));
    }

    @Override
    public void pause(String deviceId) throws IOException, CredentialException {
        put("pause", deviceParam(deviceId));
    }

    @Override
    public void resume(String deviceId) throws IOException, CredentialException {
        put("play", deviceParam(deviceId));
    }

    @Override
    public void seek(long positionMs, String deviceId) throws IOException, CredentialException {
        put("seek", params("position_ms", String.valueOf(positionMs), deviceId));
    }

    @Override
    public void setVolume(int percent, String deviceId) throws IOException, CredentialException {
        int clamped = Math.max(0, Math.min(100, percent));
        put("volume", params("volume_percent", String.valueOf(clamped), deviceId));
    }

    @Override
    public void skipNext(String deviceId) throws IOException, CredentialException {
        post("next", deviceParam(deviceId));
    }

    @Override
    public void skipPrevious(String deviceId) throws IOException, CredentialException {
        post("previous", deviceParam(deviceId));
    }

    @Override
    public void setShuffle(boolean on) throws IOException, CredentialException {
        put("shuffle", ImmutableMap.of("state", String.valueOf(on)));
    }

    @Override
    public void setRepeat(RepeatMode mode) throws IOException, CredentialException {
        put("repeat", ImmutableMap.of("state", mode.apiValue()));
    }

    private void put(String action, Map<String, String> params) throws IOException, CredentialException {
        send(request(playerUrl(action, params)).PUT(HttpRequest.BodyPublishers.noBody()));
    }

    private void post(String action, Map<String, String> params) throws IOException, CredentialException {
        send(request(playerUrl(action, params)).POST(HttpRequest.BodyPublishers.noBody()));
    }

    private static Map<String, String> deviceParam(String deviceId) {
        return (deviceId == null) ? ImmutableMap.of() : ImmutableMap.of("device_id", deviceId);
    }

    private static Map<String, String> params(String name, String value, String deviceId) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put(name, value);
        params.putAll(deviceParam(deviceId));
        return params;
    }

    private URI playerUrl(String action, Map<String, String> params) {
        String base = apiBaseUrl.toString().replaceAll("/+$", "");
        String query = params.entrySet().stream()
                .map(e -> e.getKey() + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(joining("&"));
        return URI.create(base + "/me/player/" + action + (query.isEmpty() ? "" : "?" + query));
    }

    private HttpRequest.Builder request(URI url) throws CredentialException {
        return HttpRequest.newBuilder(url)
                .timeout(TIMEOUT)
                .header("Authorization", "Bearer " + tokens.getValidAccessCredential());
    }

    private String send(HttpRequest.Builder builder) throws IOException {
        HttpRequest request = builder.build();
        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted during " + request.method() + " " + request.uri().getPath(), e);
        }
        int status = response.statusCode();
        log.debug("{} {} -> {}", request.method(), request.uri(), status);
        if (status / 100 != 2) {
            throw error(status, response.body());
        }
        return response.body();
    }

    private RemoteApiException error(int status, String body) {
        Optional<JsonNode> parsed = mapping.tryReadTree(body);
        // Spotify uses {"error":{"status":..,"message":..,"reason":..}}; our server proxy leaves out the wrapper
        Optional<JsonNode> payload = parsed.map(node -> node.has("error") && node.get("error").isObject()
                ? node.get("error")
                : node);
        Optional<String> message = payload.map(p -> p.path("message")).filter(JsonNode::isTextual).map(JsonNode::asText);
        Optional<String> reason = payload.map(p -> p.path("reason")).filter(JsonNode::isTextual).map(JsonNode::asText);
        String text = message.orElse((body == null || body.isBlank()) ? "(no body)" : body);
        log.warn("Request failed with {}: {}", status, text);
        return new RemoteApiException(status, text, reason);
    }
}
