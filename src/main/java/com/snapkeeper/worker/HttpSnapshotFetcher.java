package com.snapkeeper.worker;

import com.snapkeeper.core.model.CameraSettings;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;

/**
 * Fetches snapshots over HTTP, using basic auth when the camera has credentials.
 */
public class HttpSnapshotFetcher implements SnapshotFetcher {

    private final HttpClient httpClient;
    private final Duration readTimeout;

    public HttpSnapshotFetcher(FetcherProperties properties) {
        this(HttpClient.newBuilder()
                .connectTimeout(properties.getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(), properties.getReadTimeout());
    }

    HttpSnapshotFetcher(HttpClient httpClient, Duration readTimeout) {
        this.httpClient = httpClient;
        this.readTimeout = readTimeout;
    }

    @Override
    public byte[] fetch(CameraSettings settings) throws SnapshotException {
        HttpRequest request = buildRequest(settings);
        try {
            HttpResponse<byte[]> response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
            if (response.statusCode() != 200) {
                throw new SnapshotException("Camera responded with HTTP " + response.statusCode());
            }
            byte[] body = response.body();
            if (body == null || body.length == 0) {
                throw new SnapshotException("Camera returned an empty body");
            }
            return body;
        } catch (IOException e) {
            throw new SnapshotException("Snapshot request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SnapshotException("Snapshot request interrupted", e);
        }
    }

    HttpRequest buildRequest(CameraSettings settings) {
        var builder = HttpRequest.newBuilder(URI.create(settings.url()))
                .timeout(readTimeout)
                .GET();
        if (settings.auth() != null && !settings.auth().isEmpty()) {
            String token = Base64.getEncoder().encodeToString(settings.auth().getBytes(StandardCharsets.UTF_8));
            builder.header("Authorization", "Basic " + token);
        }
        return builder.build();
    }
}
