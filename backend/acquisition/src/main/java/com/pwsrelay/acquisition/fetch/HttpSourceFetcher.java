package com.pwsrelay.acquisition.fetch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pwsrelay.acquisition.config.AcquisitionConfig;
import com.pwsrelay.acquisition.coordinator.LocationState;
import com.pwsrelay.acquisition.error.ApiErrorException;
import com.pwsrelay.acquisition.error.FetchTimeoutException;
import com.pwsrelay.acquisition.error.HttpStatusException;
import com.pwsrelay.acquisition.error.MalformedResponseException;
import com.pwsrelay.acquisition.error.NoObservationsException;
import com.pwsrelay.acquisition.field.FieldSchema;
import com.pwsrelay.acquisition.request.RequestBuilder;
import com.pwsrelay.acquisition.request.RequestKind;
import com.pwsrelay.core.model.Coordinates;
import com.pwsrelay.core.model.ObservationDocument;
import com.pwsrelay.core.model.SourceConfig;
import com.pwsrelay.core.util.JsonUtils;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.zip.GZIPInputStream;

public final class HttpSourceFetcher implements SourceFetcher {
    private static final Logger LOGGER = Logger.getLogger(HttpSourceFetcher.class.getName());

    // Upstream rejects the default Java client agent.
    public static final String USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome/111.0.0.0 Safari/537.36";
    private static final int BODY_SNIPPET_LENGTH = 200;

    private final HttpClient httpClient;
    private final AcquisitionConfig config;
    private final RequestBuilder requestBuilder;
    private final LocationState location;

    public HttpSourceFetcher(HttpClient httpClient, AcquisitionConfig config, LocationState location) {
        this.httpClient = httpClient;
        this.config = config;
        this.requestBuilder = new RequestBuilder(config);
        this.location = location;
    }

    @Override
    public ObservationDocument fetch(SourceConfig source) {
        String currentUrl = requestBuilder.buildUrl(RequestKind.CURRENT, source.id(), null);
        ObjectNode current = getJson(currentUrl);
        checkErrors(currentUrl, current);
        JsonNode observations = current.path(ObservationDocument.OBSERVATIONS);
        if (!observations.isArray() || observations.isEmpty()) {
            throw new NoObservationsException("No observations for station " + source.id() + "; station may be offline");
        }
        learnCoordinates(source, observations.get(0));

        if (!config.forecastEnabled()) {
            return ObservationDocument.merge(current, null);
        }

        Coordinates coordinates = location.current().orElseThrow(() -> new MalformedResponseException(
                "Station " + source.id() + " reported no coordinates and none are configured"));
        String forecastUrl = requestBuilder.buildUrl(RequestKind.FORECAST, source.id(), coordinates);
        ObjectNode forecast = getJson(forecastUrl);
        checkErrors(forecastUrl, forecast);
        JsonNode daypart = forecast.path(ObservationDocument.DAYPART);
        if (!daypart.isArray() || daypart.isEmpty()) {
            LOGGER.warning("Station " + source.id() + ": no forecast daypart data available");
        }
        return ObservationDocument.merge(current, forecast);
    }

    private void learnCoordinates(SourceConfig source, JsonNode observation) {
        if (location.current().isPresent()) {
            return;
        }
        Optional<Coordinates> reported = coordinatesOf(observation);
        if (reported.isPresent() && location.learn(reported.get())) {
            LOGGER.info("Learned coordinates " + reported.get() + " from station " + source.id());
        }
    }

    private static Optional<Coordinates> coordinatesOf(JsonNode observation) {
        JsonNode lat = observation.path(FieldSchema.LATITUDE);
        JsonNode lon = observation.path(FieldSchema.LONGITUDE);
        if (!lat.isNumber() || !lon.isNumber()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new Coordinates(lat.asDouble(), lon.asDouble()));
        } catch (IllegalArgumentException e) {
            LOGGER.log(Level.WARNING, "Ignoring invalid coordinates in observation", e);
            return Optional.empty();
        }
    }

    private ObjectNode getJson(String url) {
        HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                .GET()
                .timeout(config.requestTimeout())
                .header("Accept", "application/json")
                .header("Accept-Encoding", "gzip")
                .header("User-Agent", USER_AGENT)
                .build();
        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (HttpTimeoutException e) {
            throw new FetchTimeoutException("Request timed out after " + config.requestTimeout() + " for " + redact(url), e);
        } catch (IOException e) {
            throw new HttpStatusException("Request failed for " + redact(url) + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchTimeoutException("Interrupted while requesting " + redact(url), e);
        }

        if (response.statusCode() != 200) {
            throw new HttpStatusException(response.statusCode(), "HTTP " + response.statusCode() + ": " + errorSnippet(response, url));
        }
        String body = decodeBody(response, url);
        if (body.isBlank()) {
            throw new MalformedResponseException("Empty response from " + redact(url));
        }
        JsonNode root;
        try {
            root = JsonUtils.objectMapper().readTree(body);
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException("Unparseable response from " + redact(url), e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedResponseException("Expected a JSON object from " + redact(url));
        }
        return (ObjectNode) root;
    }

    private static String decodeBody(HttpResponse<byte[]> response, String url) {
        byte[] raw = response.body() == null ? new byte[0] : response.body();
        boolean gzip = response.headers().firstValue("Content-Encoding")
                .map(value -> value.equalsIgnoreCase("gzip"))
                .orElse(false);
        if (!gzip || raw.length == 0) {
            return new String(raw, StandardCharsets.UTF_8);
        }
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(raw))) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new MalformedResponseException("Corrupt gzip body from " + redact(url), e);
        }
    }

    private static void checkErrors(String url, JsonNode payload) {
        JsonNode errors = payload.path("errors");
        if (!errors.isArray() || errors.isEmpty()) {
            return;
        }
        List<String> messages = new ArrayList<>();
        for (JsonNode error : errors) {
            String message = error.path("message").asText("");
            if (message.isBlank()) {
                message = error.path("error").path("message").asText("");
            }
            messages.add(message.isBlank() ? error.toString() : message);
        }
        throw new ApiErrorException(redact(url), messages);
    }

    static String redact(String url) {
        return url.replaceAll("apiKey=[^&]*", "apiKey=***");
    }

    private static String errorSnippet(HttpResponse<byte[]> response, String url) {
        try {
            return snippet(decodeBody(response, url));
        } catch (MalformedResponseException e) {
            LOGGER.fine("Could not decode error body from " + redact(url) + ": " + e.getMessage());
            return "<undecodable body>";
        }
    }

    private static String snippet(String body) {
        return body.length() <= BODY_SNIPPET_LENGTH ? body : body.substring(0, BODY_SNIPPET_LENGTH) + "...";
    }
}
