package com.pwsrelay.acquisition.request;

import com.pwsrelay.acquisition.config.AcquisitionConfig;
import com.pwsrelay.core.model.Coordinates;
import com.pwsrelay.core.model.PrecisionMode;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Builds the upstream URLs. Current conditions are station-scoped; the forecast is geocoded
 * and ignores the station id.
 */
public final class RequestBuilder {
    private final AcquisitionConfig config;

    public RequestBuilder(AcquisitionConfig config) {
        this.config = Objects.requireNonNull(config, "config is required");
    }

    public String buildUrl(RequestKind kind, String sourceId, Coordinates coordinates) {
        Objects.requireNonNull(kind, "kind is required");
        StringBuilder url = new StringBuilder();
        switch (kind) {
            case CURRENT -> {
                Objects.requireNonNull(sourceId, "sourceId is required");
                url.append(config.endpoints().currentBaseUrl())
                        .append("?stationId=").append(encode(sourceId));
                if (config.precision() != PrecisionMode.NONE) {
                    url.append("&numericPrecision=").append(encode(config.precision().apiValue()));
                }
            }
            case FORECAST -> {
                if (coordinates == null) {
                    throw new IllegalStateException("Forecast request needs coordinates");
                }
                url.append(config.endpoints().forecastBaseUrl())
                        .append("?geocode=")
                        .append(encode(Double.toString(coordinates.latitude())))
                        .append(',')
                        .append(encode(Double.toString(coordinates.longitude())))
                        .append("&language=").append(encode(config.language()));
            }
            default -> throw new IllegalArgumentException("Unsupported request kind: " + kind);
        }
        url.append("&format=json")
                .append("&apiKey=").append(encode(config.apiKey()))
                .append("&units=").append(encode(config.unitSystem().apiCode()));
        return url.toString();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
