package com.example.jejutrip.service;

import com.example.jejutrip.exception.ExternalDependency;
import com.example.jejutrip.exception.ExternalServiceException;
import com.example.jejutrip.model.SpotLocation;
import com.example.jejutrip.model.TravelEstimate;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Google Distance Matrix (렌터카 기준 driving). 목적지는 요청당 25개씩 나눠 보낸다.
 */
public class GoogleDistanceMatrixClient implements TravelTimeOracle {

    private static final Logger log = LoggerFactory.getLogger(GoogleDistanceMatrixClient.class);
    static final int MAX_DESTINATIONS_PER_REQUEST = 25;

    private final OkHttpClient http;
    private final HttpUrl baseUrl;
    private final String apiKey;
    private final ZoneId zoneId;
    private final RetryPolicy retryPolicy;
    private final ObjectMapper om = new ObjectMapper();

    public GoogleDistanceMatrixClient(OkHttpClient http, String baseUrl, String apiKey,
                                      ZoneId zoneId, RetryPolicy retryPolicy) {
        this.http = http;
        this.baseUrl = HttpUrl.get(baseUrl);
        this.apiKey = apiKey;
        this.zoneId = zoneId;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public List<TravelEstimate> estimateTravelTime(SpotLocation origin, List<SpotLocation> destinations,
                                                   LocalDateTime departureTime) {
        List<TravelEstimate> out = new ArrayList<>(destinations.size());
        for (int i = 0; i < destinations.size(); i += MAX_DESTINATIONS_PER_REQUEST) {
            List<SpotLocation> chunk = destinations.subList(i,
                    Math.min(destinations.size(), i + MAX_DESTINATIONS_PER_REQUEST));
            HttpUrl url = buildUrl(origin, chunk, departureTime);
            out.addAll(retryPolicy.execute(ExternalDependency.TRAVEL_TIME_ORACLE, () -> fetch(url, chunk.size())));
        }
        log.debug("[distance-matrix] {} destination(s) from {}", destinations.size(), origin.name());
        return out;
    }

    HttpUrl buildUrl(SpotLocation origin, List<SpotLocation> destinations, LocalDateTime departureTime) {
        HttpUrl.Builder b = baseUrl.newBuilder()
                .addPathSegments("distancematrix/json")
                .addQueryParameter("origins", latLng(origin))
                .addQueryParameter("destinations",
                        destinations.stream().map(GoogleDistanceMatrixClient::latLng).collect(Collectors.joining("|")))
                .addQueryParameter("mode", "driving")
                .addQueryParameter("language", "ko")
                .addQueryParameter("key", apiKey);
        if (departureTime != null) {
            Instant departure = departureTime.atZone(zoneId).toInstant();
            // 과거 시각은 API 가 거부한다
            if (departure.isAfter(Instant.now())) {
                b.addQueryParameter("departure_time", String.valueOf(departure.getEpochSecond()));
            }
        }
        return b.build();
    }

    private List<TravelEstimate> fetch(HttpUrl url, int expected) throws IOException {
        Request request = new Request.Builder().url(url).get().build();
        try (Response resp = http.newCall(request).execute()) {
            ResponseBody rb = resp.body();
            String text = (rb != null) ? rb.string() : "";
            if (!resp.isSuccessful()) {
                throw new IOException("Distance Matrix HTTP " + resp.code());
            }
            JsonNode root = om.readTree(text);
            String status = root.path("status").asText("");
            if (!"OK".equals(status)) {
                throw new ExternalServiceException(ExternalDependency.TRAVEL_TIME_ORACLE,
                        "Distance Matrix status " + status + " " + root.path("error_message").asText(""));
            }
            JsonNode elements = root.path("rows").path(0).path("elements");
            if (!elements.isArray() || elements.size() != expected) {
                throw new ExternalServiceException(ExternalDependency.TRAVEL_TIME_ORACLE,
                        "Distance Matrix returned " + elements.size() + " element(s), expected " + expected);
            }
            List<TravelEstimate> out = new ArrayList<>(expected);
            for (JsonNode el : elements) {
                if ("OK".equals(el.path("status").asText())) {
                    int minutes = (int) Math.ceil(el.path("duration").path("value").asDouble() / 60.0);
                    double km = Math.round(el.path("distance").path("value").asDouble() / 10.0) / 100.0;
                    out.add(new TravelEstimate(minutes, km));
                } else {
                    out.add(TravelEstimate.unreachable());
                }
            }
            return out;
        }
    }

    static String latLng(SpotLocation l) {
        return l.latitude() + "," + l.longitude();
    }
}
