package com.example.jejutrip.service;

import com.example.jejutrip.exception.ExternalDependency;
import com.example.jejutrip.exception.ExternalServiceException;
import com.example.jejutrip.model.RouteSegment;
import com.example.jejutrip.model.SpotLocation;
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
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Google Directions 로 확정 경로의 구간별 길 안내 생성.
 * 경유지 수 제한 때문에 긴 경로는 여러 요청으로 나누고, 인접 요청은 경계 지점을 공유한다.
 */
public class GoogleDirectionsClient implements RouteOracle {

    private static final Logger log = LoggerFactory.getLogger(GoogleDirectionsClient.class);
    static final int MAX_WAYPOINTS_PER_REQUEST = 23;

    private final OkHttpClient http;
    private final HttpUrl baseUrl;
    private final String apiKey;
    private final RetryPolicy retryPolicy;
    private final ObjectMapper om = new ObjectMapper();

    public GoogleDirectionsClient(OkHttpClient http, String baseUrl, String apiKey, RetryPolicy retryPolicy) {
        this.http = http;
        this.baseUrl = HttpUrl.get(baseUrl);
        this.apiKey = apiKey;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public List<RouteSegment> stitchRoute(List<SpotLocation> waypoints) {
        if (waypoints == null || waypoints.size() < 2) return List.of();

        List<RouteSegment> all = new ArrayList<>();
        for (int i = 0; i < waypoints.size() - 1; i += MAX_WAYPOINTS_PER_REQUEST) {
            List<SpotLocation> chunk = waypoints.subList(i,
                    Math.min(waypoints.size(), i + MAX_WAYPOINTS_PER_REQUEST + 1));
            HttpUrl url = buildUrl(chunk);
            all.addAll(retryPolicy.execute(ExternalDependency.ROUTE_ORACLE, () -> fetch(url, chunk)));
        }
        log.info("[directions] {} waypoint(s) → {} segment(s)", waypoints.size(), all.size());
        return all;
    }

    HttpUrl buildUrl(List<SpotLocation> chunk) {
        HttpUrl.Builder b = baseUrl.newBuilder()
                .addPathSegments("directions/json")
                .addQueryParameter("origin", GoogleDistanceMatrixClient.latLng(chunk.get(0)))
                .addQueryParameter("destination", GoogleDistanceMatrixClient.latLng(chunk.get(chunk.size() - 1)));
        if (chunk.size() > 2) {
            b.addQueryParameter("waypoints", chunk.subList(1, chunk.size() - 1).stream()
                    .map(GoogleDistanceMatrixClient::latLng)
                    .collect(Collectors.joining("|")));
        }
        return b.addQueryParameter("mode", "driving")
                .addQueryParameter("language", "ko")
                .addQueryParameter("key", apiKey)
                .build();
    }

    private List<RouteSegment> fetch(HttpUrl url, List<SpotLocation> chunk) throws IOException {
        Request request = new Request.Builder().url(url).get().build();
        try (Response resp = http.newCall(request).execute()) {
            ResponseBody rb = resp.body();
            String text = (rb != null) ? rb.string() : "";
            if (!resp.isSuccessful()) {
                throw new IOException("Directions HTTP " + resp.code());
            }
            JsonNode root = om.readTree(text);
            String status = root.path("status").asText("");
            if (!"OK".equals(status)) {
                throw new ExternalServiceException(ExternalDependency.ROUTE_ORACLE,
                        "Directions status " + status + " " + root.path("error_message").asText(""));
            }
            JsonNode route = root.path("routes").path(0);
            JsonNode legs = route.path("legs");
            if (!legs.isArray() || legs.size() != chunk.size() - 1) {
                throw new ExternalServiceException(ExternalDependency.ROUTE_ORACLE,
                        "Directions returned " + legs.size() + " leg(s) for " + chunk.size() + " waypoint(s)");
            }
            String polyline = route.path("overview_polyline").path("points").asText(null);

            List<RouteSegment> segments = new ArrayList<>();
            for (int i = 0; i < legs.size(); i++) {
                JsonNode leg = legs.get(i);
                List<RouteSegment.RouteStep> steps = new ArrayList<>();
                for (JsonNode step : leg.path("steps")) {
                    steps.add(new RouteSegment.RouteStep(
                            stripHtml(step.path("html_instructions").asText("")),
                            step.path("distance").path("value").asInt(),
                            step.path("duration").path("value").asInt()));
                }
                segments.add(new RouteSegment(chunk.get(i), chunk.get(i + 1),
                        (int) Math.ceil(leg.path("duration").path("value").asDouble() / 60.0),
                        Math.round(leg.path("distance").path("value").asDouble() / 10.0) / 100.0,
                        List.copyOf(steps), polyline));
            }
            return segments;
        }
    }

    static String stripHtml(String html) {
        return html.replaceAll("<[^>]*>", "");
    }
}
