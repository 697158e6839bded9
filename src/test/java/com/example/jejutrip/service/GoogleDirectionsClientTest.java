package com.example.jejutrip.service;

import com.example.jejutrip.exception.ExternalServiceException;
import com.example.jejutrip.model.RouteSegment;
import com.example.jejutrip.model.SpotLocation;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GoogleDirectionsClientTest {

    private MockWebServer server;
    private GoogleDirectionsClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        client = new GoogleDirectionsClient(new OkHttpClient(), server.url("/maps/api").toString(),
                "test-key", RetryPolicy.once());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private static List<SpotLocation> waypoints(int n) {
        List<SpotLocation> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            out.add(SpotLocation.of("w" + i, 33.5 - i * 0.005, 126.5 + i * 0.001));
        }
        return out;
    }

    private static String route(int legs) {
        StringJoiner joined = new StringJoiner(",");
        for (int i = 0; i < legs; i++) {
            joined.add("{\"duration\":{\"value\":900},\"distance\":{\"value\":7000},\"steps\":["
                    + "{\"html_instructions\":\"<b>일주동로</b> 방면으로 우회전\","
                    + "\"distance\":{\"value\":350},\"duration\":{\"value\":40}}]}");
        }
        return "{\"status\":\"OK\",\"routes\":[{\"overview_polyline\":{\"points\":\"abc\"},\"legs\":["
                + joined + "]}]}";
    }

    @Test
    void mapsLegsToSegments() throws InterruptedException {
        // Given
        server.enqueue(new MockResponse().setBody(route(2)));
        List<SpotLocation> points = waypoints(3);

        // When
        List<RouteSegment> segments = client.stitchRoute(points);

        // Then
        assertThat(segments).hasSize(2);
        RouteSegment first = segments.get(0);
        assertThat(first.origin()).isEqualTo(points.get(0));
        assertThat(first.destination()).isEqualTo(points.get(1));
        assertThat(first.durationMinutes()).isEqualTo(15);
        assertThat(first.distanceKm()).isEqualTo(7.0);
        assertThat(first.polyline()).isEqualTo("abc");
        assertThat(first.steps()).singleElement()
                .satisfies(step -> {
                    assertThat(step.instruction()).isEqualTo("일주동로 방면으로 우회전");
                    assertThat(step.distanceMeters()).isEqualTo(350);
                });

        HttpUrl url = server.takeRequest().getRequestUrl();
        assertThat(url.encodedPath()).isEqualTo("/maps/api/directions/json");
        assertThat(url.queryParameter("waypoints")).isEqualTo(GoogleDistanceMatrixClient.latLng(points.get(1)));
    }

    @Test
    void longRoutesAreChunkedWithSharedBoundaries() throws InterruptedException {
        // 30개 지점 → [0..23] + [23..29]
        server.enqueue(new MockResponse().setBody(route(23)));
        server.enqueue(new MockResponse().setBody(route(6)));
        List<SpotLocation> points = waypoints(30);

        List<RouteSegment> segments = client.stitchRoute(points);

        assertThat(segments).hasSize(29);
        for (int i = 0; i < segments.size(); i++) {
            assertThat(segments.get(i).origin()).isEqualTo(points.get(i));
            assertThat(segments.get(i).destination()).isEqualTo(points.get(i + 1));
        }
        server.takeRequest();
        HttpUrl second = server.takeRequest().getRequestUrl();
        assertThat(second.queryParameter("origin")).isEqualTo(GoogleDistanceMatrixClient.latLng(points.get(23)));
        assertThat(second.queryParameter("destination")).isEqualTo(GoogleDistanceMatrixClient.latLng(points.get(29)));
    }

    @Test
    void fewerThanTwoWaypointsNeedsNoCall() {
        assertThat(client.stitchRoute(waypoints(1))).isEmpty();
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void legCountMismatchIsRejected() {
        server.enqueue(new MockResponse().setBody(route(1)));

        assertThatThrownBy(() -> client.stitchRoute(waypoints(3)))
                .isInstanceOf(ExternalServiceException.class)
                .hasMessageContaining("1 leg(s)");
    }

    @Test
    void zeroResultsIsAnError() {
        server.enqueue(new MockResponse().setBody("{\"status\":\"ZERO_RESULTS\",\"routes\":[]}"));

        assertThatThrownBy(() -> client.stitchRoute(waypoints(2)))
                .isInstanceOf(ExternalServiceException.class)
                .hasMessageContaining("ZERO_RESULTS");
    }
}
