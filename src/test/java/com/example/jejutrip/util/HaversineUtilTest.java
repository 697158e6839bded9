package com.example.jejutrip.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class HaversineUtilTest {

    @Test
    void distanceKm_samePointIsZero() {
        assertThat(HaversineUtil.distanceKm(33.5066, 126.4931, 33.5066, 126.4931)).isZero();
    }

    @Test
    void distanceKm_jejuAirportToSeogwipo() {
        double d = HaversineUtil.distanceKm(33.5066, 126.4931, 33.2541, 126.5601);

        assertThat(d).isBetween(28.0, 30.0);
        assertThat(HaversineUtil.distanceKm(33.2541, 126.5601, 33.5066, 126.4931)).isCloseTo(d, within(1e-9));
    }

    @Test
    void distanceKm_oneDegreeOfLatitude() {
        assertThat(HaversineUtil.distanceKm(33.0, 126.5, 34.0, 126.5)).isCloseTo(111.19, within(0.01));
    }

    @Test
    void pointToSegmentKm_zeroLengthSegmentUsesEndpoint() {
        double expected = HaversineUtil.distanceKm(33.40, 126.30, 33.5066, 126.4931);

        double d = HaversineUtil.pointToSegmentKm(33.40, 126.30, 33.5066, 126.4931, 33.5066, 126.4931);

        assertThat(d).isCloseTo(expected, within(1e-9));
    }

    @Test
    void pointToSegmentKm_pointBeyondEndIsClampedToEndpoint() {
        // 서귀포 남쪽 바다, 선분 연장선 위
        double expected = HaversineUtil.distanceKm(33.10, 126.60, 33.2541, 126.5601);

        double d = HaversineUtil.pointToSegmentKm(33.10, 126.60, 33.5066, 126.4931, 33.2541, 126.5601);

        assertThat(d).isCloseTo(expected, within(1e-9));
    }

    @Test
    void pointToSegmentKm_pointOnSegmentIsZero() {
        double lat = (33.5066 + 33.2541) / 2;
        double lng = (126.4931 + 126.5601) / 2;

        assertThat(HaversineUtil.pointToSegmentKm(lat, lng, 33.5066, 126.4931, 33.2541, 126.5601))
                .isCloseTo(0.0, within(1e-6));
    }

    @Test
    void pointToSegmentKm_neverExceedsFartherEndpoint() {
        double aLat = 33.5066, aLng = 126.4931, bLat = 33.2541, bLng = 126.5601;
        for (double lat = 33.0; lat <= 33.8; lat += 0.05) {
            for (double lng = 126.1; lng <= 127.0; lng += 0.05) {
                double seg = HaversineUtil.pointToSegmentKm(lat, lng, aLat, aLng, bLat, bLng);
                double bound = Math.max(HaversineUtil.distanceKm(lat, lng, aLat, aLng),
                        HaversineUtil.distanceKm(lat, lng, bLat, bLng));
                assertThat(seg).isLessThanOrEqualTo(bound + 1e-9);
            }
        }
    }
}
