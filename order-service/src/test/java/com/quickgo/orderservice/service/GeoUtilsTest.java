package com.quickgo.orderservice.service;

import com.quickgo.orderservice.model.GeoPoint;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class GeoUtilsTest {

    @Test
    void samePointIsZero() {
        GeoPoint point = GeoPoint.of(41.0, 29.0);
        assertThat(GeoUtils.distanceKm(point, point)).isEqualTo(0.0);
    }

    @Test
    void oneDegreeOfLatitudeIsAbout111Km() {
        assertThat(GeoUtils.distanceKm(0.0, 0.0, 1.0, 0.0)).isCloseTo(111.19, within(0.05));
    }

    @Test
    void istanbulToAnkaraIsAbout350Km() {
        double km = GeoUtils.distanceKm(41.0082, 28.9784, 39.9334, 32.8597);
        assertThat(km).isCloseTo(350.0, within(5.0));
    }
}
