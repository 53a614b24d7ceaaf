package com.example.organizationservice.entity;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CoordinateTest {

    @Test
    void acceptsBoundaryValues() {
        Coordinate corner = new Coordinate(-90, 180);

        assertThat(corner.getLatitude()).isEqualTo(-90);
        assertThat(corner.getLongitude()).isEqualTo(180);
    }

    @Test
    void rejectsLatitudeOutOfRange() {
        assertThatThrownBy(() -> new Coordinate(91, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Latitude");
    }

    @Test
    void rejectsLongitudeOutOfRange() {
        assertThatThrownBy(() -> new Coordinate(0, -181))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Longitude");
    }

    @Test
    void rejectsNaN() {
        assertThatThrownBy(() -> new Coordinate(Double.NaN, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
