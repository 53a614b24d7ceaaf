package com.example.organizationservice.filter;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CoordinateFilterTest {

    @Test
    void parsesTwoCorners() {
        CoordinateFilter filter = CoordinateFilter.parse("55.759961,37.637420;55.756001,37.647054");

        assertThat(filter.getMin().getLatitude()).isEqualTo(55.759961);
        assertThat(filter.getMin().getLongitude()).isEqualTo(37.637420);
        assertThat(filter.getMax().getLatitude()).isEqualTo(55.756001);
        assertThat(filter.getMax().getLongitude()).isEqualTo(37.647054);
    }

    @Test
    void toleratesWhitespaceAroundNumbers() {
        CoordinateFilter filter = CoordinateFilter.parse(" 10 , 20 ; 30 , 40 ");

        assertThat(filter.getMax().getLongitude()).isEqualTo(40);
    }

    @Test
    void rejectsMalformedBox() {
        assertThatThrownBy(() -> CoordinateFilter.parse("10,20")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CoordinateFilter.parse("10;20")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CoordinateFilter.parse("a,b;c,d")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CoordinateFilter.parse("1,2;3,4;5,6")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsCornerOutOfRange() {
        assertThatThrownBy(() -> CoordinateFilter.parse("0,0;91,0"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Latitude");
    }
}
