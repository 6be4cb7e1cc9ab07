package com.volovo.tracksync.analysis;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;

class DownsamplerTest {

    private static List<Integer> range(int n) {
        return IntStream.range(0, n).boxed().toList();
    }

    @Test
    @DisplayName("10,000 points with max 4,000 → stride 2, 5,000 points, last point kept")
    void strideTwo() {
        Downsampler.Decimation<Integer> result = Downsampler.decimate(range(10_000), 4000);

        assertThat(result.stride()).isEqualTo(2);
        assertThat(result.sampled()).hasSize(5000);
        assertThat(result.sampled().get(0)).isZero();
        assertThat(result.sampled().get(4999)).isEqualTo(9999);
        assertThat(result.sampled().get(4998)).isEqualTo(9996);
    }

    @Test
    @DisplayName("Series within the limit is returned unchanged with stride 1")
    void withinLimit() {
        List<Integer> points = range(100);

        Downsampler.Decimation<Integer> result = Downsampler.decimate(points, 4000);

        assertThat(result.stride()).isEqualTo(1);
        assertThat(result.sampled()).isSameAs(points);
    }

    @Test
    @DisplayName("When the stride already lands on the last point nothing is replaced")
    void strideHitsLastPoint() {
        assertThat(Downsampler.decimate(range(10), 3).sampled()).containsExactly(0, 3, 6, 9);
    }

    @Test
    @DisplayName("When the stride skips the last point it replaces the last sample")
    void lastPointReplacesSample() {
        Downsampler.Decimation<Integer> result = Downsampler.decimate(range(11), 3);

        assertThat(result.stride()).isEqualTo(3);
        assertThat(result.sampled()).containsExactly(0, 3, 6, 10);
    }

    @Test
    @DisplayName("A single allowed point still keeps both endpoints")
    void maxOne() {
        assertThat(Downsampler.decimate(range(5), 1).sampled()).containsExactly(0, 4);
    }

    @Test
    @DisplayName("Non-positive maximum is rejected")
    void invalidMax() {
        assertThatThrownBy(() -> Downsampler.decimate(range(5), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
