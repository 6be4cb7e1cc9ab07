package com.volovo.tracksync.fetch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.volovo.tracksync.model.TrackPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.*;

class PointParserTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final PointParser parser = new PointParser();

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }

    @Test
    @DisplayName("Array rows map positionally to [dir, dst, lat, lon, speed, st, tm, width]")
    void arrayEncoding() throws Exception {
        JsonNode coords = json("[[90, 0.12, 52.036242, 37.887744, 41.5, \"move\", \"2026-02-01 06:30:15\", \"3\"]]");

        PointParser.Result result = parser.parse(182, coords);

        assertThat(result.points()).singleElement().satisfies(p -> {
            assertThat(p.getDeviceId()).isEqualTo(182);
            assertThat(p.getTimestamp()).isEqualTo(LocalDateTime.of(2026, 2, 1, 6, 30, 15));
            assertThat(p.getLatitude()).isEqualTo(52.036242);
            assertThat(p.getLongitude()).isEqualTo(37.887744);
            assertThat(p.getDirection()).isEqualTo(90.0);
            assertThat(p.getOdometerDelta()).isEqualTo(0.12);
            assertThat(p.getSpeed()).isEqualTo(41.5);
            assertThat(p.getStatus()).isEqualTo("move");
            assertThat(p.getWidth()).isEqualTo("3");
            assertThat(p.getSequenceIndex()).isZero();
        });
        assertThat(result.skipped()).isZero();
    }

    @Test
    @DisplayName("Object rows use named fields; numbers may be strings with a decimal comma")
    void objectEncoding() throws Exception {
        JsonNode coords = json("[{\"lat\": \"52,036242\", \"lon\": \"37,887744\", \"tm\": \"2026-02-01T06:30:15\","
                + " \"speed\": 12, \"dir\": null}]");

        TrackPoint p = parser.parse(716, coords).points().get(0);

        assertThat(p.getLatitude()).isEqualTo(52.036242);
        assertThat(p.getLongitude()).isEqualTo(37.887744);
        assertThat(p.getSpeed()).isEqualTo(12.0);
        assertThat(p.getDirection()).isNull();
        assertThat(p.getTimestamp()).isEqualTo(LocalDateTime.of(2026, 2, 1, 6, 30, 15));
    }

    @Test
    @DisplayName("Object rows fall back to dt or time when tm is absent")
    void timestampAliases() throws Exception {
        JsonNode coords = json("[{\"lat\": 52.0, \"lon\": 37.0, \"dt\": \"2026-02-01 01:00:00\"},"
                + " {\"lat\": 52.0, \"lon\": 37.0, \"time\": \"2026-02-01 02:00:00\"}]");

        assertThat(parser.parse(182, coords).points())
                .extracting(TrackPoint::getTimestamp)
                .containsExactly(LocalDateTime.of(2026, 2, 1, 1, 0), LocalDateTime.of(2026, 2, 1, 2, 0));
    }

    @Test
    @DisplayName("Rows lacking coordinates or a parseable time are dropped, odd shapes counted as malformed")
    void dropsAndMalformed() throws Exception {
        JsonNode coords = json("["
                + "[0, 0, null, 37.9, 0, \"\", \"2026-02-01 00:00:00\", \"\"],"   // no lat
                + "{\"lat\": 52.0, \"lon\": 37.9, \"tm\": \"not a time\"},"        // bad tm
                + "[0, 0, 52.0],"                                                  // short array, no tm
                + "\"garbage\","                                                   // malformed
                + "42,"                                                            // malformed
                + "{\"lat\": 52.0, \"lon\": 37.9, \"tm\": \"2026-02-01 00:00:05\"}"
                + "]");

        PointParser.Result result = parser.parse(182, coords);

        assertThat(result.points()).hasSize(1);
        assertThat(result.points().get(0).getSequenceIndex()).isEqualTo(5);
        assertThat(result.dropped()).isEqualTo(3);
        assertThat(result.malformed()).isEqualTo(2);
        assertThat(result.skipped()).isEqualTo(5);
    }

    @Test
    @DisplayName("Missing or non-array coords give an empty result")
    void noCoords() throws Exception {
        assertThat(parser.parse(182, null).points()).isEmpty();
        assertThat(parser.parse(182, json("{\"a\": 1}")).points()).isEmpty();
    }
}
