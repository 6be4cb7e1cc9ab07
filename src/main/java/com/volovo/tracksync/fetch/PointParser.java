package com.volovo.tracksync.fetch;

import com.fasterxml.jackson.databind.JsonNode;
import com.volovo.tracksync.exception.UpstreamFormatException;
import com.volovo.tracksync.model.TrackPoint;
import com.volovo.tracksync.util.PortalTimes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns the {@code coords} array of a track response into canonical points.
 *
 * A record comes in one of two encodings:
 *   ARRAY:  {@code [dir, dst, lat, lon, speed, st, tm, width]}
 *   OBJECT: {@code {"dir":..,"dst":..,"lat":..,"lon":..,"speed":..,"st":..,"tm":..,"width":..}}
 *
 * Records without a usable latitude, longitude or timestamp are dropped.
 * Records of any other shape are skipped and counted as malformed.
 */
@Component
@Slf4j
public class PointParser {

    enum Encoding { ARRAY, OBJECT }

    /** Source fields of one record, independent of its encoding */
    record RawFields(JsonNode direction, JsonNode odometerDelta, JsonNode latitude, JsonNode longitude,
                     JsonNode speed, JsonNode status, JsonNode timestamp, JsonNode width) {
    }

    /**
     * @param points    canonical points in response order
     * @param dropped   records lacking latitude, longitude or timestamp
     * @param malformed records of an unknown shape
     */
    public record Result(List<TrackPoint> points, int dropped, int malformed) {

        public int skipped() {
            return dropped + malformed;
        }
    }

    public Result parse(long deviceId, JsonNode coords) {
        List<TrackPoint> points = new ArrayList<>();
        if (coords == null || !coords.isArray()) {
            return new Result(points, 0, 0);
        }

        int dropped = 0;
        int malformed = 0;
        for (int i = 0; i < coords.size(); i++) {
            JsonNode row = coords.get(i);
            try {
                Optional<TrackPoint> point = toPoint(deviceId, i, decode(row));
                if (point.isPresent()) {
                    points.add(point.get());
                } else {
                    dropped++;
                }
            } catch (UpstreamFormatException e) {
                malformed++;
                log.debug("Device {}: record #{} skipped: {}", deviceId, i, e.getMessage());
            }
        }
        return new Result(points, dropped, malformed);
    }

    static Encoding encodingOf(JsonNode row) {
        if (row != null && row.isArray()) {
            return Encoding.ARRAY;
        }
        if (row != null && row.isObject()) {
            return Encoding.OBJECT;
        }
        throw new UpstreamFormatException("Unsupported point encoding: "
                + (row == null ? "null" : row.getNodeType()));
    }

    static RawFields decode(JsonNode row) {
        switch (encodingOf(row)) {
            case ARRAY:
                return new RawFields(row.get(0), row.get(1), row.get(2), row.get(3),
                        row.get(4), row.get(5), row.get(6), row.get(7));
            case OBJECT:
            default:
                JsonNode tm = row.get("tm");
                if (isBlank(tm)) {
                    tm = row.hasNonNull("dt") ? row.get("dt") : row.get("time");
                }
                return new RawFields(row.get("dir"), row.get("dst"), row.get("lat"), row.get("lon"),
                        row.get("speed"), row.get("st"), tm, row.get("width"));
        }
    }

    private static Optional<TrackPoint> toPoint(long deviceId, int index, RawFields raw) {
        Double lat = toDouble(raw.latitude());
        Double lon = toDouble(raw.longitude());
        Optional<LocalDateTime> tm = isBlank(raw.timestamp())
                ? Optional.empty()
                : PortalTimes.tryParse(raw.timestamp().asText());
        if (lat == null || lon == null || tm.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(TrackPoint.builder()
                .deviceId(deviceId)
                .timestamp(tm.get())
                .latitude(lat)
                .longitude(lon)
                .sequenceIndex(index)
                .speed(toDouble(raw.speed()))
                .direction(toDouble(raw.direction()))
                .odometerDelta(toDouble(raw.odometerDelta()))
                .status(toText(raw.status()))
                .width(toText(raw.width()))
                .build());
    }

    /**
     * Numbers arrive as JSON numbers or as strings, sometimes with a decimal comma.
     */
    static Double toDouble(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return finite(node.asDouble());
        }
        String text = node.asText().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return finite(Double.parseDouble(text.replace(',', '.')));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Double finite(double value) {
        return Double.isFinite(value) ? value : null;
    }

    private static String toText(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }

    private static boolean isBlank(JsonNode node) {
        return node == null || node.isNull() || node.asText().isBlank();
    }
}
