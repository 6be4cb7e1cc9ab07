package com.volovo.tracksync.config;

import com.volovo.tracksync.model.PointKeyStrategy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * All tunables of the tracking sync, bound from {@code tracksync.*}.
 * Every value can be overridden from the environment
 * (e.g. {@code TRACKSYNC_PORTAL_PASSWORD}).
 */
@Data
@Component
@ConfigurationProperties(prefix = "tracksync")
public class TrackSyncProperties {

    private Portal portal = new Portal();

    private Sync sync = new Sync();

    private Geofence geofence = new Geofence();

    private Analysis analysis = new Analysis();

    /**
     * Legacy tracking portal (ASP.NET WebForms, cookie session).
     */
    @Data
    public static class Portal {

        private String baseUrl = "http://109.195.2.91";

        private String login = "";

        private String password = "";

        /** Value of the TimeZone field posted with the login form */
        private String timeZone = "3";

        private String language = "ru-ru";

        /** Cookies that must all be present after a successful login */
        private List<String> sessionCookies = new ArrayList<>(List.of("ASP.NET_SessionId", ".ASPXAUTH"));

        private String loginPath = "/login.aspx";

        /** Protected page used to probe whether a stored cookie is still accepted */
        private String probePath = "/MileageReportData.aspx";

        private String trackPath = "/api/Api.svc/track";

        private String userAgent = "Mozilla/5.0";

        private Duration httpTimeout = Duration.ofSeconds(60);

        private Path credentialFile = Path.of(System.getProperty("user.home"), ".tracksync", "cookie.txt");

        /** Base URL without a trailing slash */
        public String normalizedBaseUrl() {
            String url = baseUrl == null ? "" : baseUrl.trim();
            while (url.endsWith("/")) {
                url = url.substring(0, url.length() - 1);
            }
            return url;
        }
    }

    @Data
    public static class Sync {

        /** Devices synced when no explicit list is given */
        private List<Long> deviceIds = new ArrayList<>();

        private int chunkHours = 6;

        private int retryAttempts = 3;

        private Duration retryBackoff = Duration.ofSeconds(2);

        /** Pause between two window requests, zero disables it */
        private Duration requestPause = Duration.ZERO;

        /** Buffered points per writer flush */
        private int bufferLimit = 5000;

        private PointKeyStrategy keyStrategy = PointKeyStrategy.TIMESTAMP;

        /** Devices synced concurrently; windows of one device always stay sequential */
        private int parallelism = 1;

        private boolean saveRaw = false;

        private Path rawDir = Path.of("tracks_raw");

        private Schedule schedule = new Schedule();
    }

    @Data
    public static class Schedule {

        private boolean enabled = false;

        private String cron = "0 */30 * * * *";
    }

    /**
     * Loading site. Membership is great-circle distance to the center within the radius.
     */
    @Data
    public static class Geofence {

        private double latitude = 52.036242;

        private double longitude = 37.887744;

        private double radiusKm = 0.02;
    }

    @Data
    public static class Analysis {

        private double maxJumpKm = 1.0;

        private double maxSpeedKmh = 180.0;

        private int maxPointsPerTrip = 4000;

        private double minTripKm = 1.0;

        /** Upper bound of points loaded for one query */
        private int pointLimit = 500_000;
    }
}
