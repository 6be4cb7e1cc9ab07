package com.volovo.tracksync.fetch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.volovo.tracksync.config.TrackSyncProperties;
import com.volovo.tracksync.exception.AuthenticationException;
import com.volovo.tracksync.exception.FetchException;
import com.volovo.tracksync.model.TimeWindow;
import com.volovo.tracksync.portal.PortalClient;
import com.volovo.tracksync.portal.PortalResponse;
import com.volovo.tracksync.session.Credential;
import com.volovo.tracksync.session.SessionManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.FixedBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Pulls a device's track in fixed windows.
 *
 * Windows are requested one after another, each with its own retry budget
 * ({@code retry-attempts} tries, {@code retry-backoff} apart).
 * A failed window yields a failed {@link FetchedWindow} and the stream goes on;
 * only an {@link AuthenticationException} ends it.
 */
@Service
@Slf4j
public class ChunkedFetcher {

    static final String NOT_AUTHENTICATED = "NoAuth";

    private final SessionManager sessionManager;
    private final PortalClient portalClient;
    private final PointParser pointParser;
    private final RawResponseArchive rawArchive;
    private final ObjectMapper objectMapper;
    private final TrackSyncProperties.Sync sync;
    private final Sleeper sleeper;
    private final int attempts;
    private final RetryTemplate retryTemplate;

    @Autowired
    public ChunkedFetcher(SessionManager sessionManager,
                          PortalClient portalClient,
                          PointParser pointParser,
                          RawResponseArchive rawArchive,
                          ObjectMapper objectMapper,
                          TrackSyncProperties properties) {
        this(sessionManager, portalClient, pointParser, rawArchive, objectMapper, properties, new ThreadWaitSleeper());
    }

    ChunkedFetcher(SessionManager sessionManager,
                   PortalClient portalClient,
                   PointParser pointParser,
                   RawResponseArchive rawArchive,
                   ObjectMapper objectMapper,
                   TrackSyncProperties properties,
                   Sleeper sleeper) {
        this.sessionManager = sessionManager;
        this.portalClient = portalClient;
        this.pointParser = pointParser;
        this.rawArchive = rawArchive;
        this.objectMapper = objectMapper;
        this.sync = properties.getSync();
        this.sleeper = sleeper;
        this.attempts = Math.max(1, sync.getRetryAttempts());
        this.retryTemplate = retryTemplate(attempts, sync.getRetryBackoff(), sleeper);
    }

    /** A decoded reply to one track request. */
    private record Reply(JsonNode body, String raw, boolean notAuthenticated) {
    }

    /**
     * Lazily fetches {@code [from, to)} split into windows of {@code chunkHours}.
     * Nothing is requested until the stream is consumed.
     *
     * @throws AuthenticationException from the consuming terminal operation when no valid session can be obtained
     */
    public Stream<FetchedWindow> fetchRange(long deviceId, LocalDateTime from, LocalDateTime to, int chunkHours) {
        List<TimeWindow> windows = TimeWindow.chunk(from, to, chunkHours);
        log.debug("Device {}: {} window(s) of {}h between {} and {}", deviceId, windows.size(), chunkHours, from, to);
        return windows.stream().map(window -> fetchWindowSafely(deviceId, window));
    }

    private FetchedWindow fetchWindowSafely(long deviceId, TimeWindow window) {
        try {
            return fetchWindow(deviceId, window);
        } catch (FetchException e) {
            log.warn("{}", e.getMessage());
            return FetchedWindow.failed(window, e);
        } finally {
            pause(sync.getRequestPause());
        }
    }

    /**
     * Fetches and parses one window.
     *
     * @throws FetchException          when retries are exhausted or the session stays rejected after one re-login
     * @throws AuthenticationException when logging in fails
     */
    public FetchedWindow fetchWindow(long deviceId, TimeWindow window) {
        Credential credential = sessionManager.ensureValid(sessionManager.currentOrStored());
        Reply reply = requestWithRetry(credential, deviceId, window);

        if (reply.notAuthenticated()) {
            log.info("Device {} window {}: session rejected by the portal, logging in again", deviceId, window);
            sessionManager.markStale(credential);
            credential = sessionManager.refresh(credential);
            reply = requestWithRetry(credential, deviceId, window);
            if (reply.notAuthenticated()) {
                throw new FetchException(deviceId, window, "session still rejected after re-login");
            }
        }

        rawArchive.store(deviceId, window, reply.raw());

        PointParser.Result parsed = pointParser.parse(deviceId, reply.body().path("coords"));
        if (parsed.skipped() > 0) {
            log.info("Device {} window {}: {} point(s), {} dropped, {} malformed",
                    deviceId, window, parsed.points().size(), parsed.dropped(), parsed.malformed());
        } else {
            log.debug("Device {} window {}: {} point(s)", deviceId, window, parsed.points().size());
        }
        return FetchedWindow.succeeded(window, parsed.points(), parsed.skipped());
    }

    private Reply requestWithRetry(Credential credential, long deviceId, TimeWindow window) {
        try {
            return retryTemplate.execute(context -> attempt(credential, deviceId, window, context.getRetryCount() + 1));
        } catch (RetryableFailure e) {
            throw new FetchException(deviceId, window,
                    "giving up after " + attempts + " attempt(s), " + e.getMessage(), e.getCause());
        } catch (BackOffInterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(deviceId, window, "interrupted", e);
        }
    }

    /**
     * One request. Outcomes worth another attempt surface as {@link RetryableFailure}.
     */
    private Reply attempt(Credential credential, long deviceId, TimeWindow window, int attempt) {
        String problem;
        IOException cause = null;
        try {
            PortalResponse response = portalClient.fetchTrack(credential, deviceId, window);
            if (response.statusCode() == 401 || response.statusCode() == 403) {
                return new Reply(null, response.body(), true);
            }
            if (!response.isSuccess()) {
                problem = "HTTP " + response.statusCode() + ": " + response.head();
            } else {
                JsonNode body = readJson(response);
                if (body != null) {
                    return new Reply(body, response.body(), isNotAuthenticated(body));
                }
                problem = "response is not JSON (content-type " + response.contentType() + "): " + response.head();
            }
        } catch (IOException e) {
            cause = e;
            problem = e.getClass().getSimpleName() + ": " + e.getMessage();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(deviceId, window, "interrupted", e);
        }
        log.warn("Device {} window {}: attempt {}/{} failed, {}", deviceId, window, attempt, attempts, problem);
        throw new RetryableFailure(problem, cause);
    }

    private JsonNode readJson(PortalResponse response) {
        String body = response.body();
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            return node != null && node.isContainerNode() ? node : null;
        } catch (JsonProcessingException e) {
            log.debug("Track response not parseable: {}", e.getOriginalMessage());
            return null;
        }
    }

    static boolean isNotAuthenticated(JsonNode body) {
        return body.isObject() && NOT_AUTHENTICATED.equalsIgnoreCase(body.path("result").asText(""));
    }

    private void pause(Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            sleeper.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Pause between windows interrupted");
        }
    }

    private static RetryTemplate retryTemplate(int attempts, Duration backoff, Sleeper sleeper) {
        FixedBackOffPolicy backOffPolicy = new FixedBackOffPolicy();
        backOffPolicy.setBackOffPeriod(backoff == null ? 0 : backoff.toMillis());
        backOffPolicy.setSleeper(sleeper);

        Map<Class<? extends Throwable>, Boolean> retryable = Map.of(RetryableFailure.class, true);
        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(new SimpleRetryPolicy(attempts, retryable));
        template.setBackOffPolicy(backOffPolicy);
        return template;
    }

    /** A failed attempt that the retry policy may repeat. */
    private static final class RetryableFailure extends RuntimeException {

        private RetryableFailure(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
