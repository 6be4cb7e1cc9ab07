package com.volovo.tracksync.portal;

import com.volovo.tracksync.config.TrackSyncProperties;
import com.volovo.tracksync.exception.AuthenticationException;
import com.volovo.tracksync.model.TimeWindow;
import com.volovo.tracksync.session.Credential;
import com.volovo.tracksync.util.PortalTimes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.CookieManager;
import java.net.CookiePolicy;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * HTTP plumbing against the legacy tracking portal (ASP.NET WebForms).
 *
 * Login flow:
 *  1. GET  login page, scrape the hidden __VIEWSTATE (+ optional __EVENTVALIDATION, __VIEWSTATEGENERATOR)
 *  2. POST the form back with the credentials; success is a 302/303, never a 200
 *  3. GET  the redirect target so the portal finishes the session
 *
 * Redirects are never followed automatically: a redirect to the login page is
 * how the portal says a cookie is stale.
 */
@Component
@Slf4j
public class PortalClient {

    private static final String VIEWSTATE = "__VIEWSTATE";
    private static final String EVENTVALIDATION = "__EVENTVALIDATION";
    private static final String VIEWSTATEGENERATOR = "__VIEWSTATEGENERATOR";

    private final TrackSyncProperties.Portal portal;

    /** Shared client for probe and track calls; the cookie travels as an explicit header */
    private final HttpClient httpClient;

    public PortalClient(TrackSyncProperties properties) {
        this.portal = properties.getPortal();
        this.httpClient = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(portal.getHttpTimeout())
                .build();
    }

    /**
     * Runs the login sequence with a fresh cookie jar.
     *
     * @return every cookie collected during the flow as one header line
     * @throws AuthenticationException when the form is missing, the post is
     *                                 not answered with a redirect, or the portal is unreachable
     */
    public String login() {
        CookieManager cookieJar = new CookieManager(null, CookiePolicy.ACCEPT_ALL);
        HttpClient client = HttpClient.newBuilder()
                .cookieHandler(cookieJar)
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(portal.getHttpTimeout())
                .build();
        String loginUrl = portal.normalizedBaseUrl() + portal.getLoginPath();

        try {
            HttpResponse<String> page = client.send(
                    HttpRequest.newBuilder(URI.create(loginUrl))
                            .timeout(portal.getHttpTimeout())
                            .header("User-Agent", portal.getUserAgent())
                            .GET().build(),
                    HttpResponse.BodyHandlers.ofString());
            if (page.statusCode() < 200 || page.statusCode() >= 300) {
                throw new AuthenticationException(AuthenticationException.Reason.PORTAL_UNREACHABLE,
                        "Login page answered HTTP " + page.statusCode());
            }

            String html = page.body();
            String viewState = hiddenField(html, VIEWSTATE)
                    .orElseThrow(() -> new AuthenticationException(AuthenticationException.Reason.LOGIN_FORM_CHANGED,
                            "No " + VIEWSTATE + " on " + portal.getLoginPath() + " (login form changed?)"));

            Map<String, String> form = new LinkedHashMap<>();
            form.put("__EVENTTARGET", "lbEnter");
            form.put("__EVENTARGUMENT", "");
            form.put("__LASTFOCUS", "");
            form.put(VIEWSTATE, viewState);
            form.put("TimeZone", portal.getTimeZone());
            form.put("tbLogin", portal.getLogin());
            form.put("tbPassword", portal.getPassword());
            form.put("ddlLanguage", portal.getLanguage());
            form.put("CheckNewInterface", "on");
            hiddenField(html, EVENTVALIDATION).ifPresent(v -> form.put(EVENTVALIDATION, v));
            hiddenField(html, VIEWSTATEGENERATOR).ifPresent(v -> form.put(VIEWSTATEGENERATOR, v));

            HttpResponse<String> posted = client.send(
                    HttpRequest.newBuilder(URI.create(loginUrl))
                            .timeout(portal.getHttpTimeout())
                            .header("Origin", portal.normalizedBaseUrl())
                            .header("Referer", loginUrl)
                            .header("Content-Type", "application/x-www-form-urlencoded")
                            .header("User-Agent", portal.getUserAgent())
                            .POST(HttpRequest.BodyPublishers.ofString(encodeForm(form)))
                            .build(),
                    HttpResponse.BodyHandlers.ofString());

            if (posted.statusCode() != 302 && posted.statusCode() != 303) {
                throw new AuthenticationException(AuthenticationException.Reason.REJECTED,
                        "Login not accepted: HTTP " + posted.statusCode());
            }

            Optional<String> location = posted.headers().firstValue("Location");
            if (location.isPresent()) {
                followLoginRedirect(client, URI.create(loginUrl).resolve(location.get()));
            }

            return cookieJar.getCookieStore().getCookies().stream()
                    .map(c -> c.getName() + "=" + c.getValue())
                    .collect(Collectors.joining("; "));

        } catch (IOException e) {
            throw new AuthenticationException(AuthenticationException.Reason.PORTAL_UNREACHABLE,
                    "Portal unreachable during login: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AuthenticationException(AuthenticationException.Reason.PORTAL_UNREACHABLE,
                    "Login interrupted", e);
        }
    }

    /**
     * Opens the protected probe page with the given cookie and reports whether
     * the portal still accepts it.
     */
    public ProbeResult probe(Credential credential) {
        String probeUrl = portal.normalizedBaseUrl() + portal.getProbePath();
        try {
            HttpResponse<Void> response = httpClient.send(
                    HttpRequest.newBuilder(URI.create(probeUrl))
                            .timeout(portal.getHttpTimeout())
                            .header("Cookie", credential.cookieLine())
                            .header("User-Agent", portal.getUserAgent())
                            .GET().build(),
                    HttpResponse.BodyHandlers.discarding());

            int status = response.statusCode();
            String location = response.headers().firstValue("Location").orElse("").toLowerCase();
            if (status == 401 || status == 403 || location.contains(portal.getLoginPath().toLowerCase())) {
                log.debug("Probe rejected credential: HTTP {}, location '{}'", status, location);
                return ProbeResult.REJECTED;
            }
            return ProbeResult.VALID;

        } catch (IOException e) {
            log.debug("Probe transport failure: {}", e.getMessage());
            return ProbeResult.UNREACHABLE;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProbeResult.UNREACHABLE;
        }
    }

    /**
     * Requests the raw track of one device for one window.
     *
     * @throws IOException on transport failure; the caller decides about retries
     */
    public PortalResponse fetchTrack(Credential credential, long deviceId, TimeWindow window)
            throws IOException, InterruptedException {
        String url = portal.normalizedBaseUrl() + portal.getTrackPath()
                + "?oid=" + deviceId
                + "&from=" + encode(PortalTimes.format(window.from()))
                + "&to=" + encode(PortalTimes.format(window.to()));
        log.debug("Track request: {}", url);

        HttpResponse<String> response = httpClient.send(
                HttpRequest.newBuilder(URI.create(url))
                        .timeout(portal.getHttpTimeout())
                        .header("Accept", "application/json, text/javascript, */*; q=0.01")
                        .header("X-Requested-With", "XMLHttpRequest")
                        .header("Referer", portal.normalizedBaseUrl() + portal.getProbePath())
                        .header("Cookie", credential.cookieLine())
                        .header("User-Agent", portal.getUserAgent())
                        .GET().build(),
                HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));

        return new PortalResponse(response.statusCode(),
                response.headers().firstValue("Content-Type").orElse(""),
                response.body());
    }

    private void followLoginRedirect(HttpClient client, URI target) throws InterruptedException {
        try {
            client.send(HttpRequest.newBuilder(target)
                            .timeout(portal.getHttpTimeout())
                            .header("User-Agent", portal.getUserAgent())
                            .GET().build(),
                    HttpResponse.BodyHandlers.discarding());
        } catch (IOException e) {
            // the session cookies were already issued by the form post
            log.warn("Login redirect to {} not reachable: {}", target.getPath(), e.getMessage());
        }
    }

    static Optional<String> hiddenField(String html, String name) {
        if (html == null) {
            return Optional.empty();
        }
        Pattern pattern = Pattern.compile(
                "<input[^>]+name=\"" + Pattern.quote(name) + "\"[^>]+value=\"([^\"]*)\"",
                Pattern.CASE_INSENSITIVE);
        Matcher matcher = pattern.matcher(html);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    private static String encodeForm(Map<String, String> form) {
        return form.entrySet().stream()
                .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                        + URLEncoder.encode(e.getValue() == null ? "" : e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
