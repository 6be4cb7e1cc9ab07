package com.volovo.tracksync.session;

import java.time.Instant;
import java.util.Arrays;

/**
 * Portal session token: the cookie header line ({@code a=b; c=d}) obtained at login.
 */
public record Credential(String cookieLine, Instant acquiredAt) {

    public Credential {
        if (cookieLine == null || cookieLine.isBlank()) {
            throw new IllegalArgumentException("Cookie line must not be blank");
        }
        cookieLine = cookieLine.trim();
    }

    public boolean hasCookie(String name) {
        return Arrays.stream(cookieLine.split(";"))
                .map(String::trim)
                .anyMatch(part -> part.startsWith(name + "="));
    }

    @Override
    public String toString() {
        // cookie values stay out of logs
        return "Credential[acquiredAt=" + acquiredAt + "]";
    }
}
