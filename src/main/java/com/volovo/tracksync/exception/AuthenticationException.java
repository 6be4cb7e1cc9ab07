package com.volovo.tracksync.exception;

import lombok.Getter;

/**
 * The portal session could not be established. Fatal for a whole sync run:
 * no device can be fetched without a credential.
 */
@Getter
public class AuthenticationException extends TrackSyncException {

    public enum Reason {
        /** Login form posted but the portal answered without a redirect */
        REJECTED,
        /** Redirect received but one of the expected session cookies is missing */
        SESSION_MARKERS_MISSING,
        /** Login page no longer carries the hidden view-state field */
        LOGIN_FORM_CHANGED,
        /** Portal could not be reached while logging in */
        PORTAL_UNREACHABLE
    }

    private final Reason reason;

    public AuthenticationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public AuthenticationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
