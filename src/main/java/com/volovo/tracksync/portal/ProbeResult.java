package com.volovo.tracksync.portal;

/**
 * Outcome of checking a stored credential against a protected page.
 */
public enum ProbeResult {
    VALID,
    /** 401/403 or a redirect back to the login page */
    REJECTED,
    /** Transport failure, the credential state is unknown */
    UNREACHABLE
}
