package com.volovo.tracksync.session;

import com.volovo.tracksync.config.TrackSyncProperties;
import com.volovo.tracksync.exception.AuthenticationException;
import com.volovo.tracksync.portal.PortalClient;
import com.volovo.tracksync.portal.ProbeResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the single portal credential of this process.
 *
 * State: NONE → AUTHENTICATING → VALID, VALID → STALE when a probe or a fetch
 * response rejects it, STALE → AUTHENTICATING on the next refresh.
 *
 * Logins are serialized: concurrent callers holding the same stale credential
 * trigger one login and all receive its result. Readers only ever attach the
 * credential to outgoing requests.
 */
@Service
@Slf4j
public class SessionManager {

    public enum State { NONE, AUTHENTICATING, VALID, STALE }

    private final PortalClient portalClient;
    private final CredentialStore credentialStore;
    private final List<String> sessionCookies;

    private final ReentrantLock loginLock = new ReentrantLock();

    private volatile Credential current;
    private volatile State state = State.NONE;

    public SessionManager(PortalClient portalClient, CredentialStore credentialStore, TrackSyncProperties properties) {
        this.portalClient = portalClient;
        this.credentialStore = credentialStore;
        this.sessionCookies = List.copyOf(properties.getPortal().getSessionCookies());
    }

    /**
     * Logs in, checks the session markers and persists the new credential.
     *
     * @throws AuthenticationException when the portal rejects the login or a session cookie is missing
     */
    public Credential acquire() {
        loginLock.lock();
        try {
            return doAcquire();
        } finally {
            loginLock.unlock();
        }
    }

    /**
     * Returns a credential the portal accepts: {@code candidate} itself when the
     * probe passes, otherwise a fresh one.
     *
     * A probe that cannot reach the portal also leads to a new login rather than
     * an error: availability wins over certainty here.
     */
    public Credential ensureValid(Credential candidate) {
        if (candidate == null) {
            log.info("No credential at hand, logging in");
            return refresh(null);
        }

        ProbeResult probe = portalClient.probe(candidate);
        switch (probe) {
            case VALID:
                current = candidate;
                state = State.VALID;
                return candidate;
            case REJECTED:
                log.info("Portal rejected credential acquired at {}, logging in again", candidate.acquiredAt());
                markStale(candidate);
                return refresh(candidate);
            case UNREACHABLE:
            default:
                log.warn("Credential probe could not reach the portal, logging in again as a fallback");
                return refresh(candidate);
        }
    }

    /**
     * Replaces {@code stale} with a new credential unless another caller already did.
     */
    public Credential refresh(Credential stale) {
        loginLock.lock();
        try {
            Credential latest = current;
            if (latest != null && latest != stale && state == State.VALID) {
                log.debug("Credential already refreshed by another caller");
                return latest;
            }
            return doAcquire();
        } finally {
            loginLock.unlock();
        }
    }

    /**
     * Called when a response body says the session is gone despite HTTP 200.
     */
    public void markStale(Credential credential) {
        if (credential != null && credential == current) {
            state = State.STALE;
        }
    }

    /**
     * In-memory credential, else the persisted one, else empty-handed ({@code null}).
     * No network call.
     */
    public Credential currentOrStored() {
        Credential latest = current;
        if (latest != null) {
            return latest;
        }
        return credentialStore.load()
                .map(stored -> {
                    current = stored;
                    state = State.STALE;
                    return stored;
                })
                .orElse(null);
    }

    public State getState() {
        return state;
    }

    private Credential doAcquire() {
        State before = state;
        state = State.AUTHENTICATING;
        try {
            String cookieLine = portalClient.login();
            if (cookieLine == null || cookieLine.isBlank()) {
                throw new AuthenticationException(AuthenticationException.Reason.SESSION_MARKERS_MISSING,
                        "Login redirect received but no cookie was issued, check login/password");
            }
            Credential fresh = new Credential(cookieLine, Instant.now());
            for (String marker : sessionCookies) {
                if (!fresh.hasCookie(marker)) {
                    throw new AuthenticationException(AuthenticationException.Reason.SESSION_MARKERS_MISSING,
                            "Login redirect received but cookie " + marker + " is missing, check login/password");
                }
            }
            persist(fresh);
            current = fresh;
            state = State.VALID;
            log.info("Portal session established");
            return fresh;
        } catch (RuntimeException e) {
            state = before == State.NONE ? State.NONE : State.STALE;
            throw e;
        }
    }

    private void persist(Credential credential) {
        try {
            credentialStore.save(credential);
        } catch (UncheckedIOException e) {
            log.warn("Credential kept in memory only: {}", e.getMessage());
        }
    }
}
