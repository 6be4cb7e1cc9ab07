package com.volovo.tracksync.session;

import java.util.Optional;

/**
 * Durable home of the portal credential, so a restart can reuse the last session.
 */
public interface CredentialStore {

    Optional<Credential> load();

    void save(Credential credential);
}
