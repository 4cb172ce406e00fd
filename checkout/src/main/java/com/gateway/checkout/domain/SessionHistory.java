package com.gateway.checkout.domain;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * All versions of one session in version order, plus lookups derived from them.
 */
public class SessionHistory {

    private final String sessionId;
    private final List<SessionVersion> versions;

    public SessionHistory(String sessionId, List<SessionVersion> versions) {
        this.sessionId = sessionId;
        this.versions = versions.stream()
                .sorted(Comparator.comparingInt(SessionVersion::getVersion))
                .toList();
    }

    public static SessionHistory empty(String sessionId) {
        return new SessionHistory(sessionId, List.of());
    }

    public String getSessionId() {
        return sessionId;
    }

    public List<SessionVersion> getVersions() {
        return versions;
    }

    public boolean exists() {
        return !versions.isEmpty();
    }

    /** 0 when the session has never been written. */
    public int getLatestVersion() {
        return exists() ? versions.get(versions.size() - 1).getVersion() : 0;
    }

    public int getNextVersion() {
        return getLatestVersion() + 1;
    }

    public Optional<SessionVersion> latest() {
        return exists() ? Optional.of(versions.get(versions.size() - 1)) : Optional.empty();
    }

    /**
     * The response previously produced under this idempotency key, if any.
     * When a key caused several versions, the most recent one answers.
     */
    public Optional<CheckoutSession> pastResponse(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            return Optional.empty();
        }
        for (int i = versions.size() - 1; i >= 0; i--) {
            SessionVersion version = versions.get(i);
            if (idempotencyKey.equals(version.getIdempotencyKey())) {
                return Optional.of(version.getSnapshot());
            }
        }
        return Optional.empty();
    }
}
