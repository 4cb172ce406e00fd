package com.gateway.checkout.repository;

import com.gateway.checkout.domain.SessionHistory;
import com.gateway.checkout.domain.SessionVersion;

/**
 * Append-only, versioned store of checkout session snapshots.
 *
 * Appends are conditional on (sessionId, version) not existing yet: of several writers
 * racing for the same version exactly one gets {@link AppendResult#APPENDED}. Losers
 * re-read the history and try the next version.
 */
public interface SessionEventStore {

    SessionHistory history(String sessionId);

    AppendResult append(SessionVersion version);

    enum AppendResult {
        APPENDED,
        CONFLICT
    }

    class EventStoreException extends RuntimeException {
        public EventStoreException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
