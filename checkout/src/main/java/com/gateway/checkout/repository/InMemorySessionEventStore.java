package com.gateway.checkout.repository;

import com.gateway.checkout.domain.SessionHistory;
import com.gateway.checkout.domain.SessionVersion;

import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Process-local session event store for local runs and tests.
 * {@code putIfAbsent} on the per-session map is the conditional write.
 */
public class InMemorySessionEventStore implements SessionEventStore {

    private final ConcurrentMap<String, NavigableMap<Integer, SessionVersion>> sessions = new ConcurrentHashMap<>();

    @Override
    public SessionHistory history(String sessionId) {
        Map<Integer, SessionVersion> versions = sessions.get(sessionId);
        if (versions == null) {
            return SessionHistory.empty(sessionId);
        }
        return new SessionHistory(sessionId, List.copyOf(versions.values()));
    }

    @Override
    public AppendResult append(SessionVersion version) {
        NavigableMap<Integer, SessionVersion> versions =
                sessions.computeIfAbsent(version.getSessionId(), id -> new ConcurrentSkipListMap<>());
        return versions.putIfAbsent(version.getVersion(), version) == null
                ? AppendResult.APPENDED
                : AppendResult.CONFLICT;
    }
}
