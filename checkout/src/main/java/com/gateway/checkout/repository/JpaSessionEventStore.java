package com.gateway.checkout.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gateway.checkout.domain.CheckoutSession;
import com.gateway.checkout.domain.SessionHistory;
import com.gateway.checkout.domain.SessionVersion;
import com.gateway.checkout.domain.TransitionReason;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.List;

/**
 * Session event store on PostgreSQL.
 *
 * Each append is its own short transaction (saveAndFlush), so a duplicate
 * (session_id, version) surfaces immediately as a key violation and is reported
 * as a conflict rather than an error. Any other integrity violation is an error.
 */
@Slf4j
@RequiredArgsConstructor
public class JpaSessionEventStore implements SessionEventStore {

    private final SessionVersionRecordRepository repository;
    private final ObjectMapper objectMapper;

    @Override
    public SessionHistory history(String sessionId) {
        List<SessionVersion> versions = repository.findBySessionIdOrderByVersionAsc(sessionId)
                .stream()
                .map(this::toVersion)
                .toList();
        return new SessionHistory(sessionId, versions);
    }

    @Override
    public AppendResult append(SessionVersion version) {
        SessionVersionRecord record = SessionVersionRecord.builder()
                .sessionId(version.getSessionId())
                .version(version.getVersion())
                .status(version.getStatus().getValue())
                .reason(version.getReason().getValue())
                .idempotencyKey(version.getIdempotencyKey())
                .requestId(version.getRequestId())
                .signature(version.getSignature())
                .snapshot(serialize(version))
                .createdAt(version.getTimestamp())
                .build();
        try {
            repository.saveAndFlush(record);
            return AppendResult.APPENDED;
        } catch (DataIntegrityViolationException e) {
            // Only a row already holding this (session_id, version) is a lost race
            if (repository.existsById(record.getId())) {
                log.debug("Version already taken: sessionId={}, version={}", version.getSessionId(), version.getVersion());
                return AppendResult.CONFLICT;
            }
            throw new EventStoreException("Version rejected by the database: sessionId=" + version.getSessionId()
                    + ", version=" + version.getVersion(), e);
        }
    }

    private String serialize(SessionVersion version) {
        try {
            return objectMapper.writeValueAsString(version.getSnapshot());
        } catch (JsonProcessingException e) {
            throw new EventStoreException("Failed to serialize snapshot: sessionId=" + version.getSessionId(), e);
        }
    }

    private SessionVersion toVersion(SessionVersionRecord record) {
        try {
            return SessionVersion.builder()
                    .sessionId(record.getSessionId())
                    .version(record.getVersion())
                    .reason(TransitionReason.fromValue(record.getReason()))
                    .snapshot(objectMapper.readValue(record.getSnapshot(), CheckoutSession.class))
                    .idempotencyKey(record.getIdempotencyKey())
                    .requestId(record.getRequestId())
                    .signature(record.getSignature())
                    .timestamp(record.getCreatedAt())
                    .build();
        } catch (JsonProcessingException e) {
            throw new EventStoreException("Corrupt snapshot: sessionId=" + record.getSessionId()
                    + ", version=" + record.getVersion(), e);
        }
    }
}
