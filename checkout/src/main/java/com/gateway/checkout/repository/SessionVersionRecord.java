package com.gateway.checkout.repository;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

/**
 * Session Version Log — one row per session version.
 *
 * The primary key (session_id, version) is the optimistic concurrency guard: a second
 * insert of the same version fails on the key instead of overwriting.
 * Rows are only ever inserted.
 */
@Entity
@Table(name = "session_versions", indexes = {
    @Index(name = "idx_session_versions_idempotency_key", columnList = "idempotency_key"),
    @Index(name = "idx_session_versions_status", columnList = "status")
})
@IdClass(SessionVersionKey.class)
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionVersionRecord implements Persistable<SessionVersionKey> {

    @Id
    @Column(name = "session_id", length = 64)
    private String sessionId;

    @Id
    @Column(name = "version")
    private int version;

    @Column(name = "status", nullable = false, length = 32)
    private String status;

    @Column(name = "reason", nullable = false, length = 16)
    private String reason;

    @Column(name = "idempotency_key", length = 255)
    private String idempotencyKey;

    @Column(name = "request_id", length = 255)
    private String requestId;

    @Column(name = "signature", length = 512)
    private String signature;

    @Column(name = "snapshot", nullable = false, columnDefinition = "text")
    private String snapshot;           // Full CheckoutSession JSON

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Override
    public SessionVersionKey getId() {
        return new SessionVersionKey(sessionId, version);
    }

    // Always an INSERT: never merge into an existing version.
    @Override
    public boolean isNew() {
        return true;
    }
}
