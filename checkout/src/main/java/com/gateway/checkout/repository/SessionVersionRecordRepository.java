package com.gateway.checkout.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SessionVersionRecordRepository extends JpaRepository<SessionVersionRecord, SessionVersionKey> {

    List<SessionVersionRecord> findBySessionIdOrderByVersionAsc(String sessionId);
}
