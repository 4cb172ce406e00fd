package com.gateway.checkout.service;

import com.gateway.checkout.domain.SessionVersion;

/**
 * Told about every version after it is durably appended.
 * Runs on the request thread, so implementations hand slow work off elsewhere.
 * A listener that throws is logged and skipped; the commit stands.
 */
public interface SessionCommitListener {

    void onCommitted(SessionVersion version);
}
