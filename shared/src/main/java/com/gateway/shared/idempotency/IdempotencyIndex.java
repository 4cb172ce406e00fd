package com.gateway.shared.idempotency;

/**
 * Maps a client-supplied idempotency key to the identifier of the resource it created.
 *
 * First write wins: concurrent first calls for the same key all resolve to one identifier.
 * A null or blank key disables deduplication and yields a fresh identifier every call.
 */
public interface IdempotencyIndex {

    String resolve(String idempotencyKey);

    static boolean isAbsent(String idempotencyKey) {
        return idempotencyKey == null || idempotencyKey.isBlank();
    }

    class IdempotencyException extends RuntimeException {
        public IdempotencyException(String message) {
            super(message);
        }
    }
}
