package io.conductor.storage;

/**
 * The ledger could not be read or written. Distinct from any admission decision: callers must not
 * treat it as "blocked".
 */
public final class LedgerUnavailableException extends RuntimeException {
    public LedgerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
