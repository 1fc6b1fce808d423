package com.ailab.core.error;

/**
 * The persisted ledger, or one of its entries, cannot be trusted. Fatal for the affected
 * entry only; other entries keep being served.
 */
public class LedgerCorruptionException extends EnvironmentException {

    public LedgerCorruptionException(String message) {
        super(ErrorCode.LEDGER_CORRUPTION, null, message);
    }

    public LedgerCorruptionException(String message, Throwable cause) {
        super(ErrorCode.LEDGER_CORRUPTION, null, message, cause);
    }
}
