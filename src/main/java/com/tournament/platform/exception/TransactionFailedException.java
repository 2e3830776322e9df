package com.tournament.platform.exception;

/**
 * A storage transaction could not be committed. Nothing it wrote is visible.
 */
public class TransactionFailedException extends TournamentException {
    public TransactionFailedException(String message) {
        super(message, "TRANSACTION_FAILED");
    }
    
    public TransactionFailedException(String message, Throwable cause) {
        super(message, "TRANSACTION_FAILED", cause);
    }
}
