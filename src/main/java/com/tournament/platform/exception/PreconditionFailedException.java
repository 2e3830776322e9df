package com.tournament.platform.exception;

/**
 * The tournament is not in a state that allows the requested operation.
 */
public class PreconditionFailedException extends TournamentException {
    public PreconditionFailedException(String message) {
        super(message, "PRECONDITION_FAILED");
    }
    
    protected PreconditionFailedException(String message, String errorCode) {
        super(message, errorCode);
    }
}
