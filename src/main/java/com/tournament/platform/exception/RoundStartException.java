package com.tournament.platform.exception;

public class RoundStartException extends PreconditionFailedException {
    public RoundStartException(String message) {
        super(message, "ROUND_START_FAILED");
    }
}
