package com.tournament.platform.exception;

public class InvalidRequestException extends TournamentException {
    public InvalidRequestException(String message) {
        super(message, "INVALID_REQUEST");
    }
}
