package com.tournament.platform.exception;

public class NotFoundException extends TournamentException {
    public NotFoundException(String message) {
        super(message, "NOT_FOUND");
    }
}
