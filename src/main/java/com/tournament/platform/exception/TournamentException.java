package com.tournament.platform.exception;

public class TournamentException extends RuntimeException {
    private final String errorCode;
    
    public TournamentException(String message) {
        super(message);
        this.errorCode = "TOURNAMENT_ERROR";
    }
    
    public TournamentException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public TournamentException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = "TOURNAMENT_ERROR";
    }
    
    public TournamentException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
}
