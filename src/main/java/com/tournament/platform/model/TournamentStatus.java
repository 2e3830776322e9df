package com.tournament.platform.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TournamentStatus {
    STAGING("staging"),
    ACTIVE("active"),
    COMPLETED("completed");
    
    private final String value;
    
    TournamentStatus(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
}
