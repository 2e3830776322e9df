package com.tournament.platform.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TournamentType {
    STANDARD("standard"),
    CUTLINE("cutline");
    
    private final String value;
    
    TournamentType(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
}
