package com.tournament.platform.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RoundStatus {
    STAGING("staging"),
    IN_PROGRESS("in_progress"),
    COMPLETED("completed");
    
    private final String value;
    
    RoundStatus(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
}
