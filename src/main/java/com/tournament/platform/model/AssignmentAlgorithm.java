package com.tournament.platform.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.tournament.platform.exception.InvalidRequestException;

public enum AssignmentAlgorithm {
    RANDOM("random"),
    RANKING("ranking"),
    ROUND_ROBIN("round_robin");
    
    private final String value;
    
    AssignmentAlgorithm(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    public boolean needsRanking() {
        return this != RANDOM;
    }
    
    public static AssignmentAlgorithm fromValue(String value) {
        for (AssignmentAlgorithm algorithm : values()) {
            if (algorithm.value.equalsIgnoreCase(value) || algorithm.name().equalsIgnoreCase(value)) {
                return algorithm;
            }
        }
        throw new InvalidRequestException("Unknown assignment algorithm: " + value);
    }
}
