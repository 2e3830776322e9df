package com.tournament.platform.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * Seat at a table, in seating order.
 */
public enum Position {
    EAST("East"),
    SOUTH("South"),
    WEST("West"),
    NORTH("North");
    
    public static final List<Position> SEATING_ORDER = List.of(EAST, SOUTH, WEST, NORTH);
    
    private final String value;
    
    Position(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
}
