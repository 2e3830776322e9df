package com.tournament.platform.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Player {
    private String id;
    private String name;
    private int wins;
    private double points;
    @Builder.Default
    private List<ScoreEvent> scoreEvents = new ArrayList<>();
    private Instant lastWinAt;
    private String tableId;
    private Position position;
    private boolean eliminated;
    private Integer eliminatedInRound;
    private Instant addedAt;
    
    /**
     * Wins as displayed: corrections never take a player below zero.
     */
    @JsonIgnore
    public int getEffectiveWins() {
        return Math.max(0, wins);
    }
    
    @JsonIgnore
    public boolean isSeated() {
        return tableId != null;
    }
}
