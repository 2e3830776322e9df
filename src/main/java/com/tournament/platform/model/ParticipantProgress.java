package com.tournament.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParticipantProgress {
    private String playerId;
    private String name;
    private String tableId;
    private Position position;
    private int snapshotWins;
    private int currentWins;
    private int winsGained;
    private double roundScore;
}
