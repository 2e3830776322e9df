package com.tournament.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RankedPlayer {
    private String playerId;
    private String name;
    // 1-based place in the strict order
    private int place;
    // shared by players equal on every score criterion
    private int rank;
    private double tournamentScore;
    private double roundScore;
    private double tableRoundScore;
    private Instant lastWinAt;
    private int wins;
    private String tableId;
    private Position position;
}
