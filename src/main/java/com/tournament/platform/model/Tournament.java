package com.tournament.platform.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Tournament {
    private String id;
    private String name;
    private TournamentType type;
    private Integer timerDuration;
    private int maxPlayers;
    private Integer totalRounds;
    private TournamentStatus status;
    private int currentRound;
    private boolean roundInProgress;
    private String tournamentCode;
    // Highest table number ever issued; table numbers are never reused.
    private int lastTableNumber;
    private Instant createdAt;
    private Instant completedAt;
    
    @JsonIgnore
    public boolean isCutline() {
        return type == TournamentType.CUTLINE;
    }
    
    @JsonIgnore
    public boolean isCompleted() {
        return status == TournamentStatus.COMPLETED;
    }
}
