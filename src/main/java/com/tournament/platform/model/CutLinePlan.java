package com.tournament.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CutLinePlan {
    private int completedRound;
    private int totalRounds;
    private int originalPlayerCount;
    private int activePlayerCount;
    private double targetPercentage;
    private int idealTarget;
    private int targetRemaining;
    private String reason;
    // worst first
    @Builder.Default
    private List<RankedPlayer> eliminated = new ArrayList<>();
    @Builder.Default
    private List<RankedPlayer> surviving = new ArrayList<>();
}
