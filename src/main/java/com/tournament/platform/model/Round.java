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
public class Round {
    public static final double DEFAULT_MULTIPLIER = 1.0;
    
    private String id;
    private int roundNumber;
    private Instant startedAt;
    private Instant endedAt;
    private RoundStatus status;
    @Builder.Default
    private double scoreMultiplier = DEFAULT_MULTIPLIER;
    private Integer timerDuration;
    private boolean playoff;
    private Instant createdAt;
}
