package com.tournament.platform.model;

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
public class RepairReport {
    
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Inference {
        private String playerId;
        private String playerName;
        private int eventIndex;
        private Instant timestamp;
        private Integer inferredRound;
        private Instant windowStart;
        private Instant windowEnd;
    }
    
    private boolean applied;
    @Builder.Default
    private List<Inference> inferred = new ArrayList<>();
    @Builder.Default
    private List<Inference> unmatched = new ArrayList<>();
    private int playersUpdated;
}
