package com.tournament.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One entry of a player's score ledger. Never edited once written, except by the
 * round number backfill of {@code ScoreEventRepairService}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoreEvent {
    private int delta;
    private Integer roundNumber;
    private Instant timestamp;
}
