package com.tournament.platform.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable view of every round's score multiplier, taken once per ranking pass so that
 * all scores of the pass use the same values.
 */
public final class RoundMultipliers {
    
    private final Map<Integer, Double> multipliers;
    private final int lastCompletedRound;
    
    private RoundMultipliers(Map<Integer, Double> multipliers, int lastCompletedRound) {
        this.multipliers = Collections.unmodifiableMap(multipliers);
        this.lastCompletedRound = lastCompletedRound;
    }
    
    public static RoundMultipliers from(List<Round> rounds) {
        Map<Integer, Double> multipliers = new HashMap<>();
        int lastCompleted = 0;
        for (Round round : rounds) {
            multipliers.put(round.getRoundNumber(), round.getScoreMultiplier());
            if (round.getStatus() == RoundStatus.COMPLETED && round.getRoundNumber() > lastCompleted) {
                lastCompleted = round.getRoundNumber();
            }
        }
        return new RoundMultipliers(multipliers, lastCompleted);
    }
    
    public static RoundMultipliers of(Map<Integer, Double> multipliers, int lastCompletedRound) {
        return new RoundMultipliers(new HashMap<>(multipliers), lastCompletedRound);
    }
    
    public boolean isKnown(Integer roundNumber) {
        return roundNumber != null && multipliers.containsKey(roundNumber);
    }
    
    /**
     * Multiplier of the round, or 1 when the round is unknown.
     */
    public double multiplierFor(Integer roundNumber) {
        if (roundNumber == null) {
            return Round.DEFAULT_MULTIPLIER;
        }
        return multipliers.getOrDefault(roundNumber, Round.DEFAULT_MULTIPLIER);
    }
    
    /**
     * Number of the most recently completed round, 0 when none has completed.
     */
    public int getLastCompletedRound() {
        return lastCompletedRound;
    }
    
    public boolean hasCompletedRound() {
        return lastCompletedRound > 0;
    }
}
