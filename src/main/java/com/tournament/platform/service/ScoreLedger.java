package com.tournament.platform.service;

import com.tournament.platform.exception.InvalidRequestException;
import com.tournament.platform.exception.NotFoundException;
import com.tournament.platform.model.IntegrityWarning;
import com.tournament.platform.model.Player;
import com.tournament.platform.model.RoundMultipliers;
import com.tournament.platform.model.ScoreEvent;
import com.tournament.platform.repository.DocumentAccess;
import com.tournament.platform.repository.DocumentStore;
import com.tournament.platform.repository.FieldValue;
import com.tournament.platform.repository.TournamentPaths;
import com.tournament.platform.repository.TournamentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * A player's append-only score history and the scores derived from it.
 * <p>
 * Scores are computed by summing the integer deltas of each round first and applying the
 * round's multiplier once, so the result does not depend on the order of the events.
 */
@Component
public class ScoreLedger {

    private static final Logger logger = LoggerFactory.getLogger(ScoreLedger.class);

    private final DocumentStore documentStore;
    private final TournamentRepository tournamentRepository;

    @Autowired
    public ScoreLedger(DocumentStore documentStore, TournamentRepository tournamentRepository) {
        this.documentStore = documentStore;
        this.tournamentRepository = tournamentRepository;
    }

    /**
     * Sum of every event's delta times the multiplier of its round. Unknown rounds, and
     * legacy events without a round number, count with multiplier 1.
     */
    public double tournamentScore(Player player, RoundMultipliers multipliers) {
        long untagged = 0;
        Map<Integer, Long> perRound = new TreeMap<>();
        for (ScoreEvent event : events(player)) {
            if (event.getRoundNumber() == null) {
                untagged += event.getDelta();
            } else {
                perRound.merge(event.getRoundNumber(), (long) event.getDelta(), Long::sum);
            }
        }
        double total = untagged;
        for (Map.Entry<Integer, Long> round : perRound.entrySet()) {
            total += round.getValue() * multipliers.multiplierFor(round.getKey());
        }
        return total;
    }

    public double roundScore(Player player, int roundNumber, RoundMultipliers multipliers) {
        long sum = 0;
        for (ScoreEvent event : events(player)) {
            if (event.getRoundNumber() != null && event.getRoundNumber() == roundNumber) {
                sum += event.getDelta();
            }
        }
        return sum * multipliers.multiplierFor(roundNumber);
    }

    /**
     * Events the scores above had to guess about.
     */
    public List<IntegrityWarning> inspect(Player player, RoundMultipliers multipliers) {
        List<IntegrityWarning> warnings = new ArrayList<>();
        List<ScoreEvent> events = events(player);
        for (int i = 0; i < events.size(); i++) {
            ScoreEvent event = events.get(i);
            if (event.getRoundNumber() == null) {
                warnings.add(IntegrityWarning.builder()
                    .kind(IntegrityWarning.Kind.MISSING_ROUND_NUMBER)
                    .subjectId(player.getId())
                    .message(String.format("%s: score event #%d at %s has no round number",
                        player.getName(), i, event.getTimestamp()))
                    .build());
            } else if (!multipliers.isKnown(event.getRoundNumber())) {
                warnings.add(IntegrityWarning.builder()
                    .kind(IntegrityWarning.Kind.UNKNOWN_ROUND)
                    .subjectId(player.getId())
                    .message(String.format("%s: score event #%d references unknown round %d, multiplier 1 assumed",
                        player.getName(), i, event.getRoundNumber()))
                    .build());
            }
        }
        return warnings;
    }

    /**
     * Appends one event to the player's ledger in a single atomic update: the event is
     * appended, {@code wins} is incremented by the delta and {@code lastWinAt} is set to the
     * event's timestamp when the delta is positive.
     *
     * @throws InvalidRequestException if the round number is missing or the delta is zero
     */
    public ScoreEvent appendScoreEvent(String tournamentId, String playerId, int delta, Integer roundNumber) {
        ScoreEvent event = appendScoreEvent(documentStore, tournamentId, playerId, delta, roundNumber);
        logger.info("Recorded {}{} for player {} in round {} of tournament {}",
            delta > 0 ? "+" : "", delta, playerId, roundNumber, tournamentId);
        return event;
    }

    /**
     * The same single update, written through {@code db} so it can join a transaction.
     */
    public ScoreEvent appendScoreEvent(DocumentAccess db, String tournamentId, String playerId,
                                       int delta, Integer roundNumber) {
        validateAppend(tournamentId, playerId, delta, roundNumber);

        Instant now = documentStore.serverTimestamp();
        ScoreEvent event = ScoreEvent.builder()
            .delta(delta)
            .roundNumber(roundNumber)
            .timestamp(now)
            .build();

        Map<String, Object> fields = new HashMap<>();
        fields.put("wins", FieldValue.increment(delta));
        fields.put("scoreEvents", FieldValue.arrayAppend(tournamentRepository.toValue(event)));
        if (delta > 0) {
            fields.put("lastWinAt", tournamentRepository.toValue(now));
        }

        try {
            db.update(TournamentPaths.player(tournamentId, playerId), fields);
        } catch (NotFoundException e) {
            throw new NotFoundException("Player not found: " + playerId);
        }
        return event;
    }

    private void validateAppend(String tournamentId, String playerId, int delta, Integer roundNumber) {
        if (tournamentId == null || tournamentId.trim().isEmpty()) {
            throw new InvalidRequestException("Tournament id cannot be null or empty");
        }
        if (playerId == null || playerId.trim().isEmpty()) {
            throw new InvalidRequestException("Player id cannot be null or empty");
        }
        if (roundNumber == null) {
            throw new InvalidRequestException("Score event for player " + playerId + " has no round number");
        }
        if (roundNumber < 1) {
            throw new InvalidRequestException("Round number must be at least 1, got " + roundNumber);
        }
        if (delta == 0) {
            throw new InvalidRequestException("Score delta cannot be zero");
        }
    }

    private static List<ScoreEvent> events(Player player) {
        return player.getScoreEvents() == null ? List.of() : player.getScoreEvents();
    }
}
