package com.tournament.platform.service;

import com.tournament.platform.model.Player;
import com.tournament.platform.model.RepairReport;
import com.tournament.platform.model.Round;
import com.tournament.platform.model.ScoreEvent;
import com.tournament.platform.repository.DocumentStore;
import com.tournament.platform.repository.TournamentPaths;
import com.tournament.platform.repository.TournamentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Backfills the round number of historical score events that were written without one.
 * The round is inferred from the event's timestamp: the round whose
 * {@code [startedAt, endedAt]} window contains it, a round not yet ended having an open window.
 * Nothing is written unless {@code apply} is requested.
 */
@Service
public class ScoreEventRepairService {

    private static final Logger logger = LoggerFactory.getLogger(ScoreEventRepairService.class);

    private final DocumentStore documentStore;
    private final TournamentRepository tournamentRepository;

    @Autowired
    public ScoreEventRepairService(DocumentStore documentStore, TournamentRepository tournamentRepository) {
        this.documentStore = documentStore;
        this.tournamentRepository = tournamentRepository;
    }

    public RepairReport repair(String tournamentId, boolean apply) {
        tournamentRepository.getTournament(documentStore, tournamentId);
        List<Round> rounds = tournamentRepository.findRounds(documentStore, tournamentId);
        List<Player> players = tournamentRepository.findPlayers(documentStore, tournamentId);

        RepairReport report = RepairReport.builder().applied(false).build();
        Map<String, Map<Integer, Integer>> fixesByPlayer = new LinkedHashMap<>();

        for (Player player : players) {
            List<ScoreEvent> events = player.getScoreEvents() == null ? List.of() : player.getScoreEvents();
            for (int i = 0; i < events.size(); i++) {
                ScoreEvent event = events.get(i);
                if (event.getRoundNumber() != null) {
                    continue;
                }
                Optional<Round> round = inferRound(rounds, event.getTimestamp());
                RepairReport.Inference inference = RepairReport.Inference.builder()
                    .playerId(player.getId())
                    .playerName(player.getName())
                    .eventIndex(i)
                    .timestamp(event.getTimestamp())
                    .inferredRound(round.map(Round::getRoundNumber).orElse(null))
                    .windowStart(round.map(Round::getStartedAt).orElse(null))
                    .windowEnd(round.map(Round::getEndedAt).orElse(null))
                    .build();
                if (round.isPresent()) {
                    logger.info("{}: event #{} (delta {}) at {} lies in round {} window [{} .. {}], inferring round {}",
                        player.getName(), i, event.getDelta(), event.getTimestamp(), inference.getInferredRound(),
                        inference.getWindowStart(), inference.getWindowEnd() != null ? inference.getWindowEnd() : "open",
                        inference.getInferredRound());
                    report.getInferred().add(inference);
                    fixesByPlayer.computeIfAbsent(player.getId(), k -> new LinkedHashMap<>())
                        .put(i, inference.getInferredRound());
                } else {
                    logger.warn("{}: event #{} (delta {}) at {} lies in no round window, left unchanged",
                        player.getName(), i, event.getDelta(), event.getTimestamp());
                    report.getUnmatched().add(inference);
                }
            }
        }

        if (!apply) {
            logger.info("Dry run for tournament {}: {} events would be updated, {} unmatched",
                tournamentId, report.getInferred().size(), report.getUnmatched().size());
            return report;
        }

        for (Map.Entry<String, Map<Integer, Integer>> fixes : fixesByPlayer.entrySet()) {
            applyFixes(tournamentId, fixes.getKey(), fixes.getValue());
        }
        report.setApplied(true);
        report.setPlayersUpdated(fixesByPlayer.size());
        logger.info("Updated {} events across {} players in tournament {}",
            report.getInferred().size(), fixesByPlayer.size(), tournamentId);
        return report;
    }

    /**
     * Rewrites the player's events from a fresh read, touching only events that still lack
     * a round number, so events appended meanwhile are kept.
     */
    private void applyFixes(String tournamentId, String playerId, Map<Integer, Integer> fixes) {
        documentStore.runTransaction(tx -> {
            Player player = tournamentRepository.getPlayer(tx, tournamentId, playerId);
            List<ScoreEvent> events = new ArrayList<>(player.getScoreEvents());
            fixes.forEach((index, roundNumber) -> {
                if (index < events.size() && events.get(index).getRoundNumber() == null) {
                    events.get(index).setRoundNumber(roundNumber);
                }
            });
            tx.update(TournamentPaths.player(tournamentId, playerId),
                Map.of("scoreEvents", tournamentRepository.toValue(events)));
            return null;
        });
    }

    /**
     * Latest-started round whose window contains the timestamp.
     */
    static Optional<Round> inferRound(List<Round> rounds, Instant timestamp) {
        if (timestamp == null) {
            return Optional.empty();
        }
        return rounds.stream()
            .filter(round -> round.getStartedAt() != null && !timestamp.isBefore(round.getStartedAt()))
            .filter(round -> round.getEndedAt() == null || !timestamp.isAfter(round.getEndedAt()))
            .max(Comparator.comparing(Round::getStartedAt));
    }
}
