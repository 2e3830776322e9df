package com.tournament.platform.service;

import com.tournament.platform.dto.RoundOptions;
import com.tournament.platform.exception.InvalidRequestException;
import com.tournament.platform.exception.NotFoundException;
import com.tournament.platform.exception.PreconditionFailedException;
import com.tournament.platform.exception.RoundStartException;
import com.tournament.platform.model.Participant;
import com.tournament.platform.model.Player;
import com.tournament.platform.model.Round;
import com.tournament.platform.model.RoundStatus;
import com.tournament.platform.model.ScoreEvent;
import com.tournament.platform.model.Table;
import com.tournament.platform.model.Tournament;
import com.tournament.platform.model.TournamentStatus;
import com.tournament.platform.repository.DocumentStore;
import com.tournament.platform.repository.Transaction;
import com.tournament.platform.repository.TournamentPaths;
import com.tournament.platform.repository.TournamentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Round state machine: no round, staging round, in progress, completed, then the next
 * staging round. Only this service changes a tournament's {@code currentRound} and
 * {@code roundInProgress}.
 */
@Service
public class RoundLifecycleService {

    private static final Logger logger = LoggerFactory.getLogger(RoundLifecycleService.class);

    public static final double MAX_MULTIPLIER = 100.0;

    private final DocumentStore documentStore;
    private final TournamentRepository tournamentRepository;
    private final ScoreLedger scoreLedger;
    private final RequestValidator requestValidator;

    @Autowired
    public RoundLifecycleService(DocumentStore documentStore,
                                 TournamentRepository tournamentRepository,
                                 ScoreLedger scoreLedger,
                                 RequestValidator requestValidator) {
        this.documentStore = documentStore;
        this.tournamentRepository = tournamentRepository;
        this.scoreLedger = scoreLedger;
        this.requestValidator = requestValidator;
    }

    /**
     * Creates the next round in staging, or reconfigures it if it is already staged.
     */
    public Round stageRound(String tournamentId, RoundOptions options) {
        RoundOptions roundOptions = options != null ? options : new RoundOptions();
        requestValidator.validate(roundOptions);

        Round round = documentStore.runTransaction(tx -> {
            Tournament tournament = tournamentRepository.getTournament(tx, tournamentId);
            requireNotCompleted(tournament);
            if (tournament.isRoundInProgress()) {
                throw new PreconditionFailedException(
                    "Round " + tournament.getCurrentRound() + " is still in progress");
            }
            int nextRound = tournament.getCurrentRound() + 1;
            requireWithinTotalRounds(tournament, nextRound);

            Round staged = tournamentRepository.findRound(tx, tournamentId, nextRound)
                .orElseGet(() -> newRound(tournament, nextRound));
            if (staged.getStatus() != RoundStatus.STAGING) {
                throw new PreconditionFailedException(
                    "Round " + nextRound + " already exists with status " + staged.getStatus().getValue());
            }
            if (roundOptions.getTimerDuration() != null) {
                staged.setTimerDuration(roundOptions.getTimerDuration());
            }
            if (roundOptions.getScoreMultiplier() != null) {
                staged.setScoreMultiplier(roundOptions.getScoreMultiplier());
            }
            staged.setPlayoff(roundOptions.isPlayoff());
            tournamentRepository.saveRound(tx, tournamentId, staged);
            return staged;
        });
        logger.info("Staged round {} of tournament {} (multiplier {}, timer {} min)",
            round.getRoundNumber(), tournamentId, round.getScoreMultiplier(), round.getTimerDuration());
        return round;
    }

    /**
     * Starts the next round: snapshots every active player as a participant and flips the
     * tournament's round flags, all in one transaction.
     *
     * @throws RoundStartException if a round is already in progress or the active players
     *                             cannot fill tables of four exactly
     */
    public Round startRound(String tournamentId) {
        Round round = documentStore.runTransaction(tx -> {
            Tournament tournament = tournamentRepository.getTournament(tx, tournamentId);
            if (tournament.isRoundInProgress()) {
                throw new RoundStartException("Round " + tournament.getCurrentRound() + " is already in progress");
            }
            if (tournament.isCompleted()) {
                throw new RoundStartException("Tournament " + tournamentId + " is completed");
            }
            List<Player> activePlayers = tournamentRepository.findPlayers(tx, tournamentId).stream()
                .filter(player -> !player.isEliminated())
                .toList();
            validateActivePlayerCount(activePlayers.size());

            int nextRound = tournament.getCurrentRound() + 1;
            if (tournament.isCutline() && tournament.getTotalRounds() != null && nextRound > tournament.getTotalRounds()) {
                throw new RoundStartException("All " + tournament.getTotalRounds() + " rounds have been played");
            }

            Instant now = documentStore.serverTimestamp();
            Round started = tournamentRepository.findRound(tx, tournamentId, nextRound)
                .orElseGet(() -> newRound(tournament, nextRound));
            if (started.getStatus() != RoundStatus.STAGING) {
                throw new RoundStartException(
                    "Round " + nextRound + " already exists with status " + started.getStatus().getValue());
            }
            started.setStatus(RoundStatus.IN_PROGRESS);
            started.setStartedAt(now);
            started.setEndedAt(null);
            tournamentRepository.saveRound(tx, tournamentId, started);

            for (Player player : activePlayers) {
                tournamentRepository.saveParticipant(tx, tournamentId, started.getId(), Participant.snapshotOf(player, now));
            }

            Map<String, Object> fields = new HashMap<>();
            fields.put("currentRound", nextRound);
            fields.put("roundInProgress", true);
            if (tournament.getStatus() == TournamentStatus.STAGING) {
                fields.put("status", TournamentStatus.ACTIVE.getValue());
            }
            tx.update(TournamentPaths.tournament(tournamentId), fields);
            return started;
        });
        logger.info("Started round {} of tournament {}", round.getRoundNumber(), tournamentId);
        return round;
    }

    private void validateActivePlayerCount(int count) {
        if (count == 0) {
            throw new RoundStartException("No active players to start a round with");
        }
        if (count % Table.SEATS != 0) {
            throw new RoundStartException(String.format(
                "%d active players cannot fill tables of %d; %d more or %d fewer needed",
                count, Table.SEATS, Table.SEATS - count % Table.SEATS, count % Table.SEATS));
        }
    }

    /**
     * Completes the round in progress. {@code currentRound} keeps its value.
     */
    public Round endRound(String tournamentId) {
        Round round = documentStore.runTransaction(tx -> {
            Tournament tournament = tournamentRepository.getTournament(tx, tournamentId);
            if (!tournament.isRoundInProgress()) {
                throw new PreconditionFailedException("No round in progress for tournament " + tournamentId);
            }
            Round current = findInProgressRound(tx, tournament);
            Instant now = documentStore.serverTimestamp();

            Map<String, Object> roundFields = new HashMap<>();
            roundFields.put("status", RoundStatus.COMPLETED.getValue());
            roundFields.put("endedAt", tournamentRepository.toValue(now));
            tx.update(TournamentPaths.round(tournamentId, current.getId()), roundFields);
            tx.update(TournamentPaths.tournament(tournamentId), Map.of("roundInProgress", false));

            current.setStatus(RoundStatus.COMPLETED);
            current.setEndedAt(now);
            return current;
        });
        logger.info("Ended round {} of tournament {}", round.getRoundNumber(), tournamentId);
        return round;
    }

    /**
     * Puts the latest completed round back in progress, e.g. after ending it by mistake.
     * Participant snapshots taken at its start are kept.
     */
    public Round reopenRound(String tournamentId) {
        Round round = documentStore.runTransaction(tx -> {
            Tournament tournament = tournamentRepository.getTournament(tx, tournamentId);
            requireNotCompleted(tournament);
            if (tournament.isRoundInProgress()) {
                throw new PreconditionFailedException(
                    "Round " + tournament.getCurrentRound() + " is already in progress");
            }
            if (tournament.getCurrentRound() < 1) {
                throw new PreconditionFailedException("No round has been played yet");
            }
            Round latest = tournamentRepository.findRound(tx, tournamentId, tournament.getCurrentRound())
                .orElseThrow(() -> new NotFoundException("Round " + tournament.getCurrentRound() + " not found"));
            if (latest.getStatus() != RoundStatus.COMPLETED) {
                throw new PreconditionFailedException("Round " + latest.getRoundNumber() + " is not completed");
            }

            Map<String, Object> roundFields = new HashMap<>();
            roundFields.put("status", RoundStatus.IN_PROGRESS.getValue());
            roundFields.put("endedAt", null);
            tx.update(TournamentPaths.round(tournamentId, latest.getId()), roundFields);
            tx.update(TournamentPaths.tournament(tournamentId), Map.of("roundInProgress", true));

            latest.setStatus(RoundStatus.IN_PROGRESS);
            latest.setEndedAt(null);
            return latest;
        });
        logger.info("Reopened round {} of tournament {}", round.getRoundNumber(), tournamentId);
        return round;
    }

    /**
     * Changes a round's multiplier. Applies retroactively to every event of the round.
     */
    public Round updateMultiplier(String tournamentId, int roundNumber, double multiplier) {
        validateMultiplier(multiplier);
        Round round = documentStore.runTransaction(tx -> {
            tournamentRepository.getTournament(tx, tournamentId);
            Round existing = tournamentRepository.findRound(tx, tournamentId, roundNumber)
                .orElseThrow(() -> new NotFoundException("Round " + roundNumber + " not found in tournament " + tournamentId));
            tx.update(TournamentPaths.round(tournamentId, existing.getId()), Map.of("scoreMultiplier", multiplier));
            existing.setScoreMultiplier(multiplier);
            return existing;
        });
        logger.info("Set multiplier of round {} in tournament {} to {}", roundNumber, tournamentId, multiplier);
        return round;
    }

    public ScoreEvent recordGame(String tournamentId, String winnerId) {
        return recordGame(tournamentId, winnerId, null, 1);
    }

    /**
     * Records a game result for the round in progress. A negative delta corrects an earlier
     * entry; the ledger itself is never rewritten.
     *
     * @param roundNumber expected round, or {@code null} to use whichever round is in progress
     */
    public ScoreEvent recordGame(String tournamentId, String winnerId, Integer roundNumber, int delta) {
        if (winnerId == null || winnerId.trim().isEmpty()) {
            throw new InvalidRequestException("Winner id cannot be null or empty");
        }
        ScoreEvent event = documentStore.runTransaction(tx -> {
            Tournament tournament = tournamentRepository.getTournament(tx, tournamentId);
            if (!tournament.isRoundInProgress()) {
                throw new PreconditionFailedException("No round in progress for tournament " + tournamentId);
            }
            int currentRound = tournament.getCurrentRound();
            if (roundNumber != null && roundNumber != currentRound) {
                throw new InvalidRequestException(
                    "Round " + roundNumber + " is not the round in progress (" + currentRound + ")");
            }
            Player winner = tournamentRepository.getPlayer(tx, tournamentId, winnerId);
            if (winner.isEliminated()) {
                throw new PreconditionFailedException("Player " + winner.getName() + " has been eliminated");
            }
            return scoreLedger.appendScoreEvent(tx, tournamentId, winnerId, delta, currentRound);
        });
        logger.info("Recorded {}{} for player {} in round {} of tournament {}",
            delta > 0 ? "+" : "", delta, winnerId, event.getRoundNumber(), tournamentId);
        return event;
    }

    public List<Round> listRounds(String tournamentId) {
        return tournamentRepository.findRounds(documentStore, tournamentId);
    }

    private Round findInProgressRound(Transaction tx, Tournament tournament) {
        return tournamentRepository.findRound(tx, tournament.getId(), tournament.getCurrentRound())
            .filter(round -> round.getStatus() == RoundStatus.IN_PROGRESS)
            .orElseThrow(() -> new NotFoundException(
                "Round " + tournament.getCurrentRound() + " is flagged in progress but was not found"));
    }

    private Round newRound(Tournament tournament, int roundNumber) {
        return Round.builder()
            .id(documentStore.generateId())
            .roundNumber(roundNumber)
            .status(RoundStatus.STAGING)
            .scoreMultiplier(Round.DEFAULT_MULTIPLIER)
            .timerDuration(tournament.getTimerDuration())
            .createdAt(documentStore.serverTimestamp())
            .build();
    }

    private static void validateMultiplier(double multiplier) {
        if (!(multiplier > 0) || multiplier > MAX_MULTIPLIER) {
            throw new InvalidRequestException("Score multiplier must be greater than 0 and at most " + MAX_MULTIPLIER);
        }
    }

    private static void requireNotCompleted(Tournament tournament) {
        if (tournament.isCompleted()) {
            throw new PreconditionFailedException("Tournament " + tournament.getId() + " is completed");
        }
    }

    private static void requireWithinTotalRounds(Tournament tournament, int roundNumber) {
        if (tournament.isCutline() && tournament.getTotalRounds() != null && roundNumber > tournament.getTotalRounds()) {
            throw new PreconditionFailedException("Tournament has only " + tournament.getTotalRounds() + " rounds");
        }
    }
}
