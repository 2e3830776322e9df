package com.tournament.platform.service;

import com.tournament.platform.exception.NotFoundException;
import com.tournament.platform.model.Participant;
import com.tournament.platform.model.ParticipantProgress;
import com.tournament.platform.model.Player;
import com.tournament.platform.model.RankedPlayer;
import com.tournament.platform.model.Round;
import com.tournament.platform.model.RoundMultipliers;
import com.tournament.platform.model.RoundStatus;
import com.tournament.platform.repository.DocumentAccess;
import com.tournament.platform.repository.DocumentStore;
import com.tournament.platform.repository.TournamentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class StandingsService {

    private static final Logger logger = LoggerFactory.getLogger(StandingsService.class);

    private final DocumentStore documentStore;
    private final TournamentRepository tournamentRepository;
    private final RankingEngine rankingEngine;
    private final ScoreLedger scoreLedger;

    @Autowired
    public StandingsService(DocumentStore documentStore,
                            TournamentRepository tournamentRepository,
                            RankingEngine rankingEngine,
                            ScoreLedger scoreLedger) {
        this.documentStore = documentStore;
        this.tournamentRepository = tournamentRepository;
        this.rankingEngine = rankingEngine;
        this.scoreLedger = scoreLedger;
    }

    /**
     * Current standings of the active players, best first. May run while scores are being
     * recorded; the result reflects the events committed when each player was read.
     */
    public List<RankedPlayer> standings(String tournamentId) {
        tournamentRepository.getTournament(documentStore, tournamentId);
        List<Player> players = tournamentRepository.findPlayers(documentStore, tournamentId);
        List<RankedPlayer> ranked = rank(documentStore, tournamentId, players);
        logger.debug("Ranked {} active players of tournament {}", ranked.size(), tournamentId);
        return ranked;
    }

    /**
     * Ranks the given players using the rounds and snapshots visible through {@code db}.
     */
    public List<RankedPlayer> rank(DocumentAccess db, String tournamentId, List<Player> players) {
        List<Round> rounds = tournamentRepository.findRounds(db, tournamentId);
        int lastCompleted = RoundMultipliers.from(rounds).getLastCompletedRound();
        List<Participant> participants = rounds.stream()
            .filter(round -> round.getRoundNumber() == lastCompleted && round.getStatus() == RoundStatus.COMPLETED)
            .findFirst()
            .map(round -> tournamentRepository.findParticipants(db, tournamentId, round.getId()))
            .orElse(List.of());
        return rankingEngine.rank(players, rounds, participants);
    }

    /**
     * Wins each participant gained in the round, measured against the snapshot taken when
     * the round started.
     */
    public List<ParticipantProgress> roundProgress(String tournamentId, int roundNumber) {
        List<Round> rounds = tournamentRepository.findRounds(documentStore, tournamentId);
        Round round = rounds.stream()
            .filter(r -> r.getRoundNumber() == roundNumber)
            .findFirst()
            .orElseThrow(() -> new NotFoundException("Round " + roundNumber + " not found in tournament " + tournamentId));
        RoundMultipliers multipliers = RoundMultipliers.from(rounds);
        Map<String, Player> players = tournamentRepository.findPlayers(documentStore, tournamentId).stream()
            .collect(Collectors.toMap(Player::getId, Function.identity()));

        return tournamentRepository.findParticipants(documentStore, tournamentId, round.getId()).stream()
            .map(participant -> progressOf(participant, players.get(participant.getPlayerId()), roundNumber, multipliers))
            .sorted(Comparator.comparingInt(ParticipantProgress::getWinsGained).reversed()
                .thenComparing(ParticipantProgress::getName, String.CASE_INSENSITIVE_ORDER))
            .toList();
    }

    private ParticipantProgress progressOf(Participant participant, Player player, int roundNumber,
                                           RoundMultipliers multipliers) {
        // a player removed since the snapshot keeps the snapshot values
        int currentWins = player != null ? player.getWins() : participant.getWins();
        double roundScore = player != null ? scoreLedger.roundScore(player, roundNumber, multipliers) : 0.0;
        return ParticipantProgress.builder()
            .playerId(participant.getPlayerId())
            .name(participant.getName())
            .tableId(participant.getTableId())
            .position(participant.getPosition())
            .snapshotWins(participant.getWins())
            .currentWins(currentWins)
            .winsGained(currentWins - participant.getWins())
            .roundScore(roundScore)
            .build();
    }
}
