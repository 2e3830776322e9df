package com.tournament.platform.service;

import com.tournament.platform.model.IntegrityWarning;
import com.tournament.platform.model.Player;
import com.tournament.platform.model.Position;
import com.tournament.platform.model.Round;
import com.tournament.platform.model.RoundMultipliers;
import com.tournament.platform.model.RoundStatus;
import com.tournament.platform.model.ScoreEvent;
import com.tournament.platform.model.Table;
import com.tournament.platform.model.Tournament;
import com.tournament.platform.repository.DocumentStore;
import com.tournament.platform.repository.TournamentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Finds data problems that do not stop the tournament from running. Warnings are logged
 * and returned; nothing is changed.
 */
@Service
public class IntegrityAuditService {

    private static final Logger logger = LoggerFactory.getLogger(IntegrityAuditService.class);

    private final DocumentStore documentStore;
    private final TournamentRepository tournamentRepository;
    private final ScoreLedger scoreLedger;

    @Autowired
    public IntegrityAuditService(DocumentStore documentStore,
                                 TournamentRepository tournamentRepository,
                                 ScoreLedger scoreLedger) {
        this.documentStore = documentStore;
        this.tournamentRepository = tournamentRepository;
        this.scoreLedger = scoreLedger;
    }

    public List<IntegrityWarning> audit(String tournamentId) {
        Tournament tournament = tournamentRepository.getTournament(documentStore, tournamentId);
        List<Player> players = tournamentRepository.findPlayers(documentStore, tournamentId);
        List<Table> tables = tournamentRepository.findTables(documentStore, tournamentId);
        List<Round> rounds = tournamentRepository.findRounds(documentStore, tournamentId);
        RoundMultipliers multipliers = RoundMultipliers.from(rounds);

        Map<String, Player> playersById = players.stream()
            .collect(Collectors.toMap(Player::getId, Function.identity()));
        Map<String, Table> tablesById = tables.stream()
            .collect(Collectors.toMap(Table::getId, Function.identity()));

        List<IntegrityWarning> warnings = new ArrayList<>();
        for (Player player : players) {
            checkPlayer(player, tablesById, multipliers, warnings);
        }
        for (Table table : tables) {
            checkTable(table, playersById, warnings);
        }
        checkRoundState(tournament, rounds, warnings);

        warnings.forEach(warning -> logger.warn("[{}] {}", warning.getKind(), warning.getMessage()));
        logger.info("Audit of tournament {} found {} warnings", tournamentId, warnings.size());
        return warnings;
    }

    private void checkPlayer(Player player, Map<String, Table> tablesById, RoundMultipliers multipliers,
                             List<IntegrityWarning> warnings) {
        if (player.isSeated()) {
            Table table = tablesById.get(player.getTableId());
            if (table == null) {
                warnings.add(warning(IntegrityWarning.Kind.ORPHANED_PLAYER_TABLE, player.getId(),
                    player.getName() + " points at missing table " + player.getTableId()));
            } else if (!table.getPlayers().contains(player.getId())) {
                warnings.add(warning(IntegrityWarning.Kind.ORPHANED_PLAYER_TABLE, player.getId(),
                    player.getName() + " points at table " + table.getTableNumber() + " which does not list them"));
            }
            if (player.isEliminated()) {
                warnings.add(warning(IntegrityWarning.Kind.ELIMINATED_PLAYER_SEATED, player.getId(),
                    player.getName() + " is eliminated but still seated at " + player.getTableId()));
            }
        }

        warnings.addAll(scoreLedger.inspect(player, multipliers));

        int deltaSum = player.getScoreEvents() == null ? 0
            : player.getScoreEvents().stream().mapToInt(ScoreEvent::getDelta).sum();
        if (deltaSum != player.getWins()) {
            warnings.add(warning(IntegrityWarning.Kind.WINS_MISMATCH, player.getId(),
                String.format("%s has %d wins but score events sum to %d", player.getName(), player.getWins(), deltaSum)));
        }
    }

    private void checkTable(Table table, Map<String, Player> playersById, List<IntegrityWarning> warnings) {
        List<String> members = table.getPlayers() == null ? List.of() : table.getPlayers();
        Map<String, Position> positions = table.getPositions() == null ? Map.of() : table.getPositions();
        boolean wellFormed = members.size() == Table.SEATS
            && new HashSet<>(members).size() == Table.SEATS
            && positions.keySet().equals(new HashSet<>(members))
            && new HashSet<>(positions.values()).size() == Table.SEATS;
        if (!wellFormed) {
            warnings.add(warning(IntegrityWarning.Kind.MALFORMED_TABLE, table.getId(),
                "Table " + table.getTableNumber() + " does not seat exactly four distinct players at distinct positions"));
        }
        for (String playerId : members) {
            Player player = playersById.get(playerId);
            if (player == null) {
                warnings.add(warning(IntegrityWarning.Kind.ORPHANED_TABLE_PLAYER, table.getId(),
                    "Table " + table.getTableNumber() + " lists missing player " + playerId));
            } else if (!table.getId().equals(player.getTableId())) {
                warnings.add(warning(IntegrityWarning.Kind.ORPHANED_TABLE_PLAYER, table.getId(),
                    "Table " + table.getTableNumber() + " lists " + player.getName() + " who is seated elsewhere"));
            }
        }
    }

    private void checkRoundState(Tournament tournament, List<Round> rounds, List<IntegrityWarning> warnings) {
        List<Round> inProgress = rounds.stream()
            .filter(round -> round.getStatus() == RoundStatus.IN_PROGRESS)
            .toList();
        if (tournament.isRoundInProgress()) {
            boolean matches = inProgress.size() == 1 && inProgress.get(0).getRoundNumber() == tournament.getCurrentRound();
            if (!matches) {
                warnings.add(warning(IntegrityWarning.Kind.ROUND_STATE_MISMATCH, tournament.getId(),
                    "Round " + tournament.getCurrentRound() + " is flagged in progress but "
                        + inProgress.size() + " rounds are in progress"));
            }
        } else if (!inProgress.isEmpty()) {
            warnings.add(warning(IntegrityWarning.Kind.ROUND_STATE_MISMATCH, tournament.getId(),
                "No round is flagged in progress but round " + inProgress.get(0).getRoundNumber() + " is"));
        }
    }

    private static IntegrityWarning warning(IntegrityWarning.Kind kind, String subjectId, String message) {
        return IntegrityWarning.builder().kind(kind).subjectId(subjectId).message(message).build();
    }
}
