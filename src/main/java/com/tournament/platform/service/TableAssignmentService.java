package com.tournament.platform.service;

import com.tournament.platform.exception.InvalidRequestException;
import com.tournament.platform.exception.NotFoundException;
import com.tournament.platform.exception.PreconditionFailedException;
import com.tournament.platform.model.AssignmentAlgorithm;
import com.tournament.platform.model.AssignmentPlan;
import com.tournament.platform.model.AssignmentResult;
import com.tournament.platform.model.Player;
import com.tournament.platform.model.Position;
import com.tournament.platform.model.RankedPlayer;
import com.tournament.platform.model.Table;
import com.tournament.platform.model.Tournament;
import com.tournament.platform.repository.DocumentAccess;
import com.tournament.platform.repository.DocumentStore;
import com.tournament.platform.repository.TournamentPaths;
import com.tournament.platform.repository.TournamentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Seats players at tables. Each table is written in its own transaction together with
 * the seat of each of its four players, so a table never exists half-filled.
 */
@Service
public class TableAssignmentService {

    private static final Logger logger = LoggerFactory.getLogger(TableAssignmentService.class);

    private final DocumentStore documentStore;
    private final TournamentRepository tournamentRepository;
    private final TableAssigner tableAssigner;
    private final StandingsService standingsService;

    @Autowired
    public TableAssignmentService(DocumentStore documentStore,
                                  TournamentRepository tournamentRepository,
                                  TableAssigner tableAssigner,
                                  StandingsService standingsService) {
        this.documentStore = documentStore;
        this.tournamentRepository = tournamentRepository;
        this.tableAssigner = tableAssigner;
        this.standingsService = standingsService;
    }

    /**
     * Seats every unassigned active player at new tables. Players left over when the count
     * is not a multiple of four are reported in the result, never dropped silently.
     */
    public AssignmentResult autoAssign(String tournamentId, AssignmentAlgorithm algorithm) {
        Tournament tournament = tournamentRepository.getTournament(documentStore, tournamentId);
        requireTablesEditable(tournament);

        List<Player> players = tournamentRepository.findPlayers(documentStore, tournamentId);
        List<Player> eligible = players.stream()
            .filter(player -> !player.isEliminated() && !player.isSeated())
            .toList();
        if (eligible.size() < Table.SEATS) {
            throw new PreconditionFailedException(
                "At least " + Table.SEATS + " unassigned active players are required, found " + eligible.size());
        }

        int upcomingRound = tournament.getCurrentRound() + 1;
        List<Player> ordered = algorithm != null && algorithm.needsRanking() && upcomingRound > 1
            ? inRankingOrder(tournamentId, players, eligible)
            : eligible;
        AssignmentPlan plan = tableAssigner.assign(ordered, algorithm, upcomingRound);

        List<Table> tables = new ArrayList<>();
        for (List<Player> group : plan.getGroups()) {
            tables.add(createTable(tournamentId, group.stream().map(Player::getId).toList()));
        }

        List<String> unassigned = plan.getUnassigned().stream().map(Player::getId).toList();
        List<String> warnings = new ArrayList<>(plan.getWarnings());
        if (!unassigned.isEmpty()) {
            String names = plan.getUnassigned().stream().map(Player::getName).collect(Collectors.joining(", "));
            warnings.add(unassigned.size() + " players left unassigned: " + names);
            logger.warn("{} players left unassigned in tournament {}: {}", unassigned.size(), tournamentId, names);
        }
        logger.info("Assigned {} tables in tournament {} using {}",
            tables.size(), tournamentId, plan.getAlgorithm().getValue());

        return AssignmentResult.builder()
            .algorithm(plan.getAlgorithm())
            .tables(tables)
            .unassignedPlayerIds(unassigned)
            .warnings(warnings)
            .build();
    }

    private List<Player> inRankingOrder(String tournamentId, List<Player> players, List<Player> eligible) {
        Map<String, Integer> places = standingsService.rank(documentStore, tournamentId, players).stream()
            .collect(Collectors.toMap(RankedPlayer::getPlayerId, RankedPlayer::getPlace));
        return eligible.stream()
            .sorted(Comparator.comparingInt(player -> places.getOrDefault(player.getId(), Integer.MAX_VALUE)))
            .toList();
    }

    /**
     * Creates one table for exactly four unseated active players, seated East, South, West,
     * North in the given order.
     */
    public Table createTable(String tournamentId, List<String> playerIds) {
        validateTablePlayers(playerIds);
        Table table = documentStore.runTransaction(tx -> {
            Tournament tournament = tournamentRepository.getTournament(tx, tournamentId);
            requireTablesEditable(tournament);
            for (String playerId : playerIds) {
                Player player = tournamentRepository.getPlayer(tx, tournamentId, playerId);
                if (player.isEliminated()) {
                    throw new PreconditionFailedException("Player " + player.getName() + " has been eliminated");
                }
                if (player.isSeated()) {
                    throw new PreconditionFailedException(
                        "Player " + player.getName() + " is already seated at table " + player.getTableId());
                }
            }

            int tableNumber = nextTableNumber(tx, tournament);
            Table created = Table.builder()
                .id(documentStore.generateId())
                .tableNumber(tableNumber)
                .createdAt(documentStore.serverTimestamp())
                .build();
            for (int seat = 0; seat < playerIds.size(); seat++) {
                String playerId = playerIds.get(seat);
                Position position = Position.SEATING_ORDER.get(seat);
                created.getPlayers().add(playerId);
                created.getPositions().put(playerId, position);
                tx.update(TournamentPaths.player(tournamentId, playerId), seat(created.getId(), position));
            }
            tournamentRepository.saveTable(tx, tournamentId, created);
            tx.update(TournamentPaths.tournament(tournamentId), Map.of("lastTableNumber", tableNumber));
            return created;
        });
        logger.info("Created table {} in tournament {} for players {}", table.getTableNumber(), tournamentId, playerIds);
        return table;
    }

    private static void validateTablePlayers(List<String> playerIds) {
        if (playerIds == null || playerIds.size() != Table.SEATS) {
            throw new InvalidRequestException("A table needs exactly " + Table.SEATS + " players");
        }
        if (new HashSet<>(playerIds).size() != Table.SEATS) {
            throw new InvalidRequestException("A player cannot take two seats at the same table");
        }
    }

    /**
     * Next number after every number ever issued, including tables since deleted.
     */
    private int nextTableNumber(DocumentAccess db, Tournament tournament) {
        int highestExisting = tournamentRepository.findTables(db, tournament.getId()).stream()
            .mapToInt(Table::getTableNumber)
            .max()
            .orElse(0);
        return Math.max(tournament.getLastTableNumber(), highestExisting) + 1;
    }

    /**
     * Deletes a table and unseats its players.
     */
    public void deleteTable(String tournamentId, String tableId) {
        documentStore.runTransaction(tx -> {
            Tournament tournament = tournamentRepository.getTournament(tx, tournamentId);
            requireTablesEditable(tournament);
            Table table = tournamentRepository.findTable(tx, tournamentId, tableId)
                .orElseThrow(() -> new NotFoundException("Table not found: " + tableId));
            dissolve(tx, tournamentId, table);
            return null;
        });
        logger.info("Deleted table {} in tournament {}", tableId, tournamentId);
    }

    /**
     * Deletes every table and unseats all players, ready for a fresh assignment.
     */
    public int clearTables(String tournamentId) {
        int cleared = documentStore.runTransaction(tx -> {
            Tournament tournament = tournamentRepository.getTournament(tx, tournamentId);
            requireTablesEditable(tournament);
            List<Table> tables = tournamentRepository.findTables(tx, tournamentId);
            for (Table table : tables) {
                dissolve(tx, tournamentId, table);
            }
            // players pointing at tables that no longer exist
            Map<String, Table> remaining = tournamentRepository.findTables(tx, tournamentId).stream()
                .collect(Collectors.toMap(Table::getId, Function.identity()));
            for (Player player : tournamentRepository.findPlayers(tx, tournamentId)) {
                if (player.isSeated() && !remaining.containsKey(player.getTableId())) {
                    tx.update(TournamentPaths.player(tournamentId, player.getId()), seat(null, null));
                }
            }
            return tables.size();
        });
        logger.info("Cleared {} tables in tournament {}", cleared, tournamentId);
        return cleared;
    }

    public List<Table> listTables(String tournamentId) {
        return tournamentRepository.findTables(documentStore, tournamentId);
    }

    /**
     * Deletes the table record and unseats the members that still point at it.
     */
    static void dissolve(DocumentAccess db, String tournamentId, Table table, TournamentRepository repository) {
        db.delete(TournamentPaths.table(tournamentId, table.getId()));
        for (String playerId : table.getPlayers()) {
            repository.findPlayer(db, tournamentId, playerId)
                .filter(player -> table.getId().equals(player.getTableId()))
                .ifPresent(player -> db.update(TournamentPaths.player(tournamentId, playerId), seat(null, null)));
        }
    }

    private void dissolve(DocumentAccess db, String tournamentId, Table table) {
        dissolve(db, tournamentId, table, tournamentRepository);
    }

    static Map<String, Object> seat(String tableId, Position position) {
        Map<String, Object> fields = new HashMap<>();
        fields.put("tableId", tableId);
        fields.put("position", position != null ? position.getValue() : null);
        return fields;
    }

    private static void requireTablesEditable(Tournament tournament) {
        if (tournament.isCompleted()) {
            throw new PreconditionFailedException("Tournament " + tournament.getId() + " is completed");
        }
        if (tournament.isRoundInProgress()) {
            throw new PreconditionFailedException(
                "Tables cannot change while round " + tournament.getCurrentRound() + " is in progress");
        }
    }
}
