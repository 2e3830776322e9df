package com.tournament.platform.repository;

import com.tournament.platform.exception.NotFoundException;
import com.tournament.platform.model.Participant;
import com.tournament.platform.model.Player;
import com.tournament.platform.model.Round;
import com.tournament.platform.model.Table;
import com.tournament.platform.model.Tournament;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed access to the tournament documents. Every method takes the {@link DocumentAccess}
 * to use, so the same calls work directly against the store or inside a transaction.
 */
@Repository
public class TournamentRepository {
    
    private final DocumentMapper mapper;
    
    @Autowired
    public TournamentRepository(DocumentMapper mapper) {
        this.mapper = mapper;
    }
    
    public Optional<Tournament> findTournament(DocumentAccess db, String tournamentId) {
        return db.get(TournamentPaths.tournament(tournamentId))
            .map(doc -> mapper.fromDocument(doc, Tournament.class));
    }
    
    public Tournament getTournament(DocumentAccess db, String tournamentId) {
        return findTournament(db, tournamentId)
            .orElseThrow(() -> new NotFoundException("Tournament not found: " + tournamentId));
    }
    
    public List<Tournament> findAllTournaments(DocumentAccess db) {
        return db.list(TournamentPaths.TOURNAMENTS).stream()
            .map(doc -> mapper.fromDocument(doc, Tournament.class))
            .toList();
    }
    
    public List<Player> findPlayers(DocumentAccess db, String tournamentId) {
        return db.list(TournamentPaths.players(tournamentId)).stream()
            .map(doc -> mapper.fromDocument(doc, Player.class))
            .sorted(Comparator.comparing(Player::getName, String.CASE_INSENSITIVE_ORDER)
                .thenComparing(Player::getId))
            .toList();
    }
    
    public Optional<Player> findPlayer(DocumentAccess db, String tournamentId, String playerId) {
        return db.get(TournamentPaths.player(tournamentId, playerId))
            .map(doc -> mapper.fromDocument(doc, Player.class));
    }
    
    public Player getPlayer(DocumentAccess db, String tournamentId, String playerId) {
        return findPlayer(db, tournamentId, playerId)
            .orElseThrow(() -> new NotFoundException("Player not found: " + playerId));
    }
    
    public List<Table> findTables(DocumentAccess db, String tournamentId) {
        return db.list(TournamentPaths.tables(tournamentId)).stream()
            .map(doc -> mapper.fromDocument(doc, Table.class))
            .sorted(Comparator.comparingInt(Table::getTableNumber))
            .toList();
    }
    
    public Optional<Table> findTable(DocumentAccess db, String tournamentId, String tableId) {
        return db.get(TournamentPaths.table(tournamentId, tableId))
            .map(doc -> mapper.fromDocument(doc, Table.class));
    }
    
    public List<Round> findRounds(DocumentAccess db, String tournamentId) {
        return db.list(TournamentPaths.rounds(tournamentId)).stream()
            .map(doc -> mapper.fromDocument(doc, Round.class))
            .sorted(Comparator.comparingInt(Round::getRoundNumber))
            .toList();
    }
    
    public Optional<Round> findRound(DocumentAccess db, String tournamentId, int roundNumber) {
        return findRounds(db, tournamentId).stream()
            .filter(round -> round.getRoundNumber() == roundNumber)
            .findFirst();
    }
    
    public List<Participant> findParticipants(DocumentAccess db, String tournamentId, String roundId) {
        return db.list(TournamentPaths.participants(tournamentId, roundId)).stream()
            .map(doc -> mapper.fromDocument(doc, Participant.class))
            .toList();
    }
    
    public void saveTournament(DocumentAccess db, Tournament tournament) {
        db.set(TournamentPaths.tournament(tournament.getId()), mapper.toDocument(tournament));
    }
    
    public void savePlayer(DocumentAccess db, String tournamentId, Player player) {
        db.set(TournamentPaths.player(tournamentId, player.getId()), mapper.toDocument(player));
    }
    
    public void saveTable(DocumentAccess db, String tournamentId, Table table) {
        db.set(TournamentPaths.table(tournamentId, table.getId()), mapper.toDocument(table));
    }
    
    public void saveRound(DocumentAccess db, String tournamentId, Round round) {
        db.set(TournamentPaths.round(tournamentId, round.getId()), mapper.toDocument(round));
    }
    
    public void saveParticipant(DocumentAccess db, String tournamentId, String roundId, Participant participant) {
        db.set(TournamentPaths.participant(tournamentId, roundId, participant.getPlayerId()),
            mapper.toDocument(participant));
    }
    
    /**
     * Field values in document form, for partial updates.
     */
    public Object toValue(Object value) {
        return mapper.toValue(value);
    }
    
    public Map<String, Object> toDocument(Object model) {
        return mapper.toDocument(model);
    }
}
