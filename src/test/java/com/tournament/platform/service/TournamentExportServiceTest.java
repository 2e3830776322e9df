package com.tournament.platform.service;

import com.tournament.platform.dto.CreateTournamentRequest;
import com.tournament.platform.dto.ExportedRound;
import com.tournament.platform.dto.IdRemapping;
import com.tournament.platform.dto.TournamentExport;
import com.tournament.platform.exception.InvalidRequestException;
import com.tournament.platform.exception.PreconditionFailedException;
import com.tournament.platform.model.AssignmentAlgorithm;
import com.tournament.platform.model.Participant;
import com.tournament.platform.model.Player;
import com.tournament.platform.model.Position;
import com.tournament.platform.model.Table;
import com.tournament.platform.model.Tournament;
import com.tournament.platform.model.TournamentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class TournamentExportServiceTest {
    
    private EngineFixture engine;
    private TournamentExportService exportService;
    private Tournament tournament;
    
    @BeforeEach
    void setUp() {
        engine = new EngineFixture();
        exportService = engine.exportService;
        tournament = engine.tournamentService.createTournament(CreateTournamentRequest.builder()
            .name("Export Cup")
            .type(TournamentType.CUTLINE)
            .totalRounds(3)
            .tournamentCode("EXPO")
            .build());
        List<Player> players = engine.registerPlayers(tournament.getId(), 8);
        engine.tableAssignmentService.autoAssign(tournament.getId(), AssignmentAlgorithm.RANDOM);
        engine.roundLifecycleService.startRound(tournament.getId());
        engine.recordWins(tournament.getId(), players.get(0), 2);
        engine.recordWins(tournament.getId(), players.get(5), 1);
        engine.roundLifecycleService.endRound(tournament.getId());
        engine.roundLifecycleService.updateMultiplier(tournament.getId(), 1, 1.5);
    }
    
    @Test
    void testExport_ContainsWholeTournament() {
        // Act
        TournamentExport export = exportService.export(tournament.getId());
        
        // Assert
        assertEquals(TournamentExport.CURRENT_VERSION, export.getExportVersion());
        assertEquals(tournament.getId(), export.getTournamentId());
        assertNotNull(export.getExportedAt());
        assertEquals(8, export.getPlayers().size());
        assertEquals(2, export.getTables().size());
        assertEquals(1, export.getRounds().size());
        assertEquals(8, export.getRounds().get(0).getParticipants().size());
        assertEquals(1.5, export.getRounds().get(0).getRound().getScoreMultiplier());
    }
    
    @Test
    void testImport_RoundTripPreservesStructure() {
        // Arrange
        TournamentExport original = exportService.export(tournament.getId());
        AtomicInteger counter = new AtomicInteger();
        IdRemapping remapping = new IdRemapping(() -> "new-" + counter.incrementAndGet());
        
        // Act
        Tournament imported = exportService.importState(original, remapping);
        TournamentExport reexported = exportService.export(imported.getId());
        
        // Assert
        assertNotEquals(tournament.getId(), imported.getId());
        assertNotEquals("EXPO", imported.getTournamentCode());
        assertEquals(tournament.getName(), imported.getName());
        assertEquals(tournament.getCurrentRound(), imported.getCurrentRound());
        assertEquals(tournament.getLastTableNumber(), imported.getLastTableNumber());
        
        assertEquals(byId(remapPlayers(original.getPlayers(), remapping)), byId(reexported.getPlayers()));
        assertEquals(remapTables(original.getTables(), remapping), reexported.getTables());
        
        ExportedRound originalRound = original.getRounds().get(0);
        ExportedRound importedRound = reexported.getRounds().get(0);
        assertEquals(remapping.roundId(originalRound.getRound().getId()), importedRound.getRound().getId());
        assertEquals(originalRound.getRound().getScoreMultiplier(), importedRound.getRound().getScoreMultiplier());
        assertEquals(originalRound.getRound().getStartedAt(), importedRound.getRound().getStartedAt());
        assertEquals(sortedParticipants(remapParticipants(originalRound.getParticipants(), remapping)),
            sortedParticipants(importedRound.getParticipants()));
        
        assertEquals(summary(tournament.getId()), summary(imported.getId()));
    }
    
    @Test
    void testImport_ThroughFileIntoFreshStore(@TempDir Path directory) throws Exception {
        // Arrange
        Path file = directory.resolve("export.json");
        exportService.writeExport(exportService.export(tournament.getId()), file);
        EngineFixture other = new EngineFixture();
        
        // Act
        TournamentExport read = other.exportService.readExport(file);
        Tournament imported = other.exportService.importState(read);
        
        // Assert
        assertTrue(Files.readString(file).contains("\"export_version\""));
        assertEquals("EXPO", imported.getTournamentCode());
        assertEquals(8, other.playerService.listPlayers(imported.getId()).size());
        assertEquals(2, other.tableAssignmentService.listTables(imported.getId()).size());
        assertEquals(List.of(), other.auditService.audit(imported.getId()));
        assertEquals(engine.standingsService.standings(tournament.getId()).get(0).getName(),
            other.standingsService.standings(imported.getId()).get(0).getName());
        assertEquals(3.0, other.standingsService.standings(imported.getId()).get(0).getTournamentScore());
    }
    
    @Test
    void testImport_ExistingTournamentIdRejected() {
        // Arrange
        TournamentExport export = exportService.export(tournament.getId());
        IdRemapping remapping = new IdRemapping(engine.store::generateId, tournament.getId(), Map.of(), Map.of(), Map.of());
        
        // Act & Assert
        assertThrows(PreconditionFailedException.class, () -> exportService.importState(export, remapping));
    }
    
    @Test
    void testImport_UnsupportedVersion() {
        // Arrange
        TournamentExport export = exportService.export(tournament.getId());
        export.setExportVersion("0.1");
        
        // Act & Assert
        assertThrows(InvalidRequestException.class, () -> exportService.importState(export));
        assertEquals(1, engine.tournamentService.listTournaments().size());
    }
    
    private List<String> summary(String tournamentId) {
        return engine.standingsService.standings(tournamentId).stream()
            .map(ranked -> ranked.getName() + "=" + ranked.getTournamentScore())
            .toList();
    }
    
    private static List<Player> remapPlayers(List<Player> players, IdRemapping remapping) {
        return players.stream().map(player -> Player.builder()
            .id(remapping.playerId(player.getId()))
            .name(player.getName())
            .wins(player.getWins())
            .points(player.getPoints())
            .scoreEvents(player.getScoreEvents())
            .lastWinAt(player.getLastWinAt())
            .tableId(remapping.tableId(player.getTableId()))
            .position(player.getPosition())
            .eliminated(player.isEliminated())
            .eliminatedInRound(player.getEliminatedInRound())
            .addedAt(player.getAddedAt())
            .build()).toList();
    }
    
    private static List<Table> remapTables(List<Table> tables, IdRemapping remapping) {
        return tables.stream().map(table -> {
            Map<String, Position> positions = new LinkedHashMap<>();
            table.getPositions().forEach((playerId, position) -> positions.put(remapping.playerId(playerId), position));
            return Table.builder()
                .id(remapping.tableId(table.getId()))
                .tableNumber(table.getTableNumber())
                .players(table.getPlayers().stream().map(remapping::playerId).toList())
                .positions(positions)
                .createdAt(table.getCreatedAt())
                .build();
        }).toList();
    }
    
    private static List<Participant> remapParticipants(List<Participant> participants, IdRemapping remapping) {
        return participants.stream().map(participant -> participant.toBuilder()
            .id(remapping.playerId(participant.getPlayerId()))
            .playerId(remapping.playerId(participant.getPlayerId()))
            .tableId(remapping.tableId(participant.getTableId()))
            .build()).toList();
    }
    
    private static List<Player> byId(List<Player> players) {
        return players.stream().sorted(Comparator.comparing(Player::getId)).toList();
    }
    
    private static List<Participant> sortedParticipants(List<Participant> participants) {
        return participants.stream().sorted(Comparator.comparing(Participant::getPlayerId)).toList();
    }
}
