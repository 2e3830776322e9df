package com.tournament.platform.service;

import com.tournament.platform.model.Player;
import com.tournament.platform.model.RepairReport;
import com.tournament.platform.model.Round;
import com.tournament.platform.model.ScoreEvent;
import com.tournament.platform.model.Tournament;
import com.tournament.platform.repository.FieldValue;
import com.tournament.platform.repository.TournamentPaths;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ScoreEventRepairServiceTest {
    
    private EngineFixture engine;
    private ScoreEventRepairService repairService;
    private Tournament tournament;
    private Player player;
    
    @BeforeEach
    void setUp() {
        engine = new EngineFixture();
        repairService = engine.repairService;
        tournament = engine.standardTournament();
        List<Player> players = engine.registerPlayers(tournament.getId(), 4);
        player = players.get(0);
        
        engine.clock.advance(Duration.ofMinutes(1));
        engine.roundLifecycleService.startRound(tournament.getId());
        engine.clock.advance(Duration.ofMinutes(2));
        appendLegacyEvent();
        engine.clock.advance(Duration.ofMinutes(2));
        engine.roundLifecycleService.recordGame(tournament.getId(), player.getId());
        engine.clock.advance(Duration.ofMinutes(2));
        engine.roundLifecycleService.endRound(tournament.getId());
        engine.clock.advance(Duration.ofMinutes(5));
        appendLegacyEvent();
        engine.clock.advance(Duration.ofMinutes(5));
        engine.roundLifecycleService.startRound(tournament.getId());
        engine.clock.advance(Duration.ofMinutes(3));
        appendLegacyEvent();
    }
    
    @Test
    void testRepair_DryRunChangesNothing() {
        // Act
        RepairReport report = repairService.repair(tournament.getId(), false);
        
        // Assert
        assertFalse(report.isApplied());
        assertEquals(2, report.getInferred().size());
        assertEquals(1, report.getUnmatched().size());
        assertEquals(1, report.getInferred().get(0).getInferredRound());
        assertEquals(2, report.getInferred().get(1).getInferredRound());
        assertNull(report.getInferred().get(1).getWindowEnd());
        assertEquals(2, report.getUnmatched().get(0).getEventIndex());
        
        List<ScoreEvent> events = engine.reload(tournament.getId(), player).getScoreEvents();
        assertNull(events.get(0).getRoundNumber());
        assertNull(events.get(3).getRoundNumber());
    }
    
    @Test
    void testRepair_ApplyBackfillsRoundNumbers() {
        // Act
        RepairReport report = repairService.repair(tournament.getId(), true);
        
        // Assert
        assertTrue(report.isApplied());
        assertEquals(1, report.getPlayersUpdated());
        List<ScoreEvent> events = engine.reload(tournament.getId(), player).getScoreEvents();
        assertEquals(4, events.size());
        assertEquals(1, events.get(0).getRoundNumber());
        assertEquals(1, events.get(1).getRoundNumber());
        assertNull(events.get(2).getRoundNumber());
        assertEquals(2, events.get(3).getRoundNumber());
        
        RepairReport second = repairService.repair(tournament.getId(), false);
        assertTrue(second.getInferred().isEmpty());
        assertEquals(1, second.getUnmatched().size());
    }
    
    @Test
    void testInferRound_LatestStartedWindowWins() {
        // Arrange
        Instant start = Instant.parse("2024-03-01T18:00:00Z");
        Round first = Round.builder().roundNumber(1).startedAt(start).build();
        Round second = Round.builder().roundNumber(2).startedAt(start.plusSeconds(600)).endedAt(start.plusSeconds(1200)).build();
        Round staged = Round.builder().roundNumber(3).build();
        List<Round> rounds = List.of(first, second, staged);
        
        // Act & Assert
        assertEquals(1, ScoreEventRepairService.inferRound(rounds, start.plusSeconds(60)).orElseThrow().getRoundNumber());
        assertEquals(2, ScoreEventRepairService.inferRound(rounds, start.plusSeconds(900)).orElseThrow().getRoundNumber());
        assertEquals(2, ScoreEventRepairService.inferRound(rounds, start.plusSeconds(1200)).orElseThrow().getRoundNumber());
        assertTrue(ScoreEventRepairService.inferRound(rounds, start.minusSeconds(1)).isEmpty());
        assertTrue(ScoreEventRepairService.inferRound(rounds, null).isEmpty());
    }
    
    private void appendLegacyEvent() {
        ScoreEvent legacy = ScoreEvent.builder().delta(1).timestamp(engine.clock.instant()).build();
        engine.store.update(TournamentPaths.player(tournament.getId(), player.getId()), Map.of(
            "wins", FieldValue.increment(1),
            "scoreEvents", FieldValue.arrayAppend(engine.repository.toValue(legacy))));
    }
}
