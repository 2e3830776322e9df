package com.tournament.platform.service;

import com.tournament.platform.exception.InvalidRequestException;
import com.tournament.platform.exception.NotFoundException;
import com.tournament.platform.model.IntegrityWarning;
import com.tournament.platform.model.Player;
import com.tournament.platform.model.RoundMultipliers;
import com.tournament.platform.model.ScoreEvent;
import com.tournament.platform.repository.DocumentMapper;
import com.tournament.platform.repository.DocumentStore;
import com.tournament.platform.repository.FieldValue;
import com.tournament.platform.repository.TournamentRepository;
import com.tournament.platform.repository.Transaction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ScoreLedgerTest {
    
    private static final String TOURNAMENT_ID = "t-1";
    private static final String PLAYER_ID = "p-1";
    private static final Instant NOW = Instant.parse("2024-03-01T19:00:00Z");
    
    @Mock
    private DocumentStore documentStore;
    
    private ScoreLedger scoreLedger;
    
    @BeforeEach
    void setUp() {
        scoreLedger = new ScoreLedger(documentStore, new TournamentRepository(new DocumentMapper()));
    }
    
    @Test
    void testAppendScoreEvent_SingleAtomicUpdate() {
        // Arrange
        when(documentStore.serverTimestamp()).thenReturn(NOW);
        
        // Act
        ScoreEvent event = scoreLedger.appendScoreEvent(TOURNAMENT_ID, PLAYER_ID, 1, 2);
        
        // Assert
        assertEquals(1, event.getDelta());
        assertEquals(2, event.getRoundNumber());
        assertEquals(NOW, event.getTimestamp());
        
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> fields = ArgumentCaptor.forClass(Map.class);
        verify(documentStore, times(1)).update(eq("tournaments/t-1/players/p-1"), fields.capture());
        verify(documentStore, never()).set(anyString(), anyMap());
        assertEquals(3, fields.getValue().size());
        assertTrue(fields.getValue().get("wins") instanceof FieldValue);
        assertTrue(fields.getValue().get("scoreEvents") instanceof FieldValue);
        assertEquals(NOW.toString(), fields.getValue().get("lastWinAt"));
    }
    
    @Test
    void testAppendScoreEvent_WritesThroughGivenTransaction() {
        // Arrange
        Transaction transaction = mock(Transaction.class);
        when(documentStore.serverTimestamp()).thenReturn(NOW);
        
        // Act
        ScoreEvent event = scoreLedger.appendScoreEvent(transaction, TOURNAMENT_ID, PLAYER_ID, 1, 3);
        
        // Assert
        assertEquals(3, event.getRoundNumber());
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> fields = ArgumentCaptor.forClass(Map.class);
        verify(transaction).update(eq("tournaments/t-1/players/p-1"), fields.capture());
        verify(documentStore, never()).update(anyString(), anyMap());
        assertEquals(event.getTimestamp().toString(), fields.getValue().get("lastWinAt"));
    }
    
    @Test
    void testAppendScoreEvent_NegativeDeltaLeavesLastWinAt() {
        // Arrange
        when(documentStore.serverTimestamp()).thenReturn(NOW);
        
        // Act
        scoreLedger.appendScoreEvent(TOURNAMENT_ID, PLAYER_ID, -1, 1);
        
        // Assert
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> fields = ArgumentCaptor.forClass(Map.class);
        verify(documentStore).update(anyString(), fields.capture());
        assertFalse(fields.getValue().containsKey("lastWinAt"));
        assertTrue(fields.getValue().containsKey("wins"));
        assertTrue(fields.getValue().containsKey("scoreEvents"));
    }
    
    @Test
    void testAppendScoreEvent_MissingRoundNumberRejected() {
        // Act & Assert
        assertThrows(InvalidRequestException.class,
            () -> scoreLedger.appendScoreEvent(TOURNAMENT_ID, PLAYER_ID, 1, null));
        verifyNoInteractions(documentStore);
    }
    
    @Test
    void testAppendScoreEvent_ZeroDeltaRejected() {
        // Act & Assert
        assertThrows(InvalidRequestException.class,
            () -> scoreLedger.appendScoreEvent(TOURNAMENT_ID, PLAYER_ID, 0, 1));
        verifyNoInteractions(documentStore);
    }
    
    @Test
    void testAppendScoreEvent_RoundBelowOneRejected() {
        // Act & Assert
        assertThrows(InvalidRequestException.class,
            () -> scoreLedger.appendScoreEvent(TOURNAMENT_ID, PLAYER_ID, 1, 0));
        verifyNoInteractions(documentStore);
    }
    
    @Test
    void testAppendScoreEvent_PlayerNotFound() {
        // Arrange
        when(documentStore.serverTimestamp()).thenReturn(NOW);
        doThrow(new NotFoundException("Document not found"))
            .when(documentStore).update(anyString(), anyMap());
        
        // Act & Assert
        NotFoundException exception = assertThrows(NotFoundException.class,
            () -> scoreLedger.appendScoreEvent(TOURNAMENT_ID, PLAYER_ID, 1, 1));
        assertTrue(exception.getMessage().contains(PLAYER_ID));
    }
    
    @Test
    void testTournamentScore_AppliesRoundMultipliers() {
        // Arrange
        Player player = playerWith(event(1, 1), event(1, 1), event(1, 2), event(-1, 2), event(1, 2));
        RoundMultipliers multipliers = RoundMultipliers.of(Map.of(1, 1.0, 2, 2.5), 2);
        
        // Act
        double score = scoreLedger.tournamentScore(player, multipliers);
        
        // Assert
        assertEquals(2 * 1.0 + 1 * 2.5, score);
    }
    
    @Test
    void testTournamentScore_UnknownAndUntaggedRoundsCountOnce() {
        // Arrange
        Player player = playerWith(event(1, 7), event(1, null), event(1, 1));
        RoundMultipliers multipliers = RoundMultipliers.of(Map.of(1, 3.0), 1);
        
        // Act
        double score = scoreLedger.tournamentScore(player, multipliers);
        
        // Assert
        assertEquals(1.0 + 1.0 + 3.0, score);
    }
    
    @Test
    void testTournamentScore_CorrectionsCanGoBelowZero() {
        // Arrange
        Player player = playerWith(event(-1, 1), event(-1, 2));
        RoundMultipliers multipliers = RoundMultipliers.of(Map.of(1, 1.0, 2, 2.0), 2);
        
        // Act
        double score = scoreLedger.tournamentScore(player, multipliers);
        
        // Assert
        assertEquals(-3.0, score, 1e-9);
    }
    
    @Test
    void testTournamentScore_IndependentOfEventOrder() {
        // Arrange
        List<ScoreEvent> events = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            events.add(event(i % 5 == 0 ? -1 : 1, 1 + i % 3));
        }
        RoundMultipliers multipliers = RoundMultipliers.of(Map.of(1, 0.1, 2, 0.7, 3, 1.3), 3);
        double expected = scoreLedger.tournamentScore(playerWith(events), multipliers);
        Random random = new Random(11);
        
        // Act & Assert
        for (int attempt = 0; attempt < 20; attempt++) {
            List<ScoreEvent> shuffled = new ArrayList<>(events);
            Collections.shuffle(shuffled, random);
            assertEquals(expected, scoreLedger.tournamentScore(playerWith(shuffled), multipliers));
        }
    }
    
    @Test
    void testRoundScore_OnlyCountsThatRound() {
        // Arrange
        Player player = playerWith(event(1, 1), event(1, 2), event(1, 2));
        RoundMultipliers multipliers = RoundMultipliers.of(Map.of(1, 1.0, 2, 2.0), 2);
        
        // Act & Assert
        assertEquals(4.0, scoreLedger.roundScore(player, 2, multipliers));
        assertEquals(1.0, scoreLedger.roundScore(player, 1, multipliers));
        assertEquals(0.0, scoreLedger.roundScore(player, 3, multipliers));
    }
    
    @Test
    void testInspect_ReportsGuessedEvents() {
        // Arrange
        Player player = playerWith(event(1, 1), event(1, null), event(1, 9));
        RoundMultipliers multipliers = RoundMultipliers.of(Map.of(1, 1.0), 1);
        
        // Act
        List<IntegrityWarning> warnings = scoreLedger.inspect(player, multipliers);
        
        // Assert
        assertEquals(2, warnings.size());
        assertEquals(IntegrityWarning.Kind.MISSING_ROUND_NUMBER, warnings.get(0).getKind());
        assertEquals(IntegrityWarning.Kind.UNKNOWN_ROUND, warnings.get(1).getKind());
    }
    
    private static ScoreEvent event(int delta, Integer roundNumber) {
        return ScoreEvent.builder().delta(delta).roundNumber(roundNumber).timestamp(NOW).build();
    }
    
    private static Player playerWith(ScoreEvent... events) {
        return playerWith(List.of(events));
    }
    
    private static Player playerWith(List<ScoreEvent> events) {
        return Player.builder()
            .id(PLAYER_ID)
            .name("Alice")
            .scoreEvents(new ArrayList<>(events))
            .build();
    }
}
