package com.tournament.platform.repository.impl;

import com.tournament.platform.exception.NotFoundException;
import com.tournament.platform.repository.FieldValue;
import com.tournament.platform.repository.TournamentPaths;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class JpaDocumentStoreTest {
    
    private static final Instant NOW = Instant.parse("2024-03-01T18:00:00Z");
    private static final String PLAYER = TournamentPaths.player("t1", "p1");
    
    @Autowired
    private StoredDocumentJpaRepository jpaRepository;
    
    @Autowired
    private PlatformTransactionManager transactionManager;
    
    private JpaDocumentStore store;
    
    @BeforeEach
    void setUp() {
        store = new JpaDocumentStore(jpaRepository, transactionManager, Clock.fixed(NOW, ZoneOffset.UTC), 3);
    }
    
    @AfterEach
    void tearDown() {
        jpaRepository.deleteAll();
    }
    
    @Test
    void testSetGetAndList() {
        // Act
        store.set(PLAYER, document("name", "Alice", "wins", 0));
        store.set(TournamentPaths.player("t1", "p2"), document("name", "Bob", "wins", 0));
        store.set(TournamentPaths.player("t2", "p3"), document("name", "Carol", "wins", 0));
        
        // Assert
        assertEquals("Alice", store.get(PLAYER).orElseThrow().get("name"));
        assertEquals(2, store.list(TournamentPaths.players("t1")).size());
        assertTrue(store.get(TournamentPaths.player("t1", "missing")).isEmpty());
    }
    
    @Test
    void testUpdate_AppliesFieldTransforms() {
        // Arrange
        store.set(PLAYER, document("name", "Alice", "wins", 1));
        
        // Act
        store.update(PLAYER, Map.of(
            "wins", FieldValue.increment(1),
            "scoreEvents", FieldValue.arrayAppend(Map.of("delta", 1, "roundNumber", 1)),
            "lastWinAt", FieldValue.serverTimestamp()));
        store.atomicIncrement(PLAYER, "wins", 1);
        
        // Assert
        Map<String, Object> player = store.get(PLAYER).orElseThrow();
        assertEquals(3, player.get("wins"));
        assertEquals(1, ((List<?>) player.get("scoreEvents")).size());
        assertEquals(NOW.toString(), player.get("lastWinAt"));
    }
    
    @Test
    void testUpdate_MissingDocument() {
        // Act & Assert
        assertThrows(NotFoundException.class, () -> store.update(PLAYER, Map.of("wins", 1)));
    }
    
    @Test
    void testRunTransaction_CommitsTogether() {
        // Act
        int seen = store.runTransaction(tx -> {
            tx.set(PLAYER, document("name", "Alice"));
            tx.set(TournamentPaths.player("t1", "p2"), document("name", "Bob"));
            tx.update(PLAYER, Map.of("wins", 4));
            return tx.list(TournamentPaths.players("t1")).size();
        });
        
        // Assert
        assertEquals(2, seen);
        assertEquals(4, store.get(PLAYER).orElseThrow().get("wins"));
    }
    
    @Test
    void testRunTransaction_ExceptionRollsBack() {
        // Arrange
        store.set(PLAYER, document("name", "Alice", "wins", 0));
        
        // Act
        assertThrows(IllegalStateException.class, () -> store.runTransaction(tx -> {
            tx.update(PLAYER, Map.of("wins", 9));
            tx.set(TournamentPaths.player("t1", "p2"), document("name", "Bob"));
            tx.delete(PLAYER);
            throw new IllegalStateException("abort");
        }));
        
        // Assert
        assertEquals(0, store.get(PLAYER).orElseThrow().get("wins"));
        assertTrue(store.get(TournamentPaths.player("t1", "p2")).isEmpty());
    }
    
    private static Map<String, Object> document(Object... keysAndValues) {
        Map<String, Object> document = new HashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            document.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return document;
    }
}
