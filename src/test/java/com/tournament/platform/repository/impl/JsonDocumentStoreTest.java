package com.tournament.platform.repository.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tournament.platform.exception.NotFoundException;
import com.tournament.platform.exception.TransactionFailedException;
import com.tournament.platform.repository.DocumentMapper;
import com.tournament.platform.repository.FieldValue;
import com.tournament.platform.repository.TournamentPaths;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class JsonDocumentStoreTest {
    
    private static final Instant NOW = Instant.parse("2024-03-01T18:00:00Z");
    private static final String PLAYER = TournamentPaths.player("t1", "p1");
    private static final TypeReference<Map<String, Map<String, Object>>> FILE_TYPE = new TypeReference<>() {};
    
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private JsonDocumentStore store;
    
    @BeforeEach
    void setUp() {
        store = new JsonDocumentStore("", clock);
    }
    
    @Test
    void testGet_ReturnsCopies() {
        // Arrange
        store.set(PLAYER, document("name", "Alice", "wins", 0));
        
        // Act
        Map<String, Object> read = store.get(PLAYER).orElseThrow();
        read.put("name", "Mallory");
        
        // Assert
        assertEquals("Alice", store.get(PLAYER).orElseThrow().get("name"));
        assertEquals(1, store.list(TournamentPaths.players("t1")).size());
        assertTrue(store.list(TournamentPaths.players("t2")).isEmpty());
    }
    
    @Test
    void testUpdate_AppliesFieldTransforms() {
        // Arrange
        store.set(PLAYER, document("name", "Alice", "wins", 1, "points", 1.5));
        
        // Act
        store.update(PLAYER, Map.of(
            "wins", FieldValue.increment(2),
            "points", FieldValue.increment(0.25),
            "scoreEvents", FieldValue.arrayAppend(Map.of("delta", 2)),
            "lastWinAt", FieldValue.serverTimestamp()));
        
        // Assert
        Map<String, Object> player = store.get(PLAYER).orElseThrow();
        assertEquals(3, player.get("wins"));
        assertEquals(1.75, player.get("points"));
        assertEquals(List.of(Map.of("delta", 2)), player.get("scoreEvents"));
        assertEquals(NOW.toString(), player.get("lastWinAt"));
        assertEquals("Alice", player.get("name"));
    }
    
    @Test
    void testUpdate_MissingDocument() {
        // Act & Assert
        assertThrows(NotFoundException.class, () -> store.update(PLAYER, Map.of("wins", 1)));
        assertTrue(store.get(PLAYER).isEmpty());
    }
    
    @Test
    void testAtomicIncrement_ConcurrentWritersLoseNothing() throws Exception {
        // Arrange
        store.set(PLAYER, document("wins", 0));
        ExecutorService executor = Executors.newFixedThreadPool(8);
        List<Future<?>> futures = new ArrayList<>();
        
        // Act
        try {
            for (int i = 0; i < 800; i++) {
                futures.add(executor.submit(() -> store.atomicIncrement(PLAYER, "wins", 1)));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }
        
        // Assert
        assertEquals(800, store.get(PLAYER).orElseThrow().get("wins"));
    }
    
    @Test
    void testRunTransaction_ReadsOwnWrites() {
        // Arrange
        store.set(TournamentPaths.player("t1", "gone"), document("name", "Gone"));
        
        // Act
        List<Map<String, Object>> seen = store.runTransaction(tx -> {
            tx.set(PLAYER, document("name", "Alice", "wins", 0));
            tx.update(PLAYER, Map.of("wins", FieldValue.increment(1)));
            tx.delete(TournamentPaths.player("t1", "gone"));
            assertTrue(store.get(PLAYER).isEmpty(), "Uncommitted write visible outside the transaction");
            return tx.list(TournamentPaths.players("t1"));
        });
        
        // Assert
        assertEquals(1, seen.size());
        assertEquals(1, seen.get(0).get("wins"));
        assertEquals(1, store.get(PLAYER).orElseThrow().get("wins"));
        assertTrue(store.get(TournamentPaths.player("t1", "gone")).isEmpty());
    }
    
    @Test
    void testRunTransaction_ExceptionDiscardsAllWrites() {
        // Arrange
        store.set(PLAYER, document("wins", 0));
        
        // Act
        IllegalStateException exception = assertThrows(IllegalStateException.class, () -> store.runTransaction(tx -> {
            tx.update(PLAYER, Map.of("wins", 5));
            tx.set(TournamentPaths.player("t1", "p2"), document("wins", 0));
            throw new IllegalStateException("abort");
        }));
        
        // Assert
        assertEquals("abort", exception.getMessage());
        assertEquals(0, store.get(PLAYER).orElseThrow().get("wins"));
        assertTrue(store.get(TournamentPaths.player("t1", "p2")).isEmpty());
    }
    
    @Test
    void testPersistence_ReloadsFromDirectory(@TempDir Path directory) throws Exception {
        // Arrange
        JsonDocumentStore persistent = new JsonDocumentStore(directory.toString(), clock);
        persistent.set(TournamentPaths.tournament("t1"), document("name", "Cup"));
        persistent.runTransaction(tx -> {
            tx.set(PLAYER, document("name", "Alice", "wins", 2));
            tx.set(TournamentPaths.participant("t1", "r1", "p1"), document("wins", 1));
            return null;
        });
        persistent.set(TournamentPaths.tournament("t2"), document("name", "Other"));
        
        // Act
        JsonDocumentStore reloaded = new JsonDocumentStore(directory.toString(), clock);
        
        // Assert
        assertTrue(Files.exists(directory.resolve("t1.json")));
        assertTrue(Files.exists(directory.resolve("t2.json")));
        assertEquals("Cup", reloaded.get(TournamentPaths.tournament("t1")).orElseThrow().get("name"));
        assertEquals(2, reloaded.get(PLAYER).orElseThrow().get("wins"));
        assertEquals(1, reloaded.list(TournamentPaths.participants("t1", "r1")).size());
        assertEquals(2, reloaded.list(TournamentPaths.TOURNAMENTS).size());
        
        reloaded.runTransaction(tx -> {
            tx.delete(PLAYER);
            tx.delete(TournamentPaths.participant("t1", "r1", "p1"));
            tx.delete(TournamentPaths.tournament("t1"));
            return null;
        });
        assertFalse(Files.exists(directory.resolve("t1.json")));
    }
    
    @Test
    void testPersistence_FileCurrentWhenTransactionStarts(@TempDir Path directory) throws Exception {
        // Arrange
        JsonDocumentStore persistent = new JsonDocumentStore(directory.toString(), clock);
        persistent.set(PLAYER, document("wins", 0));
        ObjectMapper objectMapper = DocumentMapper.createObjectMapper();
        File file = directory.resolve("t1.json").toFile();
        ExecutorService executor = Executors.newFixedThreadPool(4);
        List<Future<?>> futures = new ArrayList<>();
        List<String> mismatches = new ArrayList<>();
        
        // Act
        try {
            for (int i = 0; i < 400; i++) {
                futures.add(executor.submit(() -> persistent.atomicIncrement(PLAYER, "wins", 1)));
            }
            for (int i = 0; i < 50; i++) {
                persistent.runTransaction(tx -> {
                    Object inMemory = tx.get(PLAYER).orElseThrow().get("wins");
                    try {
                        Map<String, Map<String, Object>> onDisk = objectMapper.readValue(file, FILE_TYPE);
                        Object written = onDisk.get(PLAYER).get("wins");
                        if (!inMemory.equals(written)) {
                            mismatches.add("memory " + inMemory + ", file " + written);
                        }
                    } catch (IOException e) {
                        throw new UncheckedIOException(e);
                    }
                    return null;
                });
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }
        
        // Assert
        assertTrue(mismatches.isEmpty(), "File lagged behind committed writes: " + mismatches);
        assertEquals(400, new JsonDocumentStore(directory.toString(), clock).get(PLAYER).orElseThrow().get("wins"));
    }
    
    @Test
    void testRunTransaction_FailedPersistRollsBack(@TempDir Path directory) throws Exception {
        // Arrange
        Path dataDirectory = directory.resolve("data");
        JsonDocumentStore persistent = new JsonDocumentStore(dataDirectory.toString(), clock);
        Files.delete(dataDirectory);
        Files.createFile(dataDirectory);
        
        // Act & Assert
        assertThrows(TransactionFailedException.class, () -> persistent.runTransaction(tx -> {
            tx.set(PLAYER, document("wins", 1));
            return null;
        }));
        assertTrue(persistent.get(PLAYER).isEmpty());
    }
    
    private static Map<String, Object> document(Object... keysAndValues) {
        Map<String, Object> document = new HashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            document.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return document;
    }
}
