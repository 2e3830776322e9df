package com.tournament.platform.repository.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tournament.platform.exception.NotFoundException;
import com.tournament.platform.exception.TournamentException;
import com.tournament.platform.exception.TransactionFailedException;
import com.tournament.platform.repository.DocumentMapper;
import com.tournament.platform.repository.DocumentStore;
import com.tournament.platform.repository.Documents;
import com.tournament.platform.repository.Transaction;
import com.tournament.platform.repository.TournamentPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Document store kept in memory and persisted as one JSON file per tournament.
 * <p>
 * Single-document writes run concurrently and are serialized per document; they write
 * their tournament's file before releasing the read lock, so a file never holds part of a
 * commit. Transactions hold the write lock for their whole duration, buffer their writes
 * and apply them in one step, so readers never observe a partial commit. A blank data
 * directory keeps everything in memory.
 */
@Repository
@ConditionalOnProperty(name = "tournament.storage.type", havingValue = "json", matchIfMissing = true)
public class JsonDocumentStore implements DocumentStore {

    private static final Logger logger = LoggerFactory.getLogger(JsonDocumentStore.class);
    private static final TypeReference<Map<String, Map<String, Object>>> FILE_TYPE = new TypeReference<>() {};

    private final String dataDirectory;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    // collection path -> document id -> document
    private final Map<String, Map<String, Map<String, Object>>> collections = new ConcurrentHashMap<>();
    private final ReentrantReadWriteLock transactionLock = new ReentrantReadWriteLock();
    // Per-tournament locks to serialize file writes
    private final Map<String, ReentrantLock> rootLocks = new ConcurrentHashMap<>();

    @Autowired
    public JsonDocumentStore(@Value("${tournament.storage.directory:./data/tournaments}") String dataDirectory,
                             Clock clock) {
        this.dataDirectory = dataDirectory == null ? "" : dataDirectory.trim();
        this.clock = clock;
        this.objectMapper = DocumentMapper.createObjectMapper();
        if (isPersistent()) {
            initializeDirectory();
            loadAllDocuments();
        } else {
            logger.info("JSON document store running in memory only");
        }
    }

    private boolean isPersistent() {
        return !dataDirectory.isEmpty();
    }

    private void initializeDirectory() {
        try {
            Path path = Paths.get(dataDirectory);
            if (!Files.exists(path)) {
                Files.createDirectories(path);
            }
        } catch (IOException e) {
            throw new TournamentException("Failed to create data directory: " + dataDirectory, "STORAGE_ERROR", e);
        }
    }

    private void loadAllDocuments() {
        try (Stream<Path> files = Files.list(Paths.get(dataDirectory))) {
            files.filter(p -> p.toString().endsWith(".json")).forEach(this::loadDocuments);
        } catch (IOException e) {
            throw new TournamentException("Failed to list data directory: " + dataDirectory, "STORAGE_ERROR", e);
        }
    }

    private void loadDocuments(Path filePath) {
        try {
            Map<String, Map<String, Object>> documents = objectMapper.readValue(filePath.toFile(), FILE_TYPE);
            documents.forEach(this::putDocument);
            logger.info("Loaded {} documents from {}", documents.size(), filePath.getFileName());
        } catch (IOException e) {
            throw new TournamentException("Failed to load documents from " + filePath, "STORAGE_ERROR", e);
        }
    }

    private void putDocument(String path, Map<String, Object> document) {
        collection(TournamentPaths.parentOf(path)).put(TournamentPaths.idOf(path), document);
    }

    private Map<String, Map<String, Object>> collection(String collectionPath) {
        return collections.computeIfAbsent(collectionPath, k -> new ConcurrentHashMap<>());
    }

    @Override
    public Optional<Map<String, Object>> get(String path) {
        transactionLock.readLock().lock();
        try {
            return Optional.ofNullable(readCommitted(path)).map(Documents::copyOf);
        } finally {
            transactionLock.readLock().unlock();
        }
    }

    private Map<String, Object> readCommitted(String path) {
        Map<String, Map<String, Object>> documents = collections.get(TournamentPaths.parentOf(path));
        return documents == null ? null : documents.get(TournamentPaths.idOf(path));
    }

    @Override
    public List<Map<String, Object>> list(String collectionPath) {
        transactionLock.readLock().lock();
        try {
            return listCommitted(collectionPath).values().stream()
                .map(Documents::copyOf)
                .toList();
        } finally {
            transactionLock.readLock().unlock();
        }
    }

    private Map<String, Map<String, Object>> listCommitted(String collectionPath) {
        Map<String, Map<String, Object>> documents = collections.get(collectionPath);
        return documents == null ? Map.of() : documents;
    }

    @Override
    public void set(String path, Map<String, Object> document) {
        transactionLock.readLock().lock();
        try {
            putDocument(path, Documents.resolve(document, serverTimestamp()));
            logger.debug("Set {}", path);
            persistRoot(TournamentPaths.rootOf(path));
        } finally {
            transactionLock.readLock().unlock();
        }
    }

    @Override
    public void update(String path, Map<String, Object> fields) {
        transactionLock.readLock().lock();
        try {
            Instant now = serverTimestamp();
            collection(TournamentPaths.parentOf(path)).compute(TournamentPaths.idOf(path), (id, current) -> {
                if (current == null) {
                    throw new NotFoundException("Document not found: " + path);
                }
                return Documents.merge(current, fields, now);
            });
            logger.debug("Updated {} fields {}", path, fields.keySet());
            persistRoot(TournamentPaths.rootOf(path));
        } finally {
            transactionLock.readLock().unlock();
        }
    }

    @Override
    public void delete(String path) {
        transactionLock.readLock().lock();
        try {
            Map<String, Map<String, Object>> documents = collections.get(TournamentPaths.parentOf(path));
            if (documents != null) {
                documents.remove(TournamentPaths.idOf(path));
            }
            logger.debug("Deleted {}", path);
            persistRoot(TournamentPaths.rootOf(path));
        } finally {
            transactionLock.readLock().unlock();
        }
    }

    @Override
    public <T> T runTransaction(Function<Transaction, T> work) {
        transactionLock.writeLock().lock();
        try {
            JsonTransaction transaction = new JsonTransaction(serverTimestamp());
            T result = work.apply(transaction);
            commit(transaction.pendingWrites);
            return result;
        } finally {
            transactionLock.writeLock().unlock();
        }
    }

    private void commit(Map<String, Map<String, Object>> writes) {
        if (writes.isEmpty()) {
            return;
        }
        Map<String, Map<String, Object>> previous = new HashMap<>();
        Set<String> roots = new HashSet<>();
        for (Map.Entry<String, Map<String, Object>> write : writes.entrySet()) {
            String path = write.getKey();
            previous.put(path, readCommitted(path));
            applyWrite(path, write.getValue());
            roots.add(TournamentPaths.rootOf(path));
        }
        try {
            for (String root : roots) {
                writeRootFile(root);
            }
            logger.debug("Committed {} writes across {} tournaments", writes.size(), roots.size());
        } catch (IOException e) {
            previous.forEach(this::applyWrite);
            throw new TransactionFailedException("Failed to persist transaction, no changes were applied", e);
        }
    }

    private void applyWrite(String path, Map<String, Object> document) {
        if (document == null) {
            Map<String, Map<String, Object>> documents = collections.get(TournamentPaths.parentOf(path));
            if (documents != null) {
                documents.remove(TournamentPaths.idOf(path));
            }
        } else {
            putDocument(path, document);
        }
    }

    @Override
    public Instant serverTimestamp() {
        return clock.instant();
    }

    @Override
    public String generateId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 20);
    }

    private void persistRoot(String root) {
        try {
            writeRootFile(root);
        } catch (IOException e) {
            throw new TournamentException("Failed to persist " + root, "STORAGE_ERROR", e);
        }
    }

    private void writeRootFile(String root) throws IOException {
        if (!isPersistent()) {
            return;
        }
        ReentrantLock lock = rootLocks.computeIfAbsent(root, k -> new ReentrantLock());
        lock.lock();
        try {
            Map<String, Map<String, Object>> documents = collectRoot(root);
            File file = new File(dataDirectory, TournamentPaths.idOf(root) + ".json");
            if (documents.isEmpty()) {
                Files.deleteIfExists(file.toPath());
                return;
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file, documents);
        } finally {
            lock.unlock();
        }
    }

    private Map<String, Map<String, Object>> collectRoot(String root) {
        Map<String, Map<String, Object>> documents = new TreeMap<>();
        Map<String, Object> rootDocument = readCommitted(root);
        if (rootDocument != null) {
            documents.put(root, rootDocument);
        }
        String prefix = root + "/";
        collections.forEach((collectionPath, members) -> {
            if (collectionPath.startsWith(prefix)) {
                members.forEach((id, document) -> documents.put(collectionPath + "/" + id, document));
            }
        });
        return documents;
    }

    /**
     * Buffers writes until commit; a {@code null} value marks a delete.
     */
    private class JsonTransaction implements Transaction {

        private final Instant now;
        private final Map<String, Map<String, Object>> pendingWrites = new LinkedHashMap<>();

        JsonTransaction(Instant now) {
            this.now = now;
        }

        @Override
        public Optional<Map<String, Object>> get(String path) {
            if (pendingWrites.containsKey(path)) {
                return Optional.ofNullable(pendingWrites.get(path)).map(Documents::copyOf);
            }
            return Optional.ofNullable(readCommitted(path)).map(Documents::copyOf);
        }

        @Override
        public List<Map<String, Object>> list(String collectionPath) {
            Map<String, Map<String, Object>> merged = new LinkedHashMap<>(listCommitted(collectionPath));
            pendingWrites.forEach((path, document) -> {
                if (TournamentPaths.parentOf(path).equals(collectionPath)) {
                    if (document == null) {
                        merged.remove(TournamentPaths.idOf(path));
                    } else {
                        merged.put(TournamentPaths.idOf(path), document);
                    }
                }
            });
            List<Map<String, Object>> result = new ArrayList<>();
            merged.values().forEach(document -> result.add(Documents.copyOf(document)));
            return result;
        }

        @Override
        public void set(String path, Map<String, Object> document) {
            pendingWrites.put(path, Documents.resolve(document, now));
        }

        @Override
        public void update(String path, Map<String, Object> fields) {
            Map<String, Object> current = get(path)
                .orElseThrow(() -> new NotFoundException("Document not found: " + path));
            pendingWrites.put(path, Documents.merge(current, fields, now));
        }

        @Override
        public void delete(String path) {
            pendingWrites.put(path, null);
        }
    }
}
