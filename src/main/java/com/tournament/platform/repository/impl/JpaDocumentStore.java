package com.tournament.platform.repository.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tournament.platform.exception.NotFoundException;
import com.tournament.platform.exception.TournamentException;
import com.tournament.platform.exception.TransactionFailedException;
import com.tournament.platform.model.StoredDocument;
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
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Document store on top of Spring Data JPA. Conflicting transactions are detected by the
 * entity version and retried up to {@code tournament.storage.max-attempts} times.
 */
@Repository
@ConditionalOnProperty(name = "tournament.storage.type", havingValue = "jpa")
public class JpaDocumentStore implements DocumentStore {

    private static final Logger logger = LoggerFactory.getLogger(JpaDocumentStore.class);

    private final StoredDocumentJpaRepository jpaRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final int maxAttempts;
    private final ObjectMapper objectMapper;

    @Autowired
    public JpaDocumentStore(StoredDocumentJpaRepository jpaRepository,
                            PlatformTransactionManager transactionManager,
                            Clock clock,
                            @Value("${tournament.storage.max-attempts:5}") int maxAttempts) {
        this.jpaRepository = jpaRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.objectMapper = DocumentMapper.createObjectMapper();
    }

    @Override
    public Optional<Map<String, Object>> get(String path) {
        return jpaRepository.findById(path).map(this::readBody);
    }

    @Override
    public List<Map<String, Object>> list(String collectionPath) {
        return jpaRepository.findByCollectionPath(collectionPath).stream()
            .map(this::readBody)
            .toList();
    }

    @Override
    public void set(String path, Map<String, Object> document) {
        runTransaction(tx -> {
            tx.set(path, document);
            return null;
        });
    }

    @Override
    public void update(String path, Map<String, Object> fields) {
        executeWithRetry(() -> transactionTemplate.execute(status -> {
            StoredDocument stored = jpaRepository.findForUpdate(path)
                .orElseThrow(() -> new NotFoundException("Document not found: " + path));
            stored.setBody(writeBody(Documents.merge(readBody(stored), fields, serverTimestamp())));
            jpaRepository.save(stored);
            logger.debug("Updated {} fields {}", path, fields.keySet());
            return null;
        }));
    }

    @Override
    public void delete(String path) {
        runTransaction(tx -> {
            tx.delete(path);
            return null;
        });
    }

    @Override
    public <T> T runTransaction(Function<Transaction, T> work) {
        return executeWithRetry(() -> transactionTemplate.execute(status -> work.apply(new JpaTransaction(serverTimestamp()))));
    }

    private <T> T executeWithRetry(Supplier<T> action) {
        ConcurrencyFailureException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return action.get();
            } catch (ConcurrencyFailureException e) {
                lastFailure = e;
                logger.warn("Transaction conflict on attempt {}/{}: {}", attempt, maxAttempts, e.getMessage());
            }
        }
        throw new TransactionFailedException("Transaction failed after " + maxAttempts + " attempts", lastFailure);
    }

    @Override
    public Instant serverTimestamp() {
        return clock.instant();
    }

    @Override
    public String generateId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 20);
    }

    private Map<String, Object> readBody(StoredDocument stored) {
        try {
            return objectMapper.readValue(stored.getBody(), DocumentMapper.DOCUMENT_TYPE);
        } catch (JsonProcessingException e) {
            throw new TournamentException("Corrupt document body at " + stored.getPath(), "STORAGE_ERROR", e);
        }
    }

    private String writeBody(Map<String, Object> document) {
        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new TournamentException("Failed to serialize document", "STORAGE_ERROR", e);
        }
    }

    /**
     * Works on managed entities inside the surrounding JPA transaction; Hibernate flushes
     * pending changes before queries, so reads see the transaction's own writes.
     */
    private class JpaTransaction implements Transaction {

        private final Instant now;

        JpaTransaction(Instant now) {
            this.now = now;
        }

        @Override
        public Optional<Map<String, Object>> get(String path) {
            return jpaRepository.findById(path).map(JpaDocumentStore.this::readBody);
        }

        @Override
        public List<Map<String, Object>> list(String collectionPath) {
            return JpaDocumentStore.this.list(collectionPath);
        }

        @Override
        public void set(String path, Map<String, Object> document) {
            StoredDocument stored = jpaRepository.findById(path)
                .orElseGet(() -> StoredDocument.builder()
                    .path(path)
                    .collectionPath(TournamentPaths.parentOf(path))
                    .build());
            stored.setBody(writeBody(Documents.resolve(document, now)));
            jpaRepository.save(stored);
        }

        @Override
        public void update(String path, Map<String, Object> fields) {
            StoredDocument stored = jpaRepository.findById(path)
                .orElseThrow(() -> new NotFoundException("Document not found: " + path));
            stored.setBody(writeBody(Documents.merge(readBody(stored), fields, now)));
            jpaRepository.save(stored);
        }

        @Override
        public void delete(String path) {
            jpaRepository.findById(path).ifPresent(jpaRepository::delete);
        }
    }
}
