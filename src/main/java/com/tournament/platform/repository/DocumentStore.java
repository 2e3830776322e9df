package com.tournament.platform.repository;

import java.time.Instant;
import java.util.Map;
import java.util.function.Function;

public interface DocumentStore extends DocumentAccess {
    
    /**
     * Adds {@code delta} to a numeric field without a read-modify-write cycle.
     */
    default void atomicIncrement(String path, String field, Number delta) {
        update(path, Map.of(field, FieldValue.increment(delta)));
    }
    
    /**
     * Runs {@code work} so that all its writes are committed together or not at all.
     * Exceptions thrown by {@code work} abort the transaction and propagate unchanged.
     *
     * @throws com.tournament.platform.exception.TransactionFailedException if the
     *         transaction could not be committed
     */
    <T> T runTransaction(Function<Transaction, T> work);
    
    /**
     * Current time as the store sees it.
     */
    Instant serverTimestamp();
    
    String generateId();
}
