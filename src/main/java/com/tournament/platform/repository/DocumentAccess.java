package com.tournament.platform.repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Document reads and writes shared by the store itself and by its transactions.
 * Documents are JSON-shaped maps: strings, numbers, booleans, lists and nested maps.
 */
public interface DocumentAccess {
    
    Optional<Map<String, Object>> get(String path);
    
    /**
     * Direct children of the collection, in no particular order.
     */
    List<Map<String, Object>> list(String collectionPath);
    
    /**
     * Creates or replaces the document.
     */
    void set(String path, Map<String, Object> document);
    
    /**
     * Merges the fields into an existing document. Values may be {@link FieldValue}
     * transforms, which are applied against the stored value.
     *
     * @throws com.tournament.platform.exception.NotFoundException if the document does not exist
     */
    void update(String path, Map<String, Object> fields);
    
    void delete(String path);
}
