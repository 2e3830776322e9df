package com.tournament.platform.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One store document per row, body kept as JSON.
 */
@Entity
@jakarta.persistence.Table(name = "documents", indexes = {
    @Index(name = "idx_documents_collection", columnList = "collection_path")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoredDocument {
    @Id
    @Column(name = "path", nullable = false, length = 512)
    private String path;
    
    @Column(name = "collection_path", nullable = false, length = 512)
    private String collectionPath;
    
    @Lob
    @Column(name = "body", nullable = false)
    private String body;
    
    @Version
    @Column(name = "version")
    private Long version;
}
