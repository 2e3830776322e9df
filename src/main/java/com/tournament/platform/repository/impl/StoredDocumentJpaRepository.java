package com.tournament.platform.repository.impl;

import com.tournament.platform.model.StoredDocument;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface StoredDocumentJpaRepository extends JpaRepository<StoredDocument, String> {
    List<StoredDocument> findByCollectionPath(String collectionPath);
    
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select d from StoredDocument d where d.path = :path")
    Optional<StoredDocument> findForUpdate(@Param("path") String path);
}
