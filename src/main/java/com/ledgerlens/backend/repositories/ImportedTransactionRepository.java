package com.ledgerlens.backend.repositories;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.ledgerlens.backend.entities.ImportedTransaction;

public interface ImportedTransactionRepository extends JpaRepository<ImportedTransaction, UUID> {

    @Query("select t.fingerprint from ImportedTransaction t where t.userId = :userId")
    Set<String> findFingerprintsByUserId(@Param("userId") UUID userId);

    @Query("select t.fingerprint from ImportedTransaction t "
            + "where t.userId = :userId and t.fingerprint in :fingerprints")
    Set<String> findExistingFingerprints(
            @Param("userId") UUID userId,
            @Param("fingerprints") Collection<String> fingerprints);

    Optional<ImportedTransaction> findByIdAndUserId(UUID id, UUID userId);

    List<ImportedTransaction> findByUserIdAndIdIn(UUID userId, Collection<UUID> ids);

    @Query("select t from ImportedTransaction t "
            + "where t.userId = :userId and t.id <> :excludeId "
            + "and (t.description = :description "
            + "or (:merchantName <> 'Unknown' and t.merchantName = :merchantName)) "
            + "order by t.transactionDate desc")
    List<ImportedTransaction> findSimilar(
            @Param("userId") UUID userId,
            @Param("excludeId") UUID excludeId,
            @Param("description") String description,
            @Param("merchantName") String merchantName);

    Page<ImportedTransaction> findByUserIdOrderByTransactionDateDesc(UUID userId, Pageable pageable);
}
