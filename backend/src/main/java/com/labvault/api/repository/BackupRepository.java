package com.labvault.api.repository;

import com.labvault.api.model.entity.Backup;
import com.labvault.api.model.entity.BackupStatus;
import com.labvault.api.model.entity.BackupType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface BackupRepository extends JpaRepository<Backup, UUID> {

    List<Backup> findAllByOrderByCreatedAtDesc();

    List<Backup> findByStatusOrderByCreatedAtDesc(BackupStatus status);

    Optional<Backup> findFirstByStatusOrderByCreatedAtDesc(BackupStatus status);

    @Query("SELECT b FROM Backup b WHERE b.type = :type AND b.createdAt < :cutoff ORDER BY b.createdAt ASC")
    List<Backup> findRetentionCandidates(@Param("type") BackupType type, @Param("cutoff") Instant cutoff);

    long countByStatus(BackupStatus status);

    @Query("SELECT COALESCE(SUM(b.sizeBytes), 0) FROM Backup b WHERE b.status = :status")
    long sumSizeByStatus(@Param("status") BackupStatus status);
}
