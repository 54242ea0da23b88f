package com.labvault.api.repository;

import com.labvault.api.model.entity.BackupSettings;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface BackupSettingsRepository extends JpaRepository<BackupSettings, Long> {

    Optional<BackupSettings> findFirstByOrderByIdAsc();
}
