package com.ledgerlens.backend.repositories;

import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.ledgerlens.backend.entities.UploadedFile;

public interface UploadedFileRepository extends JpaRepository<UploadedFile, UUID> {

    boolean existsByUserIdAndFileHash(UUID userId, String fileHash);
}
