package com.ledgerlens.backend.dto;

import java.util.List;
import java.util.UUID;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

public record ReclassifyRequestDTO(
        @NotEmpty(message = "At least one transaction id is required") List<UUID> transactionIds,
        @NotBlank(message = "Category is required") @Size(max = 100) String category
) {
}
