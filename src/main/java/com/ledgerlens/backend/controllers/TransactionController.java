package com.ledgerlens.backend.controllers;

import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.ledgerlens.backend.dto.ApiResponse;
import com.ledgerlens.backend.dto.CategoryUpdateRequestDTO;
import com.ledgerlens.backend.dto.ReclassifyRequestDTO;
import com.ledgerlens.backend.dto.ReclassifyResultDTO;
import com.ledgerlens.backend.dto.TransactionResponseDTO;
import com.ledgerlens.backend.services.TransactionCategoryService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/transactions")
@RequiredArgsConstructor
public class TransactionController {

    private final TransactionCategoryService transactionCategoryService;

    @GetMapping
    public ResponseEntity<ApiResponse<Page<TransactionResponseDTO>>> list(
            @RequestHeader(ImportController.USER_HEADER) UUID userId,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "50") int size
    ) {
        if (page < 0 || size < 1 || size > 500) {
            throw new IllegalArgumentException("page must be >= 0 and size between 1 and 500");
        }
        Page<TransactionResponseDTO> result = transactionCategoryService.list(userId, PageRequest.of(page, size));
        return ResponseEntity.ok(ApiResponse.success(result, "Transactions retrieved successfully"));
    }

    @PatchMapping("/{id}/category")
    public ResponseEntity<ApiResponse<ReclassifyResultDTO>> updateCategory(
            @RequestHeader(ImportController.USER_HEADER) UUID userId,
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @PathVariable UUID id,
            @Valid @RequestBody CategoryUpdateRequestDTO request
    ) {
        ReclassifyResultDTO result = transactionCategoryService.updateCategory(
                userId, id, request.getCategory(), ImportController.bearerToken(authorization));
        return ResponseEntity.ok(ApiResponse.success(result, "Category updated successfully"));
    }

    @PostMapping("/reclassify")
    public ResponseEntity<ApiResponse<ReclassifyResultDTO>> reclassify(
            @RequestHeader(ImportController.USER_HEADER) UUID userId,
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @Valid @RequestBody ReclassifyRequestDTO request
    ) {
        ReclassifyResultDTO result = transactionCategoryService.reclassify(
                userId, request.transactionIds(), request.category(), ImportController.bearerToken(authorization));
        return ResponseEntity.ok(ApiResponse.success(result, "Transactions reclassified successfully"));
    }
}
