package com.ledgerlens.backend.controllers;

import java.util.UUID;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import com.ledgerlens.backend.dto.ApiResponse;
import com.ledgerlens.backend.dto.ImportResultDTO;
import com.ledgerlens.backend.services.imports.StatementImportService;

import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/imports")
@RequiredArgsConstructor
public class ImportController {

    static final String USER_HEADER = "X-User-Id";

    private final StatementImportService statementImportService;

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<ImportResultDTO>> importStatement(
            @RequestHeader(USER_HEADER) UUID userId,
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "password", required = false) String password
    ) {
        ImportResultDTO result = statementImportService.importFile(userId, file, password, bearerToken(authorization));
        return ResponseEntity.status(201).body(ApiResponse.success(result, "Statement imported successfully"));
    }

    static String bearerToken(String authorization) {
        if (authorization == null) return null;
        String value = authorization.trim();
        if (value.equalsIgnoreCase("Bearer")) return null;
        if (value.regionMatches(true, 0, "Bearer ", 0, 7)) {
            value = value.substring(7).trim();
        }
        return value.isEmpty() ? null : value;
    }
}
