package com.ledgerlens.backend.handlers;

import com.ledgerlens.backend.dto.ApiResponse;
import com.ledgerlens.backend.exceptions.ChunkUploadException;
import com.ledgerlens.backend.exceptions.EncryptionException;
import com.ledgerlens.backend.exceptions.ImportException;
import com.ledgerlens.backend.exceptions.RemoteCallTimeoutException;
import com.ledgerlens.backend.exceptions.ResourceNotFoundException;
import com.ledgerlens.backend.exceptions.StatementFormatException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private <T> ResponseEntity<ApiResponse<T>> buildResponse(
            HttpStatus status,
            String message,
            List<String> errors
    ) {
        ApiResponse<T> body = ApiResponse.<T>builder()
                .success(false)
                .message(message)
                .timestamp(LocalDateTime.now())
                .errors(errors)
                .build();

        return ResponseEntity.status(status).body(body);
    }

    // 404
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNotFound(ResourceNotFoundException ex) {
        return buildResponse(HttpStatus.NOT_FOUND, ex.getMessage(), List.of(ex.getMessage()));
    }

    // 400 - file could not be read as rows
    @ExceptionHandler(StatementFormatException.class)
    public ResponseEntity<ApiResponse<Void>> handleFormat(StatementFormatException ex) {
        return buildResponse(HttpStatus.BAD_REQUEST, ex.getMessage(), List.of(ex.getMessage()));
    }

    // 400 - the client tells "password required" apart from "wrong password" through the errors list
    @ExceptionHandler(EncryptionException.class)
    public ResponseEntity<ApiResponse<Void>> handleEncryption(EncryptionException ex) {
        String code = ex.isPasswordRequired() ? "passwordRequired" : "incorrectPassword";
        return buildResponse(HttpStatus.BAD_REQUEST, ex.getMessage(), List.of(code));
    }

    // 504
    @ExceptionHandler(RemoteCallTimeoutException.class)
    public ResponseEntity<ApiResponse<Void>> handleTimeout(RemoteCallTimeoutException ex) {
        log.warn("[Import] timeout: {}", ex.getMessage());
        return buildResponse(HttpStatus.GATEWAY_TIMEOUT, ex.getMessage(), List.of(ex.getMessage()));
    }

    // 502, or 504 when the chunk timed out; earlier chunks stay committed
    @ExceptionHandler(ChunkUploadException.class)
    public ResponseEntity<ApiResponse<Void>> handleChunkUpload(ChunkUploadException ex) {
        log.error("[Import] chunk upload failed after {} committed rows", ex.getCommittedRows(), ex);
        HttpStatus status = ex.getCause() instanceof RemoteCallTimeoutException
                ? HttpStatus.GATEWAY_TIMEOUT
                : HttpStatus.BAD_GATEWAY;
        return buildResponse(
                status,
                ex.getMessage(),
                List.of("committedRows=" + ex.getCommittedRows())
        );
    }

    @ExceptionHandler(ImportException.class)
    public ResponseEntity<ApiResponse<Void>> handleImport(ImportException ex) {
        log.error("[Import] import failed", ex);
        return buildResponse(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), List.of(ex.getMessage()));
    }

    // 400 - bean validation (@Valid)
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidation(MethodArgumentNotValidException ex) {
        List<String> errors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(err -> err.getField() + ": " + err.getDefaultMessage())
                .collect(Collectors.toList());

        return buildResponse(HttpStatus.BAD_REQUEST, "Validation failed", errors);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiResponse<Void>> handleMissingHeader(MissingRequestHeaderException ex) {
        return buildResponse(HttpStatus.BAD_REQUEST, ex.getMessage(), List.of(ex.getHeaderName()));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Void>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        String msg = "Invalid value for " + ex.getName();
        return buildResponse(HttpStatus.BAD_REQUEST, msg, List.of(msg));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Void>> handleIllegalArgument(IllegalArgumentException ex) {
        String msg = ex.getMessage();
        if (msg == null || msg.isBlank()) {
            msg = "Invalid request";
        }
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error(msg));
    }

    // 500
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGeneric(Exception ex) {
        log.error("[Api] unexpected error", ex);
        return buildResponse(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Internal server error",
                List.of(String.valueOf(ex.getMessage()))
        );
    }
}
