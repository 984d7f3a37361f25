package com.ledgerlens.backend.controllers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import com.ledgerlens.backend.dto.ImportResultDTO;
import com.ledgerlens.backend.exceptions.ChunkUploadException;
import com.ledgerlens.backend.exceptions.EncryptionException;
import com.ledgerlens.backend.exceptions.RemoteCallTimeoutException;
import com.ledgerlens.backend.exceptions.StatementFormatException;
import com.ledgerlens.backend.services.imports.StatementImportService;

@SpringBootTest(properties = {
        "spring.jpa.hibernate.ddl-auto=none",
        "spring.datasource.url=jdbc:h2:mem:ledgerlens_import_api;DB_CLOSE_DELAY=-1;MODE=PostgreSQL",
        "spring.datasource.driverClassName=org.h2.Driver",
        "spring.datasource.username=sa",
        "spring.datasource.password=",
        "spring.jpa.database-platform=org.hibernate.dialect.H2Dialect"
})
@AutoConfigureMockMvc
class ImportControllerIntegrationTest {

    @Autowired
    MockMvc mockMvc;

    @MockBean
    StatementImportService statementImportService;

    private final MockMultipartFile csv = new MockMultipartFile(
            "file", "feb.csv", "text/csv", "Date,Description,Amount\n15/02/2024,Swiggy,-450\n".getBytes());

    @Test
    void upload_returnsCreatedWithCounts() throws Exception {
        UUID userId = UUID.randomUUID();
        ImportResultDTO result = ImportResultDTO.builder()
                .filename("feb.csv")
                .fileHash("abc")
                .totalRows(1)
                .imported(1)
                .progress(100)
                .build();
        when(statementImportService.importFile(eq(userId), any(), isNull(), eq("token-123"))).thenReturn(result);

        mockMvc.perform(multipart("/api/imports")
                        .file(csv)
                        .header("X-User-Id", userId.toString())
                        .header("Authorization", "Bearer token-123"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.imported").value(1))
                .andExpect(jsonPath("$.data.skippedDuplicates").value(0))
                .andExpect(jsonPath("$.data.progress").value(100));

        verify(statementImportService).importFile(eq(userId), any(), isNull(), eq("token-123"));
    }

    @Test
    void upload_withoutUserHeader_returnsBadRequest() throws Exception {
        mockMvc.perform(multipart("/api/imports").file(csv))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.errors[0]").value("X-User-Id"));

        verifyNoInteractions(statementImportService);
    }

    @Test
    void upload_withMalformedUserHeader_returnsBadRequest() throws Exception {
        mockMvc.perform(multipart("/api/imports").file(csv).header("X-User-Id", "not-a-uuid"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void upload_unreadableStatement_returnsBadRequest() throws Exception {
        when(statementImportService.importFile(any(), any(), any(), any()))
                .thenThrow(new StatementFormatException("No rows found in feb.csv"));

        mockMvc.perform(multipart("/api/imports").file(csv).header("X-User-Id", UUID.randomUUID().toString()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("No rows found in feb.csv"));
    }

    @Test
    void upload_lockedWorkbook_reportsPasswordRequired() throws Exception {
        when(statementImportService.importFile(any(), any(), any(), any()))
                .thenThrow(EncryptionException.passwordRequired());

        mockMvc.perform(multipart("/api/imports").file(csv).header("X-User-Id", UUID.randomUUID().toString()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0]").value("passwordRequired"));
    }

    @Test
    void upload_chunkTimeout_returnsGatewayTimeoutWithCommittedRows() throws Exception {
        RemoteCallTimeoutException timeout = new RemoteCallTimeoutException("Chunk upload", 30000, null);
        when(statementImportService.importFile(any(), any(), any(), any()))
                .thenThrow(new ChunkUploadException("Upload failed after 400 rows were saved", 400, timeout));

        mockMvc.perform(multipart("/api/imports").file(csv).header("X-User-Id", UUID.randomUUID().toString()))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.errors[0]").value("committedRows=400"));
    }

    @Test
    void bearerToken_stripsSchemeAndBlankValues() {
        assertEquals("abc", ImportController.bearerToken("Bearer abc"));
        assertEquals("xyz", ImportController.bearerToken("bearer  xyz "));
        assertEquals("raw-token", ImportController.bearerToken("raw-token"));
        assertNull(ImportController.bearerToken("Bearer "));
        assertNull(ImportController.bearerToken(null));
    }
}
