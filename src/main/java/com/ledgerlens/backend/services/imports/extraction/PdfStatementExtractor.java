package com.ledgerlens.backend.services.imports.extraction;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import com.ledgerlens.backend.enums.ImportFileKind;
import com.ledgerlens.backend.exceptions.EncryptionException;
import com.ledgerlens.backend.exceptions.StatementFormatException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Pulls the text layer out of a PDF and reads it as delimited text. No layout analysis.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PdfStatementExtractor implements StatementTableExtractor {

    private final DelimitedTextExtractor delimitedTextExtractor;

    @Override
    public boolean supports(ImportFileKind kind) {
        return kind == ImportFileKind.PDF;
    }

    @Override
    public List<Map<String, Object>> extract(byte[] content, String password) {
        if (content == null || content.length == 0) return List.of();

        String text;
        try (PDDocument document = (password != null && !password.isBlank())
                ? PDDocument.load(content, password)
                : PDDocument.load(content)) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            text = stripper.getText(document);
        } catch (InvalidPasswordException e) {
            if (password != null && !password.isBlank()) {
                throw EncryptionException.incorrectPassword(e);
            }
            throw EncryptionException.passwordRequired();
        } catch (IOException e) {
            throw new StatementFormatException("Could not read PDF file", e);
        }

        if (ImportDebug.isEnabled()) {
            log.info("[PdfStatement] extracted {} chars, first 500: {}",
                    text.length(), text.substring(0, Math.min(500, text.length())));
        }
        return delimitedTextExtractor.extractText(text);
    }
}
