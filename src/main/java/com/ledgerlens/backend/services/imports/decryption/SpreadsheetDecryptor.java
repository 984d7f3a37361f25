package com.ledgerlens.backend.services.imports.decryption;

import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.security.GeneralSecurityException;

import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.hssf.record.crypto.Biff8EncryptionKey;
import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.apache.poi.poifs.crypt.Decryptor;
import org.apache.poi.poifs.crypt.EncryptionInfo;
import org.apache.poi.poifs.filesystem.FileMagic;
import org.apache.poi.poifs.filesystem.POIFSFileSystem;
import org.springframework.stereotype.Component;

import com.ledgerlens.backend.exceptions.EncryptionException;
import com.ledgerlens.backend.exceptions.StatementFormatException;

import lombok.extern.slf4j.Slf4j;

/**
 * Removes password protection from a spreadsheet. Files that are not encrypted come back unchanged;
 * a wrong password raises {@link EncryptionException} with {@code passwordRequired=false}.
 */
@Slf4j
@Component
public class SpreadsheetDecryptor {

    static final String ENCRYPTION_INFO_ENTRY = "EncryptionInfo";

    public byte[] decrypt(byte[] content, String password) {
        if (content == null || content.length == 0) return content;

        FileMagic magic;
        try (InputStream in = FileMagic.prepareToCheckMagic(new BufferedInputStream(new ByteArrayInputStream(content)))) {
            magic = FileMagic.valueOf(in);
        } catch (IOException e) {
            throw new StatementFormatException("Could not inspect spreadsheet header", e);
        }

        // zipped OOXML is never encrypted: encrypted OOXML is wrapped in an OLE2 container
        if (magic != FileMagic.OLE2) return content;

        try (POIFSFileSystem fs = new POIFSFileSystem(new ByteArrayInputStream(content))) {
            if (fs.getRoot().hasEntry(ENCRYPTION_INFO_ENTRY)) {
                return decryptOoxml(fs, password);
            }
        } catch (IOException e) {
            throw new StatementFormatException("Could not open spreadsheet container", e);
        }
        return decryptLegacyXls(content, password);
    }

    private byte[] decryptOoxml(POIFSFileSystem fs, String password) throws IOException {
        if (password == null || password.isEmpty()) {
            throw EncryptionException.passwordRequired();
        }
        try {
            EncryptionInfo info = new EncryptionInfo(fs);
            Decryptor decryptor = Decryptor.getInstance(info);
            if (!decryptor.verifyPassword(password)) {
                throw EncryptionException.incorrectPassword(null);
            }
            try (InputStream data = decryptor.getDataStream(fs)) {
                byte[] plain = data.readAllBytes();
                log.info("[SpreadsheetDecryptor] decrypted OOXML workbook ({} bytes)", plain.length);
                return plain;
            }
        } catch (GeneralSecurityException e) {
            throw EncryptionException.incorrectPassword(e);
        }
    }

    private byte[] decryptLegacyXls(byte[] content, String password) {
        try (HSSFWorkbook ignored = new HSSFWorkbook(new ByteArrayInputStream(content))) {
            return content;
        } catch (EncryptedDocumentException e) {
            if (password == null || password.isEmpty()) {
                throw EncryptionException.passwordRequired();
            }
        } catch (IOException e) {
            throw new StatementFormatException("Could not read legacy spreadsheet", e);
        }

        Biff8EncryptionKey.setCurrentUserPassword(password);
        HSSFWorkbook workbook;
        try {
            workbook = new HSSFWorkbook(new ByteArrayInputStream(content));
        } catch (EncryptedDocumentException e) {
            throw EncryptionException.incorrectPassword(e);
        } catch (IOException e) {
            throw new StatementFormatException("Could not read legacy spreadsheet", e);
        } finally {
            Biff8EncryptionKey.setCurrentUserPassword(null);
        }

        // with no current password set, write() drops the FilePass record and saves in clear
        try (HSSFWorkbook wb = workbook; ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            wb.write(out);
            log.info("[SpreadsheetDecryptor] decrypted legacy xls workbook");
            return out.toByteArray();
        } catch (IOException e) {
            throw new StatementFormatException("Could not re-encode decrypted spreadsheet", e);
        }
    }
}
