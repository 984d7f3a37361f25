package com.ledgerlens.backend.services.imports.extraction;

import java.util.List;
import java.util.Map;

import com.ledgerlens.backend.enums.ImportFileKind;

/**
 * Turns the bytes of one statement file into ordered key/value rows.
 * An empty file yields an empty list; unreadable content raises a StatementFormatException.
 */
public interface StatementTableExtractor {

    boolean supports(ImportFileKind kind);

    List<Map<String, Object>> extract(byte[] content, String password);
}
