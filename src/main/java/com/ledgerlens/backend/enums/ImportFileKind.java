package com.ledgerlens.backend.enums;

import java.util.Locale;

/**
 * Statement file kind, decided by extension only.
 */
public enum ImportFileKind {
    CSV,
    EXCEL,
    JSON,
    TEXT,
    PDF,
    UNKNOWN;

    public static ImportFileKind fromFilename(String filename) {
        if (filename == null) return UNKNOWN;
        int dot = filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) return UNKNOWN;

        String ext = filename.substring(dot + 1).trim().toLowerCase(Locale.ROOT);
        return switch (ext) {
            case "csv", "tsv" -> CSV;
            case "xls", "xlsx", "xlsm" -> EXCEL;
            case "json" -> JSON;
            case "txt" -> TEXT;
            case "pdf" -> PDF;
            default -> UNKNOWN;
        };
    }

    public boolean isDelimitedText() {
        return this == CSV || this == TEXT || this == PDF;
    }
}
