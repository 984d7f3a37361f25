package com.ledgerlens.backend.services.imports.extraction;

/**
 * Verbose extraction logging, switched on with LEDGERLENS_PARSER_DEBUG=true
 * (system property first, then environment).
 */
public final class ImportDebug {

    static final String KEY = "LEDGERLENS_PARSER_DEBUG";

    private ImportDebug() {
    }

    public static boolean isEnabled() {
        String fromProp = System.getProperty(KEY);
        if (fromProp != null) {
            return Boolean.parseBoolean(fromProp);
        }
        String fromEnv = System.getenv(KEY);
        return Boolean.parseBoolean(fromEnv != null ? fromEnv : "false");
    }
}
