package com.ledgerlens.backend.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads a local ".env" file into System properties for development runs.
 *
 * Existing environment variables and system properties always win; keys with blank values are skipped.
 * Used for things like LEDGERLENS_CLASSIFIER_URL or the datasource credentials.
 */
public final class DotenvLoader {

    private static final Logger log = LoggerFactory.getLogger(DotenvLoader.class);

    private static final List<Path> CANDIDATES = List.of(Path.of(".env"), Path.of("backend", ".env"));

    private DotenvLoader() {
    }

    public static void loadFromWorkingDirectoryIfPresent() {
        Optional<Path> envPath = CANDIDATES.stream()
                .filter(p -> Files.exists(p) && Files.isRegularFile(p))
                .findFirst();
        if (envPath.isEmpty()) {
            return;
        }

        try {
            int loaded = 0;
            for (String raw : Files.readAllLines(envPath.get(), StandardCharsets.UTF_8)) {
                if (applyLine(raw)) {
                    loaded++;
                }
            }
            if (loaded > 0) {
                log.info("[DotenvLoader] {} keys loaded from {} (values hidden)", loaded, envPath.get().toAbsolutePath());
            }
        } catch (IOException e) {
            log.warn("[DotenvLoader] could not read {}: {}", envPath.get(), e.getMessage());
        }
    }

    static boolean applyLine(String raw) {
        if (raw == null) return false;
        String line = raw.trim();
        if (line.isEmpty() || line.startsWith("#")) return false;
        if (line.startsWith("export ")) {
            line = line.substring("export ".length()).trim();
        }

        int idx = line.indexOf('=');
        if (idx <= 0) return false;

        String key = line.substring(0, idx).trim();
        String value = unquote(line.substring(idx + 1).trim());
        if (key.isEmpty() || value.isEmpty()) return false;

        if (isDefined(System.getenv(key)) || isDefined(System.getProperty(key))) {
            return false;
        }
        System.setProperty(key, value);
        return true;
    }

    private static String unquote(String value) {
        if (value.length() >= 2
                && ((value.startsWith("\"") && value.endsWith("\"")) || (value.startsWith("'") && value.endsWith("'")))) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }

    private static boolean isDefined(String value) {
        return value != null && !value.isBlank();
    }
}
