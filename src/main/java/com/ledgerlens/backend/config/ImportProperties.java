package com.ledgerlens.backend.config;

import java.time.Duration;
import java.time.ZoneId;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ledgerlens.import")
public record ImportProperties(
        Integer chunkSize,
        Integer concurrency,
        Integer progressBase,
        Duration uploadTimeout,
        String defaultCurrency,
        String zoneId,
        Duration fingerprintCacheTtl
) {
    public ImportProperties {
        if (chunkSize == null || chunkSize <= 0) {
            chunkSize = 2500;
        }
        if (concurrency == null || concurrency <= 0) {
            concurrency = 3;
        }
        if (progressBase == null || progressBase < 0 || progressBase >= 100) {
            progressBase = 10;
        }
        if (uploadTimeout == null || uploadTimeout.isZero() || uploadTimeout.isNegative()) {
            uploadTimeout = Duration.ofSeconds(60);
        }
        if (defaultCurrency == null || defaultCurrency.isBlank()) {
            defaultCurrency = "INR";
        }
        if (zoneId == null || zoneId.isBlank()) {
            zoneId = "Asia/Kolkata";
        }
        if (fingerprintCacheTtl == null || fingerprintCacheTtl.isNegative()) {
            fingerprintCacheTtl = Duration.ofSeconds(60);
        }
    }

    public static ImportProperties defaults() {
        return new ImportProperties(null, null, null, null, null, null, null);
    }

    public ZoneId zone() {
        return ZoneId.of(zoneId);
    }
}
