package com.backoffice.ledger.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tuning for the ledger engine, bound from {@code ledger.*}.
 */
@Data
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    private Retry retry = new Retry();
    private Audit audit = new Audit();

    @Data
    public static class Retry {
        /** Attempts for a mutating operation that lost a lock or version race. */
        private int maxAttempts = 3;
        private long backoffMs = 50;
        private long maxBackoffMs = 1000;
    }

    @Data
    public static class Audit {
        private int maxAttempts = 3;
        private long backoffMs = 100;
    }
}
