package org.carball.litepilot.model.optimization;

import lombok.Builder;
import lombok.Data;

/**
 * Point-in-time engine configuration. Any value that could not be read is {@code null}.
 */
@Data
@Builder
public class PerformanceMetrics {
    private Long pageCount;
    private Long pageSize;
    private Long freelistCount;
    private Long schemaVersion;
    private Long userVersion;
    private Long applicationId;
    private Long cacheSize;
    private Integer synchronous;
    private String journalMode;
    private Integer autoVacuum;
    private Integer tempStore;
    private Integer foreignKeys;
    private boolean integrityCheck;

    public long getDatabaseSizeBytes() {
        if (pageCount == null || pageSize == null) {
            return 0L;
        }
        return pageCount * pageSize;
    }

    public boolean isWalMode() {
        return "wal".equalsIgnoreCase(journalMode);
    }
}
