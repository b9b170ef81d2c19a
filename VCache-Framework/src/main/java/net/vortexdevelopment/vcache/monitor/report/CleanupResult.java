package net.vortexdevelopment.vcache.monitor.report;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class CleanupResult {
    Instant timestamp;
    String reason;
    int callbacksExecuted;
    int callbacksFailed;
    int entriesBefore;
    int entriesAfter;
    long spaceFreedBytes;

    public int getEntriesFreed() {
        return entriesBefore - entriesAfter;
    }
}
