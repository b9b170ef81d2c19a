package net.vortexdevelopment.vcache.warming.report;

import lombok.Builder;
import lombok.Value;
import org.jetbrains.annotations.Nullable;

import java.util.List;

@Value
@Builder
public class UserWarmingReport {
    String userId;
    boolean skipped;
    @Nullable
    String reason;
    List<String> keysWarmed;
    int succeeded;
    int failed;
    long durationMs;

    public static UserWarmingReport skipped(String userId, String reason) {
        return UserWarmingReport.builder()
                .userId(userId)
                .skipped(true)
                .reason(reason)
                .keysWarmed(List.of())
                .build();
    }
}
