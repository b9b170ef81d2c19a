package net.vortexdevelopment.vcache.warming.report;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class WarmingStats {
    int tasks;
    int criticalKeys;
    boolean running;
    int usersPreloaded;
    WarmingPerformance performance;
    List<TaskDetails> taskDetails;
}
