package net.vortexdevelopment.vcache.warming.report;

import lombok.Value;

import java.time.Duration;

@Value
public class ScheduleAdjustment {
    String taskId;
    double frequency;
    Duration interval;
}
