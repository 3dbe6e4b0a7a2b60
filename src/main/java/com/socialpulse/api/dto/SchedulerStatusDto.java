package com.socialpulse.api.dto;

import java.time.Instant;
import java.util.List;

public record SchedulerStatusDto(
        boolean running,
        List<JobStatus> jobs
) {

    public record JobStatus(String id, Instant nextRunTime) {
    }
}
