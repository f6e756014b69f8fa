package com.dealbot.api.dto.response;

import com.dealbot.data.entity.JobScheduleState;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class ScheduleResponse {
    private String jobType;
    private String spAddress;
    private Integer intervalSeconds;
    private Instant nextRunAt;
    private Instant lastRunAt;
    private boolean paused;

    public static ScheduleResponse from(JobScheduleState state) {
        return ScheduleResponse.builder()
            .jobType(state.getJobType().getValue())
            .spAddress(state.getSpAddress())
            .intervalSeconds(state.getIntervalSeconds())
            .nextRunAt(state.getNextRunAt())
            .lastRunAt(state.getLastRunAt())
            .paused(Boolean.TRUE.equals(state.getPaused()))
            .build();
    }
}
