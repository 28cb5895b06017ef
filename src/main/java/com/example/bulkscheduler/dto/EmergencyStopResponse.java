package com.example.bulkscheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmergencyStopResponse {

    private int stoppedCount;
    private Instant stoppedAt;
}
