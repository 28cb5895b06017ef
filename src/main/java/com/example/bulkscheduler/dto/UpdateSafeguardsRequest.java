package com.example.bulkscheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Runtime safeguard switches. Null fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateSafeguardsRequest {

    private Boolean generationEnabled;

    private Boolean allowScheduledGeneration;

    private Boolean allowManualGeneration;
}
