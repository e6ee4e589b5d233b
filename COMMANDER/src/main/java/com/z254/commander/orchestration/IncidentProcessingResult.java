package com.z254.commander.orchestration;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Summary of a fully processed incident.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IncidentProcessingResult {

    public static final String STATUS_COMPLETED = "completed";

    private String incidentId;
    private String status;
    private double durationSeconds;
    private int phasesCompleted;
}
