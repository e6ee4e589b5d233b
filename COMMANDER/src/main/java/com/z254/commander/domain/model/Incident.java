package com.z254.commander.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Incident handed to the phase agents. Agents may read it but the orchestrator
 * never interprets anything beyond its id.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Incident {

    private String id;
    private String title;

    @Builder.Default
    private Severity severity = Severity.MEDIUM;

    @Builder.Default
    private List<String> affectedServices = new ArrayList<>();

    @Builder.Default
    private Instant createdAt = Instant.now();
}
