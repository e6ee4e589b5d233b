package com.z254.commander;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * COMMANDER - Real-time incident orchestration with live dashboard streaming.
 *
 * <p>COMMANDER provides:
 * <ul>
 *   <li>Phase Orchestration - Detection, Diagnosis, Prediction and Resolution agents per incident</li>
 *   <li>Execution Tracking - Every agent state transition is broadcast as it happens</li>
 *   <li>Dashboard Fan-out - Batched, backpressure-aware WebSocket delivery to many viewers</li>
 *   <li>System Health - On-demand and periodic health snapshots</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class CommanderApplication {

    public static void main(String[] args) {
        SpringApplication.run(CommanderApplication.class, args);
    }
}
