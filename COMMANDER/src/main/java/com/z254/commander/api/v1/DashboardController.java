package com.z254.commander.api.v1;

import com.z254.commander.broadcast.ConnectionMetrics;
import com.z254.commander.broadcast.ConnectionRegistry;
import com.z254.commander.broadcast.RegistryMetrics;
import com.z254.commander.domain.model.SystemHealthMetrics;
import com.z254.commander.orchestration.RealTimeOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Set;

/**
 * REST API for broadcast and orchestration metrics.
 */
@RestController
@RequestMapping("/api/v1/dashboard")
@Tag(name = "Dashboard", description = "Broadcast layer and system health metrics")
public class DashboardController {

    private final ConnectionRegistry connectionRegistry;
    private final RealTimeOrchestrator orchestrator;

    public DashboardController(ConnectionRegistry connectionRegistry, RealTimeOrchestrator orchestrator) {
        this.connectionRegistry = connectionRegistry;
        this.orchestrator = orchestrator;
    }

    @GetMapping("/metrics")
    @Operation(summary = "Broadcast metrics", description = "Connection and delivery statistics of the broadcast layer")
    public Mono<RegistryMetrics> getMetrics() {
        return Mono.fromCallable(connectionRegistry::metrics);
    }

    @GetMapping("/connections/{id}")
    @Operation(summary = "Connection metrics", description = "Delivery statistics of one dashboard connection")
    public Mono<ResponseEntity<ConnectionMetrics>> getConnection(
            @Parameter(description = "Connection ID") @PathVariable String id) {
        return Mono.justOrEmpty(connectionRegistry.connectionMetrics(id))
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/system-health")
    @Operation(summary = "System health", description = "Current orchestrator and broadcast health snapshot")
    public Mono<SystemHealthMetrics> getSystemHealth() {
        return Mono.fromCallable(orchestrator::getSystemHealth);
    }

    @GetMapping("/incidents/active")
    @Operation(summary = "Active incidents", description = "Ids of incidents currently being processed")
    public Mono<Set<String>> getActiveIncidents() {
        return Mono.fromCallable(orchestrator::activeIncidentIds);
    }
}
