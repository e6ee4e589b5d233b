package com.z254.commander.orchestration;

import com.z254.commander.domain.model.Incident;
import reactor.core.publisher.Mono;

/**
 * External agent invoked for one incident phase.
 * <p>
 * The orchestrator only distinguishes success (completion, with or without a value) from
 * failure (an error signal or a thrown exception). It enforces the phase timeout itself.
 */
@FunctionalInterface
public interface PhaseCallback {

    Mono<?> execute(Incident incident);
}
