package com.z254.commander.orchestration;

import com.z254.commander.domain.model.IncidentPhase;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Rolling window of successful phase durations, used for health reporting only.
 */
public class PhaseTimings {

    private final int window;
    private final Map<IncidentPhase, Deque<Double>> samples = new EnumMap<>(IncidentPhase.class);

    public PhaseTimings(int window) {
        this.window = window;
    }

    public synchronized void record(IncidentPhase phase, double seconds) {
        Deque<Double> phaseSamples = samples.computeIfAbsent(phase, p -> new ArrayDeque<>());
        if (phaseSamples.size() >= window) {
            phaseSamples.pollFirst();
        }
        phaseSamples.addLast(seconds);
    }

    /**
     * Mean duration in seconds for every phase that has samples.
     */
    public synchronized Map<IncidentPhase, Double> averageSeconds() {
        Map<IncidentPhase, Double> averages = new EnumMap<>(IncidentPhase.class);
        samples.forEach((phase, values) -> {
            if (!values.isEmpty()) {
                averages.put(phase, values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0));
            }
        });
        return averages;
    }

    public synchronized List<Double> allSamples() {
        List<Double> all = new ArrayList<>();
        samples.values().forEach(all::addAll);
        return all;
    }
}
