package com.ryuqq.deployer.core.outcome;

import com.ryuqq.deployer.core.model.JobState;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * type → state → count 집계의 불변 복사 유틸리티.
 */
final class Tallies {

    private Tallies() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static Map<String, Map<JobState, Integer>> copyOf(Map<String, Map<JobState, Integer>> source) {
        if (source == null) {
            throw new IllegalArgumentException("tally cannot be null");
        }
        TreeMap<String, Map<JobState, Integer>> copy = new TreeMap<>();
        for (Map.Entry<String, Map<JobState, Integer>> entry : source.entrySet()) {
            EnumMap<JobState, Integer> states = new EnumMap<>(JobState.class);
            states.putAll(entry.getValue());
            copy.put(entry.getKey(), Collections.unmodifiableMap(states));
        }
        return Collections.unmodifiableMap(copy);
    }
}
