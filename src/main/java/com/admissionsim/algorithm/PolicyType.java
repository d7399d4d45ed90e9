package com.admissionsim.algorithm;

import com.admissionsim.simulation.InvalidConfigurationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.Random;
import java.util.stream.Collectors;

/**
 * Scheduling policies available by name.
 */
public enum PolicyType {
    ROUND_ROBIN("Round Robin"),
    RANDOM("Random"),
    LEAST_REQUESTS("Least Requests"),
    LEAST_RESPONSE_TIME("Least Response Time"),
    DYNAMIC_CPU("Dynamic CPU");

    private final String displayName;

    PolicyType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Creates a fresh policy instance.
     *
     * @param random source used by policies that draw random numbers
     */
    public SchedulingPolicy create(Random random) {
        switch (this) {
            case ROUND_ROBIN:
                return new RoundRobinPolicy();
            case RANDOM:
                return new RandomPolicy(random);
            case LEAST_REQUESTS:
                return new LeastRequestsPolicy();
            case LEAST_RESPONSE_TIME:
                return new LeastResponseTimePolicy();
            case DYNAMIC_CPU:
                return new DynamicCpuPolicy();
            default:
                throw new IllegalStateException("Unhandled policy " + this);
        }
    }

    /**
     * Resolves a policy from its display name ("Least Requests") or constant
     * name ("LEAST_REQUESTS"). Case, spaces, dashes and underscores are ignored.
     *
     * @throws InvalidConfigurationException for an unknown or blank name
     */
    public static PolicyType fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidConfigurationException("Policy name must not be blank");
        }
        String key = normalize(name);
        for (PolicyType type : values()) {
            if (normalize(type.name()).equals(key) || normalize(type.displayName).equals(key)) {
                return type;
            }
        }
        throw new InvalidConfigurationException("Unknown scheduling policy '" + name
                + "', expected one of " + Arrays.stream(values())
                .map(PolicyType::getDisplayName)
                .collect(Collectors.joining(", ")));
    }

    private static String normalize(String s) {
        return s.replaceAll("[\\s_-]", "").toLowerCase(Locale.ROOT);
    }
}
