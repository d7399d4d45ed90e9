package com.admissionsim.model;

import com.admissionsim.simulation.InvalidConfigurationException;

import java.util.List;
import java.util.Objects;

/**
 * An entry in the request catalog: a named (cpu, memory) demand pair.
 */
public class RequestType {

    /** Catalog used when none is configured. */
    public static final List<RequestType> DEFAULT_CATALOG = List.of(
            new RequestType("light", 5, 3),
            new RequestType("cpu-medium", 8, 4),
            new RequestType("memory-medium", 4, 8),
            new RequestType("heavy", 10, 6)
    );

    private final String name;
    private final double cpuDemand;
    private final double memoryDemand;

    public RequestType(String name, double cpuDemand, double memoryDemand) {
        if (name == null || name.isBlank()) {
            throw new InvalidConfigurationException("Request type name must not be blank");
        }
        checkDemand(name, "cpu", cpuDemand);
        checkDemand(name, "memory", memoryDemand);
        this.name = name;
        this.cpuDemand = cpuDemand;
        this.memoryDemand = memoryDemand;
    }

    /**
     * Parses {@code NAME=CPU:MEMORY}, e.g. {@code heavy=10:6}.
     */
    public static RequestType parse(String definition) {
        if (definition == null) {
            throw new InvalidConfigurationException("Request type definition must not be null");
        }
        int eq = definition.indexOf('=');
        int colon = definition.indexOf(':', eq + 1);
        if (eq <= 0 || colon < 0) {
            throw new InvalidConfigurationException(
                    "Malformed request type '" + definition + "', expected NAME=CPU:MEMORY");
        }
        String name = definition.substring(0, eq).trim();
        try {
            double cpu = Double.parseDouble(definition.substring(eq + 1, colon).trim());
            double memory = Double.parseDouble(definition.substring(colon + 1).trim());
            return new RequestType(name, cpu, memory);
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException(
                    "Malformed demand in request type '" + definition + "': " + e.getMessage(), e);
        }
    }

    private static void checkDemand(String name, String resource, double demand) {
        if (Double.isNaN(demand) || demand < 0 || demand > Server.CAPACITY) {
            throw new InvalidConfigurationException(String.format(
                    "Request type '%s' has %s demand %.2f outside [0, %.0f]",
                    name, resource, demand, Server.CAPACITY));
        }
    }

    public String getName() { return name; }
    public double getCpuDemand() { return cpuDemand; }
    public double getMemoryDemand() { return memoryDemand; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RequestType)) return false;
        RequestType that = (RequestType) o;
        return Double.compare(that.cpuDemand, cpuDemand) == 0
                && Double.compare(that.memoryDemand, memoryDemand) == 0
                && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, cpuDemand, memoryDemand);
    }

    @Override
    public String toString() {
        return String.format("%s(cpu=%.1f, mem=%.1f)", name, cpuDemand, memoryDemand);
    }
}
