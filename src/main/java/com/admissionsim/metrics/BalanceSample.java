package com.admissionsim.metrics;

import java.util.Objects;

/**
 * One entry of the balance history: cpu and memory balance scores at a point in simulated time.
 */
public final class BalanceSample {

    private final long timestamp;
    private final int cpuBalance;
    private final int memoryBalance;

    public BalanceSample(long timestamp, int cpuBalance, int memoryBalance) {
        this.timestamp = timestamp;
        this.cpuBalance = cpuBalance;
        this.memoryBalance = memoryBalance;
    }

    public long getTimestamp() { return timestamp; }
    public int getCpuBalance() { return cpuBalance; }
    public int getMemoryBalance() { return memoryBalance; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BalanceSample)) return false;
        BalanceSample that = (BalanceSample) o;
        return timestamp == that.timestamp
                && cpuBalance == that.cpuBalance
                && memoryBalance == that.memoryBalance;
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, cpuBalance, memoryBalance);
    }

    @Override
    public String toString() {
        return String.format("BalanceSample[t=%d, cpu=%d, mem=%d]", timestamp, cpuBalance, memoryBalance);
    }
}
