package com.admissionsim.simulation;

import com.admissionsim.metrics.BalanceSample;
import com.admissionsim.metrics.StatisticsSample;
import com.admissionsim.model.ServerSnapshot;

import java.util.List;

/**
 * Totals and final state of a simulation run, for reporting.
 */
public final class SimulationSummary {

    private final String policyName;
    private final long ticks;
    private final long elapsedMillis;
    private final long submitted;
    private final long admitted;
    private final long rejected;
    private final long completed;
    private final List<ServerSnapshot> servers;
    private final List<BalanceSample> balanceHistory;
    private final StatisticsSample latestSample;

    public SimulationSummary(String policyName, long ticks, long elapsedMillis,
                             long submitted, long admitted, long rejected, long completed,
                             List<ServerSnapshot> servers, List<BalanceSample> balanceHistory,
                             StatisticsSample latestSample) {
        this.policyName = policyName;
        this.ticks = ticks;
        this.elapsedMillis = elapsedMillis;
        this.submitted = submitted;
        this.admitted = admitted;
        this.rejected = rejected;
        this.completed = completed;
        this.servers = List.copyOf(servers);
        this.balanceHistory = List.copyOf(balanceHistory);
        this.latestSample = latestSample;
    }

    /**
     * Fraction of submitted requests that were rejected, 0 when nothing was submitted.
     */
    public double getRejectionRate() {
        return submitted == 0 ? 0.0 : (double) rejected / submitted;
    }

    public double getAverageCpuBalance() {
        return balanceHistory.stream().mapToInt(BalanceSample::getCpuBalance).average().orElse(100.0);
    }

    public double getAverageMemoryBalance() {
        return balanceHistory.stream().mapToInt(BalanceSample::getMemoryBalance).average().orElse(100.0);
    }

    /**
     * Mean response time over every completed request in the cluster.
     */
    public double getMeanResponseTime() {
        double total = 0.0;
        long count = 0;
        for (ServerSnapshot s : servers) {
            total += s.getAverageResponseTime() * s.getCompletedCount();
            count += s.getCompletedCount();
        }
        return count == 0 ? 0.0 : total / count;
    }

    // --- Getters ---

    public String getPolicyName() { return policyName; }
    public long getTicks() { return ticks; }
    public long getElapsedMillis() { return elapsedMillis; }
    public long getSubmitted() { return submitted; }
    public long getAdmitted() { return admitted; }
    public long getRejected() { return rejected; }
    public long getCompleted() { return completed; }
    public List<ServerSnapshot> getServers() { return servers; }
    public List<BalanceSample> getBalanceHistory() { return balanceHistory; }

    /**
     * Returns the last statistics sample, or null if no tick ran.
     */
    public StatisticsSample getLatestSample() { return latestSample; }

    @Override
    public String toString() {
        return String.format("SimulationSummary[policy=%s, ticks=%d, submitted=%d, admitted=%d, rejected=%d, completed=%d]",
                policyName, ticks, submitted, admitted, rejected, completed);
    }
}
