package com.admissionsim.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Represents a capacity-bounded server in the simulated cluster.
 *
 * A server hosts active requests as long as their summed cpu and memory
 * demand stay within its capacity:
 *
 *   sum(cpuDemand)    <= capacityCpu
 *   sum(memoryDemand) <= capacityMemory
 *
 * It also keeps the latency history used by the response-time policy:
 * completed count, cumulative response time and rejections.
 */
public class Server {

    /** Default capacity for both resources, in percent. */
    public static final double CAPACITY = 100.0;

    private final int id;
    private final String name;
    private final double capacityCpu;
    private final double capacityMemory;

    private final List<Request> activeRequests;

    // Statistics tracking
    private int completedCount;
    private double cumulativeResponseTime;
    private int rejectedCount;

    public Server(int id) {
        this(id, CAPACITY, CAPACITY);
    }

    public Server(int id, double capacityCpu, double capacityMemory) {
        this.id = id;
        this.name = "Server-" + id;
        this.capacityCpu = capacityCpu;
        this.capacityMemory = capacityMemory;
        this.activeRequests = new ArrayList<>();
    }

    public double getCpuLoad() {
        double total = 0.0;
        for (Request r : activeRequests) {
            total += r.getCpuDemand();
        }
        return total;
    }

    public double getMemoryLoad() {
        double total = 0.0;
        for (Request r : activeRequests) {
            total += r.getMemoryDemand();
        }
        return total;
    }

    /**
     * Admission test: true if both resources still fit after adding the request.
     */
    public boolean canAccept(Request request) {
        return getCpuLoad() + request.getCpuDemand() <= capacityCpu
                && getMemoryLoad() + request.getMemoryDemand() <= capacityMemory;
    }

    /**
     * Hosts the request.
     *
     * @throws IllegalStateException if the request does not fit
     */
    public void admit(Request request) {
        if (!canAccept(request)) {
            throw new IllegalStateException(String.format(
                    "%s cannot host %s (cpu=%.1f/%.0f, mem=%.1f/%.0f)",
                    name, request, getCpuLoad(), capacityCpu, getMemoryLoad(), capacityMemory));
        }
        activeRequests.add(request);
    }

    /**
     * Removes every request whose service duration has elapsed at {@code now}
     * and folds it into the completion counters.
     *
     * @return the requests completed by this call, in hosting order
     */
    public List<Request> reclaimCompleted(long now) {
        List<Request> completed = new ArrayList<>();
        Iterator<Request> it = activeRequests.iterator();
        while (it.hasNext()) {
            Request r = it.next();
            if (r.isComplete(now)) {
                it.remove();
                completedCount++;
                cumulativeResponseTime += r.getServiceDuration();
                completed.add(r);
            }
        }
        return completed;
    }

    public void recordRejection() {
        rejectedCount++;
    }

    /**
     * Drops all active requests and zeroes the counters.
     */
    public void reset() {
        activeRequests.clear();
        completedCount = 0;
        cumulativeResponseTime = 0.0;
        rejectedCount = 0;
    }

    public double getAverageResponseTime() {
        return completedCount == 0 ? 0.0 : cumulativeResponseTime / completedCount;
    }

    public ServerSnapshot snapshot() {
        return new ServerSnapshot(id, getCpuLoad(), getMemoryLoad(), activeRequests.size(),
                getAverageResponseTime(), completedCount, rejectedCount);
    }

    // --- Getters ---

    public int getId() { return id; }
    public String getName() { return name; }
    public double getCapacityCpu() { return capacityCpu; }
    public double getCapacityMemory() { return capacityMemory; }
    public List<Request> getActiveRequests() { return Collections.unmodifiableList(activeRequests); }
    public int getActiveRequestCount() { return activeRequests.size(); }
    public int getCompletedCount() { return completedCount; }
    public double getCumulativeResponseTime() { return cumulativeResponseTime; }
    public int getRejectedCount() { return rejectedCount; }

    @Override
    public String toString() {
        return String.format("Server[id=%d, cpu=%.1f%%, mem=%.1f%%, active=%d, avgResponse=%.1fms, rejected=%d]",
                id, getCpuLoad(), getMemoryLoad(), activeRequests.size(), getAverageResponseTime(), rejectedCount);
    }
}
