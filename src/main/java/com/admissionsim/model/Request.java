package com.admissionsim.model;

/**
 * A unit of work submitted to the cluster.
 * Immutable once created: its demand and service duration never change,
 * only its owning server does (from none, to one, back to none).
 */
public class Request {

    private final int id;
    private final String typeName;
    private final double cpuDemand;        // 0-100%
    private final double memoryDemand;     // 0-100%
    private final double serviceDuration;  // simulated milliseconds
    private final long arrivalTime;        // simulated clock at creation

    public Request(int id, String typeName, double cpuDemand, double memoryDemand,
                   double serviceDuration, long arrivalTime) {
        this.id = id;
        this.typeName = typeName;
        this.cpuDemand = cpuDemand;
        this.memoryDemand = memoryDemand;
        this.serviceDuration = serviceDuration;
        this.arrivalTime = arrivalTime;
    }

    public Request(int id, double cpuDemand, double memoryDemand, double serviceDuration, long arrivalTime) {
        this(id, "custom", cpuDemand, memoryDemand, serviceDuration, arrivalTime);
    }

    /**
     * A request is complete once it has been hosted for its full service duration.
     */
    public boolean isComplete(long now) {
        return (now - arrivalTime) >= serviceDuration;
    }

    // --- Getters ---

    public int getId() { return id; }
    public String getTypeName() { return typeName; }
    public double getCpuDemand() { return cpuDemand; }
    public double getMemoryDemand() { return memoryDemand; }
    public double getServiceDuration() { return serviceDuration; }
    public long getArrivalTime() { return arrivalTime; }

    @Override
    public String toString() {
        return String.format("Request[id=%d, type=%s, cpu=%.1f, mem=%.1f, duration=%.1fms, arrival=%d]",
                id, typeName, cpuDemand, memoryDemand, serviceDuration, arrivalTime);
    }
}
