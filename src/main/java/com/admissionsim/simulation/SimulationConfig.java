package com.admissionsim.simulation;

import com.admissionsim.algorithm.PolicyType;
import com.admissionsim.metrics.MetricsCollector;
import com.admissionsim.model.RequestType;

import java.time.Duration;
import java.util.List;

/**
 * Immutable simulation settings. Build with {@link #builder()}; every value is
 * validated in {@link Builder#build()} and nothing falls back to a default
 * once a caller has set it.
 */
public final class SimulationConfig {

    // --- Defaults ---
    public static final double DEFAULT_ARRIVAL_RATE      = 1.0;   // requests per second
    public static final int DEFAULT_SERVER_COUNT         = 4;
    public static final String DEFAULT_POLICY            = PolicyType.ROUND_ROBIN.getDisplayName();
    public static final Duration DEFAULT_RUN_DURATION    = Duration.ofSeconds(60);
    public static final long DEFAULT_TICK_MILLIS         = 100;
    public static final double DEFAULT_MIN_SERVICE_TIME  = 0.0;   // exclusive
    public static final double DEFAULT_MAX_SERVICE_TIME  = 500.0; // inclusive

    /** Upper bound on the arrivals a single tick may generate. */
    public static final long MAX_ARRIVALS_PER_TICK = Integer.MAX_VALUE;

    private final double arrivalRate;
    private final int serverCount;
    private final PolicyType policyType;
    private final Duration runDuration;
    private final long tickMillis;
    private final List<RequestType> requestTypes;
    private final int historyCapacity;
    private final double minServiceTime;
    private final double maxServiceTime;
    private final Long seed;

    private SimulationConfig(Builder b, PolicyType policyType) {
        this.arrivalRate = b.arrivalRate;
        this.serverCount = b.serverCount;
        this.policyType = policyType;
        this.runDuration = b.runDuration;
        this.tickMillis = b.tickMillis;
        this.requestTypes = List.copyOf(b.requestTypes);
        this.historyCapacity = b.historyCapacity;
        this.minServiceTime = b.minServiceTime;
        this.maxServiceTime = b.maxServiceTime;
        this.seed = b.seed;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static SimulationConfig defaults() {
        return builder().build();
    }

    /**
     * Returns a builder pre-filled with this configuration's values.
     */
    public Builder toBuilder() {
        return new Builder()
                .arrivalRate(arrivalRate)
                .serverCount(serverCount)
                .policy(policyType.getDisplayName())
                .runDuration(runDuration)
                .tickMillis(tickMillis)
                .requestTypes(requestTypes)
                .historyCapacity(historyCapacity)
                .serviceTimeRange(minServiceTime, maxServiceTime)
                .seed(seed);
    }

    static void checkServerCount(int serverCount) {
        if (serverCount < 1) {
            throw new InvalidConfigurationException("Server count must be at least 1, got " + serverCount);
        }
    }

    static void checkArrivalRate(double arrivalRate) {
        if (!(arrivalRate > 0) || Double.isInfinite(arrivalRate)) {
            throw new InvalidConfigurationException("Arrival rate must be a positive number, got " + arrivalRate);
        }
    }

    /**
     * @throws InvalidConfigurationException if one tick at this rate would generate
     *         more than {@link #MAX_ARRIVALS_PER_TICK} arrivals
     */
    static void checkArrivalsPerTick(double arrivalRate, long tickMillis) {
        double perTick = arrivalRate * tickMillis / 1000.0;
        if (perTick > MAX_ARRIVALS_PER_TICK) {
            throw new InvalidConfigurationException(String.format(
                    "Arrival rate %.0f/s yields %.0f arrivals per %dms tick, limit is %d",
                    arrivalRate, perTick, tickMillis, MAX_ARRIVALS_PER_TICK));
        }
    }

    // --- Getters ---

    public double getArrivalRate() { return arrivalRate; }
    public int getServerCount() { return serverCount; }
    public PolicyType getPolicyType() { return policyType; }
    public Duration getRunDuration() { return runDuration; }
    public long getTickMillis() { return tickMillis; }
    public List<RequestType> getRequestTypes() { return requestTypes; }
    public int getHistoryCapacity() { return historyCapacity; }
    public double getMinServiceTime() { return minServiceTime; }
    public double getMaxServiceTime() { return maxServiceTime; }

    /**
     * Returns the random seed, or null for a time-seeded run.
     */
    public Long getSeed() { return seed; }

    @Override
    public String toString() {
        return String.format("SimulationConfig[rate=%.2f/s, servers=%d, policy=%s, duration=%ds, tick=%dms, "
                        + "history=%d, service=(%.0f, %.0f]ms, types=%s, seed=%s]",
                arrivalRate, serverCount, policyType.getDisplayName(), runDuration.getSeconds(), tickMillis,
                historyCapacity, minServiceTime, maxServiceTime, requestTypes, seed);
    }

    public static final class Builder {

        private double arrivalRate = DEFAULT_ARRIVAL_RATE;
        private int serverCount = DEFAULT_SERVER_COUNT;
        private String policyName = DEFAULT_POLICY;
        private Duration runDuration = DEFAULT_RUN_DURATION;
        private long tickMillis = DEFAULT_TICK_MILLIS;
        private List<RequestType> requestTypes = RequestType.DEFAULT_CATALOG;
        private int historyCapacity = MetricsCollector.DEFAULT_HISTORY_CAPACITY;
        private double minServiceTime = DEFAULT_MIN_SERVICE_TIME;
        private double maxServiceTime = DEFAULT_MAX_SERVICE_TIME;
        private Long seed;

        private Builder() {
        }

        public Builder arrivalRate(double arrivalRate) {
            this.arrivalRate = arrivalRate;
            return this;
        }

        public Builder serverCount(int serverCount) {
            this.serverCount = serverCount;
            return this;
        }

        public Builder policy(String policyName) {
            this.policyName = policyName;
            return this;
        }

        public Builder policy(PolicyType policyType) {
            this.policyName = policyType.getDisplayName();
            return this;
        }

        public Builder runDuration(Duration runDuration) {
            this.runDuration = runDuration;
            return this;
        }

        public Builder tickMillis(long tickMillis) {
            this.tickMillis = tickMillis;
            return this;
        }

        public Builder requestTypes(List<RequestType> requestTypes) {
            this.requestTypes = requestTypes;
            return this;
        }

        public Builder historyCapacity(int historyCapacity) {
            this.historyCapacity = historyCapacity;
            return this;
        }

        public Builder serviceTimeRange(double minServiceTime, double maxServiceTime) {
            this.minServiceTime = minServiceTime;
            this.maxServiceTime = maxServiceTime;
            return this;
        }

        public Builder seed(Long seed) {
            this.seed = seed;
            return this;
        }

        /**
         * @throws InvalidConfigurationException naming the first invalid setting
         */
        public SimulationConfig build() {
            checkArrivalRate(arrivalRate);
            checkServerCount(serverCount);
            PolicyType policyType = PolicyType.fromName(policyName);
            if (runDuration == null || runDuration.isNegative() || runDuration.isZero()) {
                throw new InvalidConfigurationException("Run duration must be positive, got " + runDuration);
            }
            try {
                runDuration.toMillis();
            } catch (ArithmeticException e) {
                throw new InvalidConfigurationException("Run duration " + runDuration + " is too long", e);
            }
            if (tickMillis < 1) {
                throw new InvalidConfigurationException("Tick interval must be at least 1ms, got " + tickMillis);
            }
            checkArrivalsPerTick(arrivalRate, tickMillis);
            if (requestTypes == null || requestTypes.isEmpty()) {
                throw new InvalidConfigurationException("Request catalog must contain at least one type");
            }
            if (historyCapacity < 1) {
                throw new InvalidConfigurationException("History capacity must be at least 1, got " + historyCapacity);
            }
            if (minServiceTime < 0 || !(maxServiceTime > minServiceTime) || Double.isInfinite(maxServiceTime)) {
                throw new InvalidConfigurationException(String.format(
                        "Service time range (%.2f, %.2f] is invalid, need 0 <= min < max",
                        minServiceTime, maxServiceTime));
            }
            return new SimulationConfig(this, policyType);
        }
    }
}
