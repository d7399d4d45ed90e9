package com.admissionsim.simulation;

import com.admissionsim.algorithm.PolicyType;
import com.admissionsim.algorithm.SchedulingPolicy;
import com.admissionsim.metrics.BalanceSample;
import com.admissionsim.metrics.MetricsCollector;
import com.admissionsim.metrics.StatisticsSample;
import com.admissionsim.model.Request;
import com.admissionsim.model.Server;
import com.admissionsim.model.ServerSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Simulation Engine
 *
 * Owns the cluster and drives it one tick at a time on a simulated clock.
 * Every tick runs, in this order:
 * 1. Advances the clock by the tick interval
 * 2. Reclaims requests whose service duration has elapsed
 * 3. Generates the arrivals due at the configured rate and submits each one
 * 4. Takes one statistics sample into the bounded balance history
 *
 * Submitting a request asks the active policy for a server, then applies the
 * admission test. A request that does not fit is rejected on the spot; it is
 * never queued or retried.
 *
 * Not thread-safe: all calls must come from the thread driving the ticks.
 */
public class Simulation {

    private static final Logger log = LoggerFactory.getLogger(Simulation.class);

    private static final double ARRIVAL_EPSILON = 1e-9;

    private final SimulationConfig config;
    private final Random random;
    private final RequestGenerator generator;
    private final SimulatedClock clock;
    private final MetricsCollector metrics;
    private final List<SimulationListener> listeners;

    private List<Server> servers;
    private List<Server> serverView;
    private SchedulingPolicy policy;
    private int cursor;

    // Arrivals are counted from the last rate change so fractional rates spread evenly
    private double arrivalRate;
    private long rateEpoch;
    private long arrivalsSinceEpoch;

    private long ticks;
    private long totalSubmitted;
    private long totalAdmitted;
    private long totalRejected;
    private long totalCompleted;

    private boolean stopRequested;

    public Simulation(SimulationConfig config) {
        this.config = config;
        this.random = config.getSeed() == null ? new Random() : new Random(config.getSeed());
        this.generator = new RequestGenerator(config.getRequestTypes(),
                config.getMinServiceTime(), config.getMaxServiceTime(), random);
        this.clock = new SimulatedClock();
        this.metrics = new MetricsCollector(config.getHistoryCapacity());
        this.listeners = new CopyOnWriteArrayList<>();
        this.policy = config.getPolicyType().create(random);
        this.arrivalRate = config.getArrivalRate();
        createServers(config.getServerCount());
    }

    private void createServers(int count) {
        List<Server> fresh = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            fresh.add(new Server(i));
        }
        this.servers = fresh;
        this.serverView = Collections.unmodifiableList(fresh);
        this.cursor = 0;
    }

    // --- Tick driving ---

    /**
     * Runs ticks until the configured run duration of simulated time has
     * elapsed from now, or until {@link #stop()} is called. The last tick is
     * shortened so the run ends exactly at the configured duration.
     */
    public SimulationSummary run() {
        stopRequested = false;
        long end = endOfRun();

        log.info("Running simulation: policy={}, servers={}, rate={}/s, duration={}s",
                policy.getName(), servers.size(), arrivalRate, config.getRunDuration().getSeconds());

        while (!stopRequested && clock.now() < end) {
            tick(Math.min(config.getTickMillis(), end - clock.now()));
        }

        if (stopRequested) {
            log.info("Simulation stopped at t={}ms", clock.now());
        }
        SimulationSummary summary = getSummary();
        log.info("Simulation complete: submitted={}, admitted={}, rejected={}, completed={}",
                summary.getSubmitted(), summary.getAdmitted(), summary.getRejected(), summary.getCompleted());
        return summary;
    }

    /**
     * Performs one tick: clock, reclamation, arrivals, sampling.
     *
     * @return the statistics sample taken at the end of the tick
     */
    public StatisticsSample tick() {
        return tick(config.getTickMillis());
    }

    private StatisticsSample tick(long millis) {
        clock.advance(millis);
        ticks++;

        reclaimCompleted();

        long due = arrivalsDue();
        for (long i = 0; i < due; i++) {
            submit(generator.generate(clock.now()));
        }

        return metrics.sample(serverView, clock.now());
    }

    /**
     * Halts {@link #run()} after the current tick. Requests still active are
     * left where they are, with no completion accounting.
     */
    public void stop() {
        stopRequested = true;
    }

    private long endOfRun() {
        long duration = config.getRunDuration().toMillis();
        return clock.now() > Long.MAX_VALUE - duration ? Long.MAX_VALUE : clock.now() + duration;
    }

    private long arrivalsDue() {
        long elapsed = clock.now() - rateEpoch;
        long expected = (long) Math.floor(arrivalRate * elapsed / 1000.0 + ARRIVAL_EPSILON);
        long due = expected - arrivalsSinceEpoch;
        arrivalsSinceEpoch = expected;
        return Math.max(0, due);
    }

    private void reclaimCompleted() {
        long now = clock.now();
        for (int i = 0; i < servers.size(); i++) {
            for (Request request : servers.get(i).reclaimCompleted(now)) {
                totalCompleted++;
                for (SimulationListener listener : listeners) {
                    listener.onRequestCompleted(request, i);
                }
            }
        }
    }

    // --- Admission control ---

    /**
     * Generates one request at the current simulated time and submits it.
     */
    public AdmissionResult submitNext() {
        return submit(generator.generate(clock.now()));
    }

    /**
     * Places a request: the policy proposes a server, the admission test decides.
     * Capacity shortfalls come back as a rejected result, never as an exception.
     */
    public AdmissionResult submit(Request request) {
        totalSubmitted++;

        int index = policy.selectServer(serverView, cursor, request);
        if (index < 0 || index >= servers.size()) {
            log.warn("Policy {} returned index {} for {} servers, rejecting request {}",
                    policy.getName(), index, servers.size(), request.getId());
            totalRejected++;
            for (SimulationListener listener : listeners) {
                listener.onRequestRejected(request, -1);
            }
            return AdmissionResult.rejected(-1);
        }

        Server server = servers.get(index);
        if (server.canAccept(request)) {
            server.admit(request);
            cursor = (index + 1) % servers.size();
            totalAdmitted++;
            if (log.isDebugEnabled()) {
                log.debug("t={} admitted request {} to {} (cpu={}, mem={})",
                        clock.now(), request.getId(), server.getName(), server.getCpuLoad(), server.getMemoryLoad());
            }
            for (SimulationListener listener : listeners) {
                listener.onRequestAdmitted(request, index);
            }
            return AdmissionResult.admitted(index);
        }

        server.recordRejection();
        totalRejected++;
        if (log.isDebugEnabled()) {
            log.debug("t={} rejected request {} at {} (cpu={}+{}, mem={}+{})",
                    clock.now(), request.getId(), server.getName(),
                    server.getCpuLoad(), request.getCpuDemand(),
                    server.getMemoryLoad(), request.getMemoryDemand());
        }
        for (SimulationListener listener : listeners) {
            listener.onRequestRejected(request, index);
        }
        return AdmissionResult.rejected(index);
    }

    // --- Reconfiguration ---

    /**
     * Replaces the cluster with {@code count} fresh servers. Requests active on
     * the old servers are dropped without completion accounting.
     *
     * @throws InvalidConfigurationException if count is below 1
     */
    public void setServerCount(int count) {
        SimulationConfig.checkServerCount(count);
        createServers(count);
        log.info("Cluster resized to {} servers", count);
    }

    /**
     * Switches to the named policy; server state is kept.
     *
     * @throws InvalidConfigurationException for an unknown name
     */
    public void setPolicy(String name) {
        setPolicy(PolicyType.fromName(name).create(random));
    }

    /**
     * Switches to a custom policy; server state is kept.
     */
    public void setPolicy(SchedulingPolicy policy) {
        if (policy == null) {
            throw new InvalidConfigurationException("Scheduling policy must not be null");
        }
        this.policy = policy;
        log.info("Scheduling policy set to {}", policy.getName());
    }

    /**
     * Changes the arrival rate from the next tick on.
     *
     * @throws InvalidConfigurationException if the rate is not positive, or too
     *         high for the tick interval
     */
    public void setArrivalRate(double arrivalRate) {
        SimulationConfig.checkArrivalRate(arrivalRate);
        SimulationConfig.checkArrivalsPerTick(arrivalRate, config.getTickMillis());
        this.arrivalRate = arrivalRate;
        this.rateEpoch = clock.now();
        this.arrivalsSinceEpoch = 0;
    }

    /**
     * Clears every server, every counter, the clock and the balance history.
     * The policy, server count and arrival rate are kept.
     */
    public void reset() {
        for (Server server : servers) {
            server.reset();
        }
        if (config.getSeed() != null) {
            random.setSeed(config.getSeed());
        }
        generator.reset();
        clock.reset();
        metrics.clear();
        cursor = 0;
        rateEpoch = 0;
        arrivalsSinceEpoch = 0;
        ticks = 0;
        totalSubmitted = 0;
        totalAdmitted = 0;
        totalRejected = 0;
        totalCompleted = 0;
        stopRequested = false;
        log.info("Simulation reset");
    }

    // --- Listeners ---

    public void addListener(SimulationListener listener) {
        listeners.add(listener);
    }

    public void removeListener(SimulationListener listener) {
        listeners.remove(listener);
    }

    // --- Observation ---

    /**
     * Returns one snapshot per server, in index order.
     */
    public List<ServerSnapshot> getServerSnapshot() {
        List<ServerSnapshot> snapshot = new ArrayList<>(servers.size());
        for (Server server : servers) {
            snapshot.add(server.snapshot());
        }
        return Collections.unmodifiableList(snapshot);
    }

    /**
     * Returns the balance history, oldest first.
     */
    public List<BalanceSample> getBalanceHistory() {
        return metrics.getBalanceHistory();
    }

    public SimulationSummary getSummary() {
        return new SimulationSummary(policy.getName(), ticks, clock.now(),
                totalSubmitted, totalAdmitted, totalRejected, totalCompleted,
                getServerSnapshot(), metrics.getBalanceHistory(), metrics.getLatestSample());
    }

    // --- Getters ---

    public SimulationConfig getConfig() { return config; }
    public String getPolicyName() { return policy.getName(); }
    public int getServerCount() { return servers.size(); }
    public int getCursor() { return cursor; }
    public double getArrivalRate() { return arrivalRate; }
    public long getCurrentTime() { return clock.now(); }
    public long getTicks() { return ticks; }
    public long getTotalSubmitted() { return totalSubmitted; }
    public long getTotalAdmitted() { return totalAdmitted; }
    public long getTotalRejected() { return totalRejected; }
    public long getTotalCompleted() { return totalCompleted; }
    public StatisticsSample getLatestSample() { return metrics.getLatestSample(); }
}
