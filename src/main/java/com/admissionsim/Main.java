package com.admissionsim;

import com.admissionsim.algorithm.PolicyType;
import com.admissionsim.metrics.MetricsCollector;
import com.admissionsim.model.RequestType;
import com.admissionsim.simulation.InvalidConfigurationException;
import com.admissionsim.simulation.Simulation;
import com.admissionsim.simulation.SimulationConfig;
import com.admissionsim.simulation.SimulationSummary;
import com.admissionsim.ui.ConsoleVisualizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.PrintStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Callable;

/**
 * ========================================================================================
 * ADMISSION SIMULATOR: Main Entry Point
 * ========================================================================================
 *
 * Runs a tick-driven simulation of a pool of capacity-bounded servers behind a
 * scheduling policy. Each server can host requests up to 100% cpu and 100% memory;
 * a request the chosen server cannot fit is rejected immediately.
 *
 * Policies:
 *   1. Round Robin          : next server in rotation with room for the request
 *   2. Random               : random server with room for the request
 *   3. Least Requests       : fewest active requests
 *   4. Least Response Time  : lowest average completed response time
 *   5. Dynamic CPU          : lowest current cpu load
 *
 * Usage:
 *   java -jar admission-sim.jar --policy "Least Requests" --rate 40 --servers 4
 *   java -jar admission-sim.jar --compare --rate 60 --seed 7
 * ========================================================================================
 */
@CommandLine.Command(name = "admission-sim",
    mixinStandardHelpOptions = true,
    version = "admission-sim 1.0.0",
    header = "Simulate admission control across capacity-bounded servers",
    description = "Generates synthetic requests at a fixed rate and places them with a scheduling policy, "
        + "rejecting any request the chosen server cannot fit.")
public class Main implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_INVALID_CONFIG = 2;

    @CommandLine.Option(names = {"-r", "--rate"},
        description = "Arrival rate in requests per simulated second (default: ${DEFAULT-VALUE})")
    double arrivalRate = SimulationConfig.DEFAULT_ARRIVAL_RATE;

    @CommandLine.Option(names = {"-s", "--servers"},
        description = "Number of servers (default: ${DEFAULT-VALUE})")
    int serverCount = SimulationConfig.DEFAULT_SERVER_COUNT;

    @CommandLine.Option(names = {"-p", "--policy"},
        description = "Scheduling policy: Round Robin, Random, Least Requests, Least Response Time, "
            + "Dynamic CPU (default: ${DEFAULT-VALUE})")
    String policy = SimulationConfig.DEFAULT_POLICY;

    @CommandLine.Option(names = {"-d", "--duration"},
        description = "Run duration in simulated seconds (default: ${DEFAULT-VALUE})")
    long durationSeconds = SimulationConfig.DEFAULT_RUN_DURATION.getSeconds();

    @CommandLine.Option(names = "--tick",
        description = "Tick interval in simulated milliseconds (default: ${DEFAULT-VALUE})")
    long tickMillis = SimulationConfig.DEFAULT_TICK_MILLIS;

    @CommandLine.Option(names = "--history",
        description = "Number of balance samples kept (default: ${DEFAULT-VALUE})")
    int historyCapacity = MetricsCollector.DEFAULT_HISTORY_CAPACITY;

    @CommandLine.Option(names = "--min-service",
        description = "Exclusive lower bound of the service time in ms (default: ${DEFAULT-VALUE})")
    double minServiceTime = SimulationConfig.DEFAULT_MIN_SERVICE_TIME;

    @CommandLine.Option(names = "--max-service",
        description = "Inclusive upper bound of the service time in ms (default: ${DEFAULT-VALUE})")
    double maxServiceTime = SimulationConfig.DEFAULT_MAX_SERVICE_TIME;

    @CommandLine.Option(names = "--seed",
        description = "Random seed for a reproducible run")
    Long seed;

    @CommandLine.Option(names = {"-t", "--request-type"},
        description = "Request type as NAME=CPU:MEMORY, repeatable; replaces the default catalog")
    List<String> requestTypes = new ArrayList<>();

    @CommandLine.Option(names = "--compare",
        description = "Run every policy with the same seed and print a comparison")
    boolean compare;

    private final PrintStream out;

    public Main() {
        this(System.out);
    }

    Main(PrintStream out) {
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new Main()).execute(args));
    }

    @Override
    public Integer call() {
        SimulationConfig config;
        try {
            config = buildConfig();
        } catch (InvalidConfigurationException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return EXIT_INVALID_CONFIG;
        }

        ConsoleVisualizer visualizer = new ConsoleVisualizer(out);
        printConfiguration(config);

        if (!compare) {
            SimulationSummary summary = new Simulation(config).run();
            visualizer.printSummary(summary);
            return 0;
        }

        // Same seed for every policy so they see the same arrivals
        SimulationConfig seeded = config.getSeed() != null ? config
                : config.toBuilder().seed(new Random().nextLong()).build();
        List<SimulationSummary> results = new ArrayList<>();
        for (PolicyType type : PolicyType.values()) {
            SimulationSummary summary = new Simulation(seeded.toBuilder().policy(type).build()).run();
            visualizer.printSummary(summary);
            results.add(summary);
        }
        out.println("\n\n" + "═".repeat(70));
        out.println("  POLICY COMPARISON");
        out.println("═".repeat(70));
        visualizer.printComparisonTable(results);
        return 0;
    }

    SimulationConfig buildConfig() {
        SimulationConfig.Builder builder = SimulationConfig.builder()
                .arrivalRate(arrivalRate)
                .serverCount(serverCount)
                .policy(policy)
                .tickMillis(tickMillis)
                .historyCapacity(historyCapacity)
                .serviceTimeRange(minServiceTime, maxServiceTime)
                .runDuration(Duration.ofSeconds(durationSeconds))
                .seed(seed);
        if (!requestTypes.isEmpty()) {
            List<RequestType> catalog = new ArrayList<>();
            for (String definition : requestTypes) {
                catalog.add(RequestType.parse(definition));
            }
            builder.requestTypes(catalog);
        }
        return builder.build();
    }

    private void printConfiguration(SimulationConfig config) {
        out.println();
        out.println("  Configuration:");
        out.printf("    Servers             : %d%n", config.getServerCount());
        out.printf("    Policy              : %s%n", compare ? "all (comparison)" : config.getPolicyType().getDisplayName());
        out.printf("    Arrival Rate        : %.2f req/s%n", config.getArrivalRate());
        out.printf("    Run Duration        : %d s%n", config.getRunDuration().getSeconds());
        out.printf("    Tick Interval       : %d ms%n", config.getTickMillis());
        out.printf("    Service Time        : (%.0f, %.0f] ms%n", config.getMinServiceTime(), config.getMaxServiceTime());
        out.printf("    Request Types       : %s%n", config.getRequestTypes());
        out.printf("    Seed                : %s%n", config.getSeed() == null ? "random" : config.getSeed());
    }
}
