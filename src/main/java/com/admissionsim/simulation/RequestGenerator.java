package com.admissionsim.simulation;

import com.admissionsim.model.Request;
import com.admissionsim.model.RequestType;

import java.util.List;
import java.util.Random;

/**
 * Produces synthetic requests.
 *
 * Each request gets a catalog type chosen uniformly at random, a service
 * duration uniform in (minServiceTime, maxServiceTime], and the next id.
 */
public class RequestGenerator {

    private final List<RequestType> catalog;
    private final double minServiceTime;
    private final double maxServiceTime;
    private final Random random;

    private int nextId;

    public RequestGenerator(List<RequestType> catalog, double minServiceTime, double maxServiceTime, Random random) {
        if (catalog.isEmpty()) {
            throw new InvalidConfigurationException("Request catalog must not be empty");
        }
        this.catalog = List.copyOf(catalog);
        this.minServiceTime = minServiceTime;
        this.maxServiceTime = maxServiceTime;
        this.random = random;
    }

    public Request generate(long now) {
        RequestType type = catalog.get(random.nextInt(catalog.size()));
        // nextDouble() is in [0, 1), so the duration lands in (min, max]
        double duration = maxServiceTime - random.nextDouble() * (maxServiceTime - minServiceTime);
        return new Request(nextId++, type.getName(), type.getCpuDemand(), type.getMemoryDemand(), duration, now);
    }

    public int getNextId() { return nextId; }

    public void reset() {
        nextId = 0;
    }
}
