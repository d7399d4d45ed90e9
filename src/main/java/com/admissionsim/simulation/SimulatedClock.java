package com.admissionsim.simulation;

/**
 * Simulated time in milliseconds, advanced only by the tick driver.
 */
public class SimulatedClock {

    private long now;

    public long now() {
        return now;
    }

    public void advance(long millis) {
        if (millis < 0) {
            throw new IllegalArgumentException("Cannot move the clock backwards by " + millis + "ms");
        }
        now += millis;
    }

    public void reset() {
        now = 0;
    }
}
