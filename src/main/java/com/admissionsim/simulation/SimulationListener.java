package com.admissionsim.simulation;

import com.admissionsim.model.Request;

/**
 * Synchronous notifications fired inside the tick that produced the event.
 * Listeners are for presentation only and must not reconfigure the simulation
 * from within a callback; {@link Simulation#stop()} is the one exception.
 */
public interface SimulationListener {

    default void onRequestAdmitted(Request request, int serverIndex) {
    }

    /**
     * @param serverIndex the refusing server, or -1 if the policy returned an out-of-range index
     */
    default void onRequestRejected(Request request, int serverIndex) {
    }

    default void onRequestCompleted(Request request, int serverIndex) {
    }
}
