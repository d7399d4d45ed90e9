package com.admissionsim.simulation;

import java.util.Objects;

/**
 * Outcome of submitting one request: admitted to a server, or rejected.
 * A rejection carries the index of the server that refused it, or -1 when
 * the policy returned an index outside the cluster.
 */
public final class AdmissionResult {

    public enum Outcome { ADMITTED, REJECTED }

    private final Outcome outcome;
    private final int serverIndex;

    private AdmissionResult(Outcome outcome, int serverIndex) {
        this.outcome = outcome;
        this.serverIndex = serverIndex;
    }

    public static AdmissionResult admitted(int serverIndex) {
        return new AdmissionResult(Outcome.ADMITTED, serverIndex);
    }

    public static AdmissionResult rejected(int serverIndex) {
        return new AdmissionResult(Outcome.REJECTED, serverIndex);
    }

    public Outcome getOutcome() { return outcome; }
    public int getServerIndex() { return serverIndex; }
    public boolean isAdmitted() { return outcome == Outcome.ADMITTED; }
    public boolean isRejected() { return outcome == Outcome.REJECTED; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AdmissionResult)) return false;
        AdmissionResult that = (AdmissionResult) o;
        return serverIndex == that.serverIndex && outcome == that.outcome;
    }

    @Override
    public int hashCode() {
        return Objects.hash(outcome, serverIndex);
    }

    @Override
    public String toString() {
        return outcome + "(" + serverIndex + ")";
    }
}
