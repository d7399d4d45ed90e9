package com.admissionsim.simulation;

/**
 * Thrown when a simulation setting is rejected: non-positive server count,
 * unknown policy name, malformed request type and so on.
 * The simulation state is left untouched when this is thrown.
 */
public class InvalidConfigurationException extends IllegalArgumentException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
