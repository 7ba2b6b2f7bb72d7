package org.carball.tuner.replica;

/**
 * A cost was read through a configuration handle after the replica had been reconfigured.
 */
public class StaleConfigurationException extends IllegalStateException {

    public StaleConfigurationException(String message) {
        super(message);
    }
}
