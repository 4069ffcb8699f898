package com.openforge.toollog.provisioning;

/** Missing or unusable control-plane configuration. Never retried. */
public class ControlPlaneConfigurationException extends RuntimeException {

    public ControlPlaneConfigurationException(String message) {
        super(message);
    }
}
