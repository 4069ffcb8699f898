package com.openforge.toollog.provisioning;

/** The control plane answered with a success status but an unreadable body. */
public class ControlPlaneParseException extends ProvisioningException {

    public ControlPlaneParseException(String message, int status, String responseBody, Throwable cause) {
        super(message, status, responseBody, cause);
    }
}
