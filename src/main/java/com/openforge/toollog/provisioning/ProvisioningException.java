package com.openforge.toollog.provisioning;

import lombok.Getter;

/**
 * A control-plane call failed. Carries the upstream HTTP status and body when
 * the failure came from a response; {@code status} is {@code -1} for network
 * errors where no response was received.
 */
@Getter
public class ProvisioningException extends RuntimeException {

    public static final int NO_STATUS = -1;

    private final int    status;
    private final String responseBody;

    public ProvisioningException(String message, int status, String responseBody) {
        super(message);
        this.status       = status;
        this.responseBody = responseBody;
    }

    public ProvisioningException(String message, Throwable cause) {
        super(message, cause);
        this.status       = NO_STATUS;
        this.responseBody = null;
    }

    public ProvisioningException(String message, int status, String responseBody, Throwable cause) {
        super(message, cause);
        this.status       = status;
        this.responseBody = responseBody;
    }
}
