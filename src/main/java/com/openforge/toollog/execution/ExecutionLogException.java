package com.openforge.toollog.execution;

/**
 * Writing an execution record failed: the target database could not be
 * provisioned or reached, or the insert was rejected. Never retried here.
 */
public class ExecutionLogException extends RuntimeException {

    public ExecutionLogException(String message) {
        super(message);
    }

    public ExecutionLogException(String message, Throwable cause) {
        super(message, cause);
    }
}
