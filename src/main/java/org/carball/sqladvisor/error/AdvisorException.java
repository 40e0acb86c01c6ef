package org.carball.sqladvisor.error;

/**
 * Root of every condition the advisor reports. None of them are transient:
 * they are caused either by the caller's input or by the loaded rule data.
 */
public abstract class AdvisorException extends RuntimeException {

    protected AdvisorException(String message) {
        super(message);
    }

    protected AdvisorException(String message, Throwable cause) {
        super(message, cause);
    }
}
