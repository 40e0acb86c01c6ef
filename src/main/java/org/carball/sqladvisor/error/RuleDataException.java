package org.carball.sqladvisor.error;

/**
 * Load-time failure: the rule or capability source is unreadable or contains
 * a malformed row. Fatal at startup.
 */
public class RuleDataException extends AdvisorException {

    public RuleDataException(String message) {
        super(message);
    }

    public RuleDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
