package com.agrilink.community.exception;

/**
 * Exception thrown when a status change is not allowed from the current status.
 *
 * @author AgriLink Team
 */
public class InvalidStateTransitionException extends RuntimeException {

    private final String currentStatus;
    private final String requestedStatus;

    public InvalidStateTransitionException(String resourceType, String currentStatus, String requestedStatus) {
        super(String.format("Cannot change %s status from %s to %s", resourceType, currentStatus, requestedStatus));
        this.currentStatus = currentStatus;
        this.requestedStatus = requestedStatus;
    }

    public String getCurrentStatus() {
        return currentStatus;
    }

    public String getRequestedStatus() {
        return requestedStatus;
    }
}
