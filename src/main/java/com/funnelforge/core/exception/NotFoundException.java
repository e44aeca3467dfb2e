package com.funnelforge.core.exception;

/**
 * Thrown when an arm, task, decision or approval request ID is unknown.
 */
public class NotFoundException extends FunnelException {
    public NotFoundException(String message) {
        super(message);
    }
}
