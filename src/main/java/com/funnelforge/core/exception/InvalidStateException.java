package com.funnelforge.core.exception;

/**
 * Thrown when an operation is attempted on a decision or task that is not in the status
 * the operation requires.
 */
public class InvalidStateException extends FunnelException {
    public InvalidStateException(String message) {
        super(message);
    }
}
