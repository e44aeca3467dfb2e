package com.funnelforge.core.exception;

/**
 * Base type for failures raised by the decision engine.
 */
public abstract class FunnelException extends RuntimeException {
    protected FunnelException(String message) {
        super(message);
    }

    protected FunnelException(String message, Throwable cause) {
        super(message, cause);
    }
}
