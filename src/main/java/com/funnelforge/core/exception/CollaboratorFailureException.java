package com.funnelforge.core.exception;

/**
 * Wraps an error raised by an external collaborator (generator, renderer, publisher, ...).
 */
public class CollaboratorFailureException extends FunnelException {

    private final String collaborator;

    public CollaboratorFailureException(String collaborator, String message) {
        super(collaborator + " failed: " + message);
        this.collaborator = collaborator;
    }

    public CollaboratorFailureException(String collaborator, Throwable cause) {
        super(collaborator + " failed: " + cause.getMessage(), cause);
        this.collaborator = collaborator;
    }

    public String collaborator() {
        return collaborator;
    }
}
