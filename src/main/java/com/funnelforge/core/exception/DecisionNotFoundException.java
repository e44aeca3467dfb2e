package com.funnelforge.core.exception;

public class DecisionNotFoundException extends NotFoundException {

    private final String id;

    public DecisionNotFoundException(String id) {
        super("Unknown spend decision: " + id);
        this.id = id;
    }

    public String id() {
        return id;
    }
}
