package com.funnelforge.core.exception;

public class ArmNotFoundException extends NotFoundException {

    private final String id;

    public ArmNotFoundException(String id) {
        super("Unknown arm: " + id);
        this.id = id;
    }

    public String id() {
        return id;
    }
}
