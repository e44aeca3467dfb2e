package com.funnelforge.core.exception;

public class TaskNotFoundException extends NotFoundException {

    private final String id;

    public TaskNotFoundException(String id) {
        super("Unknown task: " + id);
        this.id = id;
    }

    public String id() {
        return id;
    }
}
