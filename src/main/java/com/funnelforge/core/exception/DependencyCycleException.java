package com.funnelforge.core.exception;

import java.util.List;

/**
 * Thrown when a dependency edge would make the task graph cyclic.
 */
public class DependencyCycleException extends FunnelException {

    private final List<String> cycle;

    public DependencyCycleException(List<String> cycle) {
        super("Dependency cycle: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> cycle() {
        return cycle;
    }
}
