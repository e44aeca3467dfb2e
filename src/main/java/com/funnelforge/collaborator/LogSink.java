package com.funnelforge.collaborator;

import java.util.Map;

/**
 * Append-only automation log. The engine writes to it and never reads it back.
 */
public interface LogSink {

    void record(String type, String message, String status, Map<String, Object> metadata);
}
