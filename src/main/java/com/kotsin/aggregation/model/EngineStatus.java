package com.kotsin.aggregation.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Point-in-time view of a running engine.
 */
@Value
@Builder
public class EngineStatus {
    String status;
    long timestamp;
    int aggregationCount;
    int activeSessions;
    int trackedWindows;
    Map<String, Long> metrics;
}
