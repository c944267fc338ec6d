package org.carball.litepilot.model.recommendation;

public enum IndexType {
    SINGLE,
    COMPOSITE,
    UNIQUE,
    PARTIAL
}
