package org.neuralchilli.festival.domain;

import java.util.Objects;

/**
 * Provenance of a dependency edge.
 */
public enum DependencyType {
    /**
     * Derived from task numbering inside a sequence
     */
    IMPLICIT("implicit"),

    /**
     * Declared reference within the same sequence
     */
    EXPLICIT("explicit"),

    /**
     * Declared reference to another sequence of the same phase
     */
    CROSS_SEQUENCE("cross_sequence"),

    /**
     * Declared reference into another phase
     */
    CROSS_PHASE("cross_phase");

    private final String wireValue;

    DependencyType(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    /**
     * Classify a declared reference by comparing where its endpoints live.
     */
    public static DependencyType classify(Task from, Task to) {
        if (Objects.equals(from.sequencePath(), to.sequencePath())) {
            return EXPLICIT;
        }
        if (Objects.equals(from.phasePath(), to.phasePath())) {
            return CROSS_SEQUENCE;
        }
        return CROSS_PHASE;
    }
}
