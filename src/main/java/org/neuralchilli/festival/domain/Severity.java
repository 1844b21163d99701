package org.neuralchilli.festival.domain;

/**
 * How much a validation issue matters.
 */
public enum Severity {
    ERROR("error"),
    WARNING("warning");

    private final String wireValue;

    Severity(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }
}
