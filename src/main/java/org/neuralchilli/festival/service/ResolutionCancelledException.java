package org.neuralchilli.festival.service;

/**
 * Thrown when the caller's cancellation signal is raised during a resolver pass.
 */
public class ResolutionCancelledException extends RuntimeException {

    public ResolutionCancelledException(String message) {
        super(message);
    }
}
