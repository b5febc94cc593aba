package com.liquidity.backend.exception;

import java.util.Collection;

public class CircularDependencyException extends RuntimeException {
    public CircularDependencyException(Collection<String> engineIds) {
        super("Circular dependencies detected: " + String.join(", ", engineIds));
    }
}
