package com.schemaops.core.exception;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a task graph cannot be ordered because of a dependency cycle.
 */
public class CircularDependencyException extends SchemaOpsException {

    public static final String ERROR_CODE = "CIRCULAR_DEPENDENCY";

    private final List<List<String>> cycles;

    public CircularDependencyException(List<List<String>> cycles) {
        super(ERROR_CODE, "Circular dependencies detected: " + describe(cycles));
        this.cycles = List.copyOf(cycles);
    }

    public CircularDependencyException(String message) {
        super(ERROR_CODE, message);
        this.cycles = List.of();
    }

    public List<List<String>> getCycles() {
        return cycles;
    }

    private static String describe(List<List<String>> cycles) {
        return cycles.stream()
            .map(cycle -> String.join(" -> ", cycle))
            .collect(Collectors.joining(", "));
    }
}
