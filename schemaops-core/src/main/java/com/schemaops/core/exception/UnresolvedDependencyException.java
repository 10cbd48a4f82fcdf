package com.schemaops.core.exception;

import java.util.Map;
import java.util.Set;

/**
 * Thrown when tasks depend on ids that are not part of the graph.
 */
public class UnresolvedDependencyException extends SchemaOpsException {

    public static final String ERROR_CODE = "UNRESOLVED_DEPENDENCY";

    private final Map<String, Set<String>> unresolved;

    public UnresolvedDependencyException(Map<String, Set<String>> unresolved) {
        super(ERROR_CODE, "Unresolved task dependencies: " + unresolved);
        this.unresolved = Map.copyOf(unresolved);
    }

    /**
     * Missing dependency ids keyed by the task that references them.
     */
    public Map<String, Set<String>> getUnresolved() {
        return unresolved;
    }
}
