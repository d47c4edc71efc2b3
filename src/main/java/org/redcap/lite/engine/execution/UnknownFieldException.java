package org.redcap.lite.engine.execution;

import java.util.Set;

/**
 * Thrown when a predicate references fields that the dataset does not have.
 */
public class UnknownFieldException extends RuntimeException {

    private final Set<String> unknownFields;

    public UnknownFieldException(Set<String> unknownFields) {
        super("Unknown field(s): " + String.join(", ", unknownFields));
        this.unknownFields = Set.copyOf(unknownFields);
    }

    public Set<String> getUnknownFields() {
        return unknownFields;
    }
}
