package com.aino.http;

import java.util.List;

/**
 * Thrown when a pipeline finishes without setting the status, headers and body of the response.
 * This is a wiring bug in the application, not a runtime condition.
 */
public class IncompleteResponseException extends IllegalStateException {
    private final List<String> missingFields;

    /**
     * Creates a new exception.
     *
     * @param missingFields the names of the response fields that were never set
     */
    public IncompleteResponseException(List<String> missingFields) {
        super("Context is missing required response fields - " + missingFields);
        this.missingFields = List.copyOf(missingFields);
    }

    public List<String> getMissingFields() {
        return missingFields;
    }
}
