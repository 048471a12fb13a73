package com.eainde.compatibility.batch;

/**
 * A batch was requested with inputs it cannot start from. Raised before any simulation runs.
 */
public class InvalidBatchRequestException extends IllegalArgumentException {

    public InvalidBatchRequestException(String message) {
        super(message);
    }
}
