package com.chromatrace.core.trace;

/**
 * Thrown when a decoded trace lacks the aggregate color record, or the record
 * holds fewer values than there are variables.
 */
public class MissingDataException extends RuntimeException {
    public MissingDataException(String message) {
        super(message);
    }
}
