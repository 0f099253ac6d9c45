package com.hvacintel.consumption.exception;

/**
 * Fatal condition of an estimation run: a failed external query, an unreadable
 * input file or an input file missing required columns.
 */
public class EstimationException extends RuntimeException {
    public EstimationException(String message) {
        super(message);
    }

    public EstimationException(String message, Throwable cause) {
        super(message, cause);
    }
}
