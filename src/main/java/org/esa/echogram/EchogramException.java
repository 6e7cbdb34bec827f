package org.esa.echogram;

/**
 * Thrown when the pings of one input file cannot be processed, e.g. because the
 * input is malformed. Processing of the affected file is abandoned.
 */
public class EchogramException extends RuntimeException {

    public EchogramException(String message) {
        super(message);
    }

    public EchogramException(String message, Throwable cause) {
        super(message, cause);
    }

    public EchogramException(Throwable cause) {
        super(cause);
    }
}
