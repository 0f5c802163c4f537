package com.jay.insight.layer1_data;

/** An upstream source could not be read. Callers decide whether this is fatal. */
public class UpstreamDataException extends RuntimeException {

    public UpstreamDataException(String message) {
        super(message);
    }

    public UpstreamDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
