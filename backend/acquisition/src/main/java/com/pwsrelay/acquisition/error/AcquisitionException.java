package com.pwsrelay.acquisition.error;

/**
 * Root of the classified failures raised while acquiring data from a source.
 */
public abstract class AcquisitionException extends RuntimeException {
    private final ErrorKind kind;

    protected AcquisitionException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected AcquisitionException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
