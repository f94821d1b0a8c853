package com.pwsrelay.acquisition.error;

public class HttpStatusException extends AcquisitionException {
    // Used when the request never produced a status line.
    public static final int TRANSPORT_FAILURE = -1;

    private final int status;

    public HttpStatusException(int status, String message) {
        super(ErrorKind.HTTP_ERROR, message);
        this.status = status;
    }

    public HttpStatusException(String message, Throwable cause) {
        super(ErrorKind.HTTP_ERROR, message, cause);
        this.status = TRANSPORT_FAILURE;
    }

    public int status() {
        return status;
    }
}
