package com.pwsrelay.acquisition.error;

public class FetchTimeoutException extends AcquisitionException {
    public FetchTimeoutException(String message) {
        super(ErrorKind.TIMEOUT, message);
    }

    public FetchTimeoutException(String message, Throwable cause) {
        super(ErrorKind.TIMEOUT, message, cause);
    }
}
