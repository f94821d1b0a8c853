package com.pwsrelay.acquisition.error;

public class MalformedResponseException extends AcquisitionException {
    public MalformedResponseException(String message) {
        super(ErrorKind.MALFORMED_RESPONSE, message);
    }

    public MalformedResponseException(String message, Throwable cause) {
        super(ErrorKind.MALFORMED_RESPONSE, message, cause);
    }
}
