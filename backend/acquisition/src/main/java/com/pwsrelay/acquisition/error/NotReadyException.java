package com.pwsrelay.acquisition.error;

/**
 * Raised by the first refresh when no source produced data, so setup can abort or retry.
 */
public class NotReadyException extends AcquisitionException {
    public NotReadyException(String message) {
        super(ErrorKind.NOT_READY, message);
    }
}
