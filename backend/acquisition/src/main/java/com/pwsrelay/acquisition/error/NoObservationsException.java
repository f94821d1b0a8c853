package com.pwsrelay.acquisition.error;

public class NoObservationsException extends AcquisitionException {
    public NoObservationsException(String message) {
        super(ErrorKind.NO_OBSERVATIONS, message);
    }
}
