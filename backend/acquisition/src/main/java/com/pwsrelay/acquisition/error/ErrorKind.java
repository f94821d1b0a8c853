package com.pwsrelay.acquisition.error;

public enum ErrorKind {
    HTTP_ERROR,
    MALFORMED_RESPONSE,
    NO_OBSERVATIONS,
    API_ERROR,
    TIMEOUT,
    NOT_READY
}
