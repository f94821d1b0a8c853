package com.pwsrelay.acquisition.error;

import java.util.List;

public class ApiErrorException extends AcquisitionException {
    private final List<String> messages;

    public ApiErrorException(String url, List<String> messages) {
        super(ErrorKind.API_ERROR, "Error from " + url + ": " + String.join("; ", messages));
        this.messages = List.copyOf(messages);
    }

    public List<String> messages() {
        return messages;
    }
}
