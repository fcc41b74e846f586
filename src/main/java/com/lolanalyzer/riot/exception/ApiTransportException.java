package com.lolanalyzer.riot.exception;

import java.net.URI;

public class ApiTransportException extends RiotApiException {

    public ApiTransportException(String message, URI uri, Throwable cause) {
        super(message, uri, 0, cause);
    }
}
