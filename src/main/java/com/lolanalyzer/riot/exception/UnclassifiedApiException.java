package com.lolanalyzer.riot.exception;

import lombok.Getter;

import java.net.URI;

@Getter
public class UnclassifiedApiException extends RiotApiException {

    private final String body;

    public UnclassifiedApiException(URI uri, int status, String body) {
        super("API error: " + status + " - " + body, uri, status);
        this.body = body;
    }

    public UnclassifiedApiException(String message, URI uri, int status, String body, Throwable cause) {
        super(message, uri, status, cause);
        this.body = body;
    }
}
