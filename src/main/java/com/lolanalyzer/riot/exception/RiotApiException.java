package com.lolanalyzer.riot.exception;

import lombok.Getter;

import java.net.URI;

/**
 * Base type of every failure raised while talking to the Riot API.
 */
@Getter
public abstract class RiotApiException extends RuntimeException {

    private final URI uri;
    private final int status;

    protected RiotApiException(String message, URI uri, int status) {
        super(message);
        this.uri = uri;
        this.status = status;
    }

    protected RiotApiException(String message, URI uri, int status, Throwable cause) {
        super(message, cause);
        this.uri = uri;
        this.status = status;
    }
}
