package com.lolanalyzer.riot.exception;

import java.net.URI;

/**
 * The upstream rejected our credential (401/403). Usually an expired or revoked API key.
 */
public class ApiUnauthorizedException extends RiotApiException {

    public ApiUnauthorizedException(URI uri, int status) {
        super("API key rejected with status " + status, uri, status);
    }
}
