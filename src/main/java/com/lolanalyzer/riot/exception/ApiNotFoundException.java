package com.lolanalyzer.riot.exception;

import java.net.URI;

public class ApiNotFoundException extends RiotApiException {

    public ApiNotFoundException(URI uri) {
        super("Resource not found: " + uri.getPath(), uri, 404);
    }
}
