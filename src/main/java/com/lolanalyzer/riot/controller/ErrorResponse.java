package com.lolanalyzer.riot.controller;

public record ErrorResponse(String message, int status, long timestamp) {}
