package com.dsync.controller;

/**
 * A webhook delivery of a handled event kind that lacks a field the sync needs.
 */
public class WebhookPayloadException extends RuntimeException {

    public WebhookPayloadException(String message) {
        super(message);
    }

    public WebhookPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
