package com.eveapi.client.common;

/**
 * Base type of every failure raised while fetching or converting an EVE API response.
 */
public class EveApiException extends RuntimeException {

    public EveApiException(final String message) {
        super(message);
    }

    public EveApiException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
