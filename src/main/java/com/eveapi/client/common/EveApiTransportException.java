package com.eveapi.client.common;

import lombok.Getter;

/**
 * The API server could not be reached, did not answer in time, or answered
 * with a non-2xx status.
 */
@Getter
public class EveApiTransportException extends EveApiException {

    /** HTTP status of the response, or {@code -1} when no response was received. */
    private final int statusCode;

    public EveApiTransportException(final String message, final Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public EveApiTransportException(final String message, final int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }
}
