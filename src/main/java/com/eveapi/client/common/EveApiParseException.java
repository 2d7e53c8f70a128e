package com.eveapi.client.common;

/**
 * The response body is not a well-formed XML document.
 */
public class EveApiParseException extends EveApiException {

    public EveApiParseException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
