package com.eveapi.client.common;

/**
 * A caller-supplied XML document could not be converted. Unlike the
 * {@link EveApiException} family, the fault lies with the request, not with
 * the upstream server.
 */
public class InvalidDocumentException extends RuntimeException {

    public InvalidDocumentException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
