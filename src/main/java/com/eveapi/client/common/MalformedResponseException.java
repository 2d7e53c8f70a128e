package com.eveapi.client.common;

/**
 * The response is well-formed XML but does not follow the EVE API document
 * structure, e.g. a {@code rowset} without its {@code key} or {@code name}
 * attribute.
 */
public class MalformedResponseException extends EveApiException {

    public MalformedResponseException(final String message) {
        super(message);
    }
}
