package com.eveapi.client.common;

/**
 * No catalog entry exists under the requested method name.
 */
public class UnknownEveApiMethodException extends EveApiException {

    public UnknownEveApiMethodException(final String name) {
        super("No EVE API method named " + name);
    }
}
