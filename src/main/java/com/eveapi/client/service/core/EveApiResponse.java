package com.eveapi.client.service.core;

import com.eveapi.client.parser.KeyPath;
import com.eveapi.client.parser.ResultValue;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Converted EVE API response.
 *
 * @param method the method that was called
 * @param result converted document, see {@link com.eveapi.client.parser.EveApiDocumentConverter}
 * @param rawXml response body as received, or {@code null} when it was not requested
 */
public record EveApiResponse(EveApiMethod method, ResultValue.Node result, String rawXml) {

    private static final KeyPath CURRENT_TIME = KeyPath.of("eveapi", "currentTime", "text");

    private static final KeyPath CACHED_UNTIL = KeyPath.of("eveapi", "cachedUntil", "text");

    public Optional<String> rawXmlIfPresent() {
        return Optional.ofNullable(rawXml);
    }

    /**
     * @return server time at which the response was generated; empty when missing or unreadable
     */
    public Optional<LocalDateTime> currentTime() {
        return result.text(CURRENT_TIME).flatMap(EveDateTimes::parseIfValid);
    }

    /**
     * @return time until which the server will answer the same request from its cache;
     * empty when missing or unreadable
     */
    public Optional<LocalDateTime> cachedUntil() {
        return result.text(CACHED_UNTIL).flatMap(EveDateTimes::parseIfValid);
    }
}
