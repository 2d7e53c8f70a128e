package com.eveapi.client.dto;

import com.eveapi.client.parser.ResultValue;
import com.eveapi.client.service.core.EveApiResponse;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDateTime;

/**
 * Converted EVE API response as returned by the REST facade.
 *
 * @param method      method path that was called
 * @param result      converted document
 * @param rawXml      raw response body, only when requested
 * @param currentTime {@code eveapi.currentTime} parsed, when present
 * @param cachedUntil {@code eveapi.cachedUntil} parsed, when present
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EveApiResultResponse(
        String method,
        ResultValue.Node result,
        String rawXml,
        LocalDateTime currentTime,
        LocalDateTime cachedUntil
) {

    public static EveApiResultResponse of(final EveApiResponse response) {
        return new EveApiResultResponse(
                response.method().method(),
                response.result(),
                response.rawXml(),
                response.currentTime().orElse(null),
                response.cachedUntil().orElse(null));
    }
}
