package com.eveapi.client.dto;

import java.util.Map;

/**
 * Request payload for calling one EVE API method through the REST facade.
 *
 * @param parameters    query parameters passed to the method, e.g. {@code keyID}, {@code vCode},
 *                      {@code characterID}; may be {@code null} or empty
 * @param includeRawXml also return the raw XML response body; defaults to {@code false}
 * @param useHttps      HTTPS instead of HTTP; {@code null} falls back to {@code eve.api.use-https}
 */
public record EveApiRequest(
        Map<String, String> parameters,
        Boolean includeRawXml,
        Boolean useHttps
) {

    public Map<String, String> parametersOrEmpty() {
        return parameters == null ? Map.of() : parameters;
    }

    public boolean rawXmlRequested() {
        return Boolean.TRUE.equals(includeRawXml);
    }
}
