package com.eveapi.client.service.core;

import org.apache.commons.lang3.StringUtils;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An arbitrary EVE API method.
 *
 * <p>For {@code new EveApiMethod("/api/CustomMethodName", "example.com")} called with
 * {@code {param1=value1, param2=value2}}, the request goes to
 * {@code https://example.com/api/CustomMethodName.xml.aspx?param1=value1&param2=value2}.</p>
 *
 * @param method  URL prefix of the method, e.g. {@code /account/Characters}
 * @param apiHome hostname of the EVE API server
 */
public record EveApiMethod(String method, String apiHome) {

    /** Host of the public EVE API server. */
    public static final String DEFAULT_API_HOST = "api.eveonline.com";

    private static final String SUFFIX = ".xml.aspx";

    public EveApiMethod {
        if (StringUtils.isBlank(method)) {
            throw new IllegalArgumentException("method must not be blank");
        }
        if (StringUtils.isBlank(apiHome)) {
            throw new IllegalArgumentException("apiHome must not be blank");
        }
    }

    public EveApiMethod(final String method) {
        this(method, DEFAULT_API_HOST);
    }

    /**
     * @return the same method on another server
     */
    public EveApiMethod withHost(final String host) {
        return new EveApiMethod(method, host);
    }

    /**
     * Composes the request path and query.
     *
     * <pre>
     * ACCOUNT_CHARACTERS.composeUrl({key=value})  → /account/Characters.xml.aspx?key=value
     * SERVER_STATUS.composeUrl({})                → /server/ServerStatus.xml.aspx
     * </pre>
     *
     * @param parameters query parameters, encoded in iteration order; values
     *                   are rendered with {@link String#valueOf(Object)}
     * @return path plus query string
     */
    public String composeUrl(final Map<String, ?> parameters) {
        if (parameters == null || parameters.isEmpty()) {
            return method + SUFFIX;
        }
        String query = parameters.entrySet().stream()
                .map(e -> encode(e.getKey()) + "=" + encode(String.valueOf(e.getValue())))
                .collect(Collectors.joining("&"));
        return method + SUFFIX + "?" + query;
    }

    /**
     * @param parameters query parameters
     * @param useHttps   {@code https} when {@code true}, {@code http} otherwise
     * @return absolute request URI on {@link #apiHome()}
     */
    public URI requestUri(final Map<String, ?> parameters, final boolean useHttps) {
        return URI.create((useHttps ? "https" : "http") + "://" + apiHome + composeUrl(parameters));
    }

    private static String encode(final String s) {
        return URLEncoder.encode(Objects.requireNonNull(s), StandardCharsets.UTF_8);
    }
}
