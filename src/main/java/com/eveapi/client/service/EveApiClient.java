package com.eveapi.client.service;

import com.eveapi.client.common.EveApiTransportException;
import com.eveapi.client.config.EveApiProperties;
import com.eveapi.client.parser.DocumentConverter;
import com.eveapi.client.parser.ResultValue;
import com.eveapi.client.parser.XmlDocumentReader;
import com.eveapi.client.service.core.EveApiMethod;
import com.eveapi.client.service.core.EveApiResponse;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * <h2>EveApiClient</h2>
 *
 * <p>Sends a request for an {@link EveApiMethod} and returns the converted response.</p>
 *
 * <ul>
 *   <li>One blocking HTTP(S) GET per call, on the shared pooled {@link WebClient}.</li>
 *   <li>Transport problems (connection refused, timeout, non-2xx, empty body)
 *       surface as {@link EveApiTransportException}.</li>
 *   <li>Malformed XML surfaces as {@link com.eveapi.client.common.EveApiParseException},
 *       documents that break the rowset contract as
 *       {@link com.eveapi.client.common.MalformedResponseException}.</li>
 * </ul>
 *
 * <pre>{@code
 * EveApiResponse rsp = client.send(EveApiMethods.EVE_CHARACTER_INFO, Map.of("characterID", 499939401));
 * rsp.result().text(KeyPath.parse("eveapi.result.race.text"));   // Optional[Gallente]
 * }</pre>
 */
@Slf4j
@Getter
@Service
public class EveApiClient {

    private final WebClient webClient;

    private final XmlDocumentReader reader;

    private final DocumentConverter converter;

    private final EveApiProperties props;

    public EveApiClient(final WebClient eveApiWebClient,
                        final XmlDocumentReader reader,
                        final DocumentConverter converter,
                        final EveApiProperties props) {
        this.webClient = eveApiWebClient;
        this.reader = reader;
        this.converter = converter;
        this.props = props;
    }

    /**
     * Sends the request over the configured scheme and drops the raw XML.
     *
     * @see #send(EveApiMethod, Map, boolean, boolean)
     */
    public EveApiResponse send(final EveApiMethod method, final Map<String, ?> parameters) {
        return send(method, parameters, false);
    }

    /**
     * Sends the request over the configured scheme.
     *
     * @see #send(EveApiMethod, Map, boolean, boolean)
     */
    public EveApiResponse send(final EveApiMethod method,
                               final Map<String, ?> parameters,
                               final boolean includeRawXml) {
        return send(method, parameters, includeRawXml, props.isUseHttps());
    }

    /**
     * Sends a request to the EVE API server and converts the response.
     *
     * @param method        API method; catalog methods are sent to {@code eve.api.host}
     * @param parameters    query parameters, may be empty
     * @param includeRawXml keep the response body in {@link EveApiResponse#rawXml()}
     * @param useHttps      HTTPS instead of HTTP
     * @return the converted response
     */
    public EveApiResponse send(final EveApiMethod method,
                               final Map<String, ?> parameters,
                               final boolean includeRawXml,
                               final boolean useHttps) {
        EveApiMethod target = resolveHost(method);
        URI uri = target.requestUri(parameters, useHttps);

        log.info("Sending request to EVE API ({}) server: {}", target.apiHome(), target.method());
        String body = fetch(uri, target);

        ResultValue.Node result = convert(body);
        log.debug("Converted {} into {} top-level entries", target.method(), result.size());
        return new EveApiResponse(target, result, includeRawXml ? body : null);
    }

    /**
     * Parses and converts an XML document without any network access.
     *
     * @param xml complete EVE API response document
     * @return converted document
     */
    public ResultValue.Node convert(final String xml) {
        return converter.convert(reader.read(xml));
    }

    /**
     * Catalog methods point at the public server; route them to the configured host instead.
     */
    private EveApiMethod resolveHost(final EveApiMethod method) {
        if (EveApiMethod.DEFAULT_API_HOST.equals(method.apiHome())
                && StringUtils.isNotBlank(props.getHost())
                && !props.getHost().equals(method.apiHome())) {
            return method.withHost(props.getHost());
        }
        return method;
    }

    private String fetch(final URI uri, final EveApiMethod method) {
        String body = webClient.get()
                .uri(uri)
                .accept(MediaType.APPLICATION_XML, MediaType.TEXT_XML)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(props.getResponseTimeout())
                .onErrorMap(WebClientResponseException.class, ex -> new EveApiTransportException(
                        "EVE API returned status " + ex.getStatusCode().value() + " for " + method.method(),
                        ex.getStatusCode().value()))
                .onErrorMap(WebClientRequestException.class, ex -> new EveApiTransportException(
                        "Failed to call EVE API " + method.method() + ": " + ex.getMessage(), ex))
                .onErrorMap(TimeoutException.class, ex -> new EveApiTransportException(
                        "EVE API did not answer " + method.method() + " within " + props.getResponseTimeout(), ex))
                .switchIfEmpty(Mono.error(() -> new EveApiTransportException(
                        "EVE API returned empty body for " + method.method(), 200)))
                .block();

        if (StringUtils.isBlank(body)) {
            throw new EveApiTransportException("EVE API returned empty body for " + method.method(), 200);
        }
        return body;
    }
}
