package com.eveapi.client.controller;

import com.eveapi.client.common.EveApiParseException;
import com.eveapi.client.common.InvalidDocumentException;
import com.eveapi.client.common.MalformedResponseException;
import com.eveapi.client.common.UnknownEveApiMethodException;
import com.eveapi.client.dto.EveApiMethodResponse;
import com.eveapi.client.dto.EveApiRequest;
import com.eveapi.client.dto.EveApiResultResponse;
import com.eveapi.client.parser.ResultValue;
import com.eveapi.client.service.EveApiClient;
import com.eveapi.client.service.core.EveApiMethod;
import com.eveapi.client.service.core.EveApiMethods;
import com.eveapi.client.service.core.EveApiResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller exposing the EVE API client.
 * <p>
 * Endpoints:
 * <ul>
 *   <li><code>GET /api/eve/methods</code> lists the method catalog;</li>
 *   <li><code>POST /api/eve/methods/{name}</code> calls one catalog method;</li>
 *   <li><code>POST /api/eve/convert</code> converts a posted XML document without network access.</li>
 * </ul>
 *
 * <h3>Example Request</h3>
 * <pre>{@code
 * POST /api/eve/methods/ACCOUNT_CHARACTERS
 * Content-Type: application/json
 *
 * {
 *   "parameters": {"keyID": "12345", "vCode": "67890"},
 *   "includeRawXml": false
 * }
 * }</pre>
 *
 * <h3>Example Response</h3>
 * <pre>{@code
 * {
 *   "method": "/account/Characters",
 *   "result": {"eveapi": {"attributes": {"version": "2"}, "result": {"characters": {...}}}},
 *   "currentTime": "2011-09-01T22:04:52",
 *   "cachedUntil": "2011-09-01T23:01:52"
 * }
 * }</pre>
 */
@RestController
@RequestMapping("/api/eve")
@RequiredArgsConstructor
public class EveApiController {

    private final EveApiClient client;

    /**
     * @return every catalog method in declaration order
     */
    @GetMapping(value = "/methods", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<EveApiMethodResponse> methods() {
        return EveApiMethods.all().entrySet().stream()
                .map(e -> EveApiMethodResponse.of(e.getKey(), e.getValue()))
                .toList();
    }

    /**
     * Calls the catalog method named {@code name}.
     *
     * @param name    catalog constant name, case-insensitive
     * @param request parameters and options; may be omitted
     * @return the converted response
     * @throws UnknownEveApiMethodException if the catalog has no such method
     */
    @PostMapping(value = "/methods/{name}",
            produces = MediaType.APPLICATION_JSON_VALUE)
    public EveApiResultResponse call(@PathVariable("name") final String name,
                                     @RequestBody(required = false) final EveApiRequest request) {
        EveApiMethod method = EveApiMethods.byName(name)
                .orElseThrow(() -> new UnknownEveApiMethodException(name));
        EveApiRequest req = request != null ? request : new EveApiRequest(null, null, null);

        EveApiResponse response = req.useHttps() == null
                ? client.send(method, req.parametersOrEmpty(), req.rawXmlRequested())
                : client.send(method, req.parametersOrEmpty(), req.rawXmlRequested(), req.useHttps());
        return EveApiResultResponse.of(response);
    }

    /**
     * Converts an EVE API XML document posted by the caller.
     *
     * @param xml complete XML document
     * @return the converted map
     * @throws InvalidDocumentException if the document is not well-formed or breaks the rowset structure
     */
    @PostMapping(value = "/convert",
            consumes = {MediaType.APPLICATION_XML_VALUE, MediaType.TEXT_XML_VALUE},
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResultValue.Node convert(@RequestBody final String xml) {
        try {
            return client.convert(xml);
        } catch (EveApiParseException | MalformedResponseException ex) {
            throw new InvalidDocumentException(ex.getMessage(), ex);
        }
    }
}
