package com.eveapi.client.dto;

import com.eveapi.client.service.core.EveApiMethod;

/**
 * One catalog entry.
 *
 * @param name    constant name, e.g. {@code SERVER_STATUS}
 * @param method  method path, e.g. {@code /server/ServerStatus}
 * @param apiHome host the method is bound to
 */
public record EveApiMethodResponse(String name, String method, String apiHome) {

    public static EveApiMethodResponse of(final String name, final EveApiMethod method) {
        return new EveApiMethodResponse(name, method.method(), method.apiHome());
    }
}
